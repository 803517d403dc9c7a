package scaraplate.template;

import org.junit.jupiter.api.Test;
import scaraplate.config.ConfigurationException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class GitRemoteTest {

    private static final String HASH = "1111111111111111111111111111111111111111";

    @Test
    void detectsHostingFromRemote() {
        assertEquals(GitRemote.GITLAB, GitRemote.detect("git@gitlab.com:pycqa/flake8.git"));
        assertEquals(GitRemote.GITLAB, GitRemote.detect("https://gitlab.example.org/pycqa/flake8.git"));
        assertEquals(GitRemote.GITHUB, GitRemote.detect("git@github.com:geopy/geopy.git"));
        assertEquals(GitRemote.GITHUB, GitRemote.detect("https://GitHub.example.org/geopy/geopy.git"));
        assertEquals(GitRemote.BITBUCKET, GitRemote.detect("https://bitbucket.org/someuser/someproject.git"));
    }

    @Test
    void unknownHostingFails() {
        assertThrows(ConfigurationException.class, () -> GitRemote.detect("https://git.example.org/pycqa/flake8.git"));
    }

    @Test
    void resolvesTypeByName() {
        assertEquals(GitRemote.GITLAB, GitRemote.byName("GitLab"));
        assertEquals(GitRemote.BITBUCKET, GitRemote.byName("scaraplate.gitremotes.BitBucket"));
        assertThrows(ConfigurationException.class, () -> GitRemote.byName("Gitea"));
    }

    @Test
    void projectUrlFromSshAndHttpsRemotes() {
        assertEquals("https://gitlab.com/pycqa/flake8", GitRemote.GITLAB.projectUrl("git@gitlab.com:pycqa/flake8.git"));
        assertEquals("https://gitlab.com/pycqa/flake8", GitRemote.GITLAB.projectUrl("https://gitlab.com/pycqa/flake8.git"));
        assertEquals("https://gitlab.example.org/pycqa/flake8",
                GitRemote.GITLAB.projectUrl("git@gitlab.example.org:pycqa/flake8.git"));
        assertEquals("https://github.com/geopy/geopy", GitRemote.GITHUB.projectUrl("https://github.com/geopy/geopy"));
    }

    @Test
    void commitUrls() {
        assertEquals("https://gitlab.com/pycqa/flake8/commit/" + HASH,
                GitRemote.GITLAB.commitUrl("https://gitlab.com/pycqa/flake8.git", HASH));
        assertEquals("https://github.com/geopy/geopy/commit/" + HASH,
                GitRemote.GITHUB.commitUrl("git@github.com:geopy/geopy.git", HASH));
        assertEquals("https://bitbucket.org/someuser/someproject/commits/" + HASH,
                GitRemote.BITBUCKET.commitUrl("https://bitbucket.org/someuser/someproject/", HASH));
    }

    @Test
    void describesTemplateRevision() {
        TemplateMeta meta = GitRemote.GITLAB.describe("git@gitlab.com:pycqa/flake8.git", HASH, false, "master");

        assertEquals("https://gitlab.com/pycqa/flake8", meta.getProjectUrl());
        assertEquals("https://gitlab.com/pycqa/flake8/commit/" + HASH, meta.getCommitUrl());
        assertEquals(HASH, meta.getCommitHash());
        assertEquals("master", meta.getHeadRef());
        assertFalse(meta.isDirty());
    }
}
