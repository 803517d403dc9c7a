package scaraplate.template;

import org.apache.commons.lang3.StringUtils;
import scaraplate.config.ConfigurationException;

import java.util.regex.Pattern;

public enum GitRemote {
    GITLAB("GitLab", "/commit/"),
    GITHUB("GitHub", "/commit/"),
    BITBUCKET("BitBucket", "/commits/");

    private static final String BUILT_IN_PREFIX = "scaraplate.gitremotes.";
    private static final Pattern SSH_PREFIX = Pattern.compile("^[^@]*@([^:]+):");
    private static final Pattern GIT_SUFFIX = Pattern.compile("\\.git$");

    private final String typeName;
    private final String commitPath;

    GitRemote(String typeName, String commitPath) {
        this.typeName = typeName;
        this.commitPath = commitPath;
    }

    public String typeName() {
        return typeName;
    }

    public static GitRemote detect(String remote) {
        for (GitRemote type : values()) {
            if (StringUtils.containsIgnoreCase(remote, type.typeName)) {
                return type;
            }
        }
        throw new ConfigurationException("Unable to determine the git remote type of `" + remote
                + "`, set `git_remote_type` in scaraplate.yaml");
    }

    public static GitRemote byName(String name) {
        String shortName = StringUtils.removeStart(name, BUILT_IN_PREFIX);
        for (GitRemote type : values()) {
            if (type.typeName.equals(shortName)) {
                return type;
            }
        }
        throw new ConfigurationException("git_remote_type: unknown git remote type `" + name + "`");
    }

    public String projectUrl(String remote) {
        String url = SSH_PREFIX.matcher(remote).replaceFirst("https://$1/");
        return GIT_SUFFIX.matcher(url).replaceFirst("");
    }

    public String commitUrl(String remote, String commitHash) {
        return StringUtils.stripEnd(projectUrl(remote), "/") + commitPath + commitHash;
    }

    public TemplateMeta describe(String remote, String commitHash, boolean dirty, String headRef) {
        return TemplateMeta.builder()
                .projectUrl(projectUrl(remote))
                .commitHash(commitHash)
                .commitUrl(commitUrl(remote, commitHash))
                .dirty(dirty)
                .headRef(headRef)
                .build();
    }
}
