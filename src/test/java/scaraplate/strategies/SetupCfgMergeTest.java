package scaraplate.strategies;

import org.junit.jupiter.api.Test;
import scaraplate.config.ConfigurationException;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SetupCfgMergeTest {

    private static final String CASES = "src/test/resources/strategies/setupcfg";

    private final Strategy strategy = SetupCfgMerge.create(RawConfig.empty("setup.cfg"));

    @Test
    void nonExistingTarget_commentsRemovedAndKeysSorted() throws Exception {
        assertCase("non_existing_target");
    }

    @Test
    void extraneousTargetSectionsAreKept() throws Exception {
        assertCase("extraneous_sections");
    }

    @Test
    void mypySectionsArePreserved() throws Exception {
        assertCase("mypy_sections");
    }

    @Test
    void requirementsWithoutTarget() throws Exception {
        assertCase("requirements_nonexisting_target");
    }

    @Test
    void requirementsUpdate_targetPinsWin() throws Exception {
        assertCase("requirements_update");
    }

    @Test
    void pytestTestpathsArePreserved() throws Exception {
        assertCase("pytest_testpaths");
    }

    @Test
    void freebsdSectionIsPreserved() throws Exception {
        assertCase("freebsd");
    }

    @Test
    void infraSectionIsPreserved() throws Exception {
        assertCase("infra_dependencies_updater");
    }

    @Test
    void crlfTargetKeepsCrlf() {
        String template = "[options]\ninstall_requires =\n  Black\n  isort==4.3\n";
        String target = "[options]\r\ninstall_requires =\r\n  aiohttp==4.3\r\n  isorT==1.3\r\n";

        String actual = apply(strategy, template, target);

        assertEquals("[options]\r\ninstall_requires =\r\n    aiohttp==4.3\r\n    Black\r\n    isorT==1.3\r\n", actual);
    }

    @Test
    void extrasPrefixNarrowsRequirementMerging() {
        Strategy narrowed = SetupCfgMerge.create(new RawConfig("setup.cfg", Map.of("extras_prefix", "dev")));
        String template = "[options.extras_require]\ndevelop =\n  pytest\ndocs =\n  sphinx\n";
        String target = "[options.extras_require]\ndevelop =\n  flask\ndocs =\n  mkdocs\n";

        String actual = apply(narrowed, template, target);

        assertEquals("[options.extras_require]\ndevelop =\n    flask\n    pytest\ndocs =\n    sphinx\n", actual);
    }

    @Test
    void explicitRulesReplaceDefaults() {
        Map<String, Object> config = Map.of(
                "merge_requirements", List.of(
                        Map.of("sections", "^options$", "keys", "^install_requires$"),
                        Map.of("sections", "^options\\.extras_require$", "keys", "^dev-")),
                "preserve_keys", List.of(),
                "preserve_sections", List.of());
        Strategy custom = SetupCfgMerge.create(new RawConfig("setup.cfg", config));
        String template = "[options]\ninstall_requires =\n  isort==4.3\n\n"
                + "[options.extras_require]\nnondev =\n  django\ndev-a =\n  pytest\ndev-b =\n  flake8\n";
        String target = "[options]\ninstall_requires =\n  aiohttp\n\n"
                + "[options.extras_require]\ndev-c =\n  flask\ndev-b =\n  isort\n";

        String actual = apply(custom, template, target);

        String expected = "[options]\ninstall_requires =\n    aiohttp\n    isort==4.3\n\n"
                + "[options.extras_require]\ndev-a =\n    pytest\ndev-b =\n    flake8\n    isort\n"
                + "dev-c =\n    flask\nnondev =\n    django\n";
        assertEquals(expected, actual);
    }

    @Test
    void invalidRulePatternFailsOnCreate() {
        Map<String, Object> config = Map.of("preserve_sections", List.of(Map.of("sections", "(")));
        assertThrows(ConfigurationException.class,
                () -> SetupCfgMerge.create(new RawConfig("setup.cfg", config)));
    }

    @Test
    void unknownRuleKeyFailsOnCreate() {
        Map<String, Object> config = Map.of("preserve_everything", List.of());
        assertThrows(ConfigurationException.class,
                () -> SetupCfgMerge.create(new RawConfig("setup.cfg", config)));
    }

    @Test
    void mergeIsAFixedPoint() throws Exception {
        for (String name : List.of("extraneous_sections", "mypy_sections", "requirements_update", "pytest_testpaths")) {
            String template = read(name, "template");
            String once = apply(strategy, template, read(name, "target"));
            String twice = apply(strategy, template, once);
            assertEquals(once, twice, name);
        }
    }

    @Test
    void mergeIsDeterministic() throws Exception {
        String template = read("requirements_update", "template");
        String target = read("requirements_update", "target");
        String first = apply(SetupCfgMerge.create(RawConfig.empty("a")), template, target);
        String second = apply(SetupCfgMerge.create(RawConfig.empty("b")), template, target);
        assertEquals(first, second);
    }

    @Test
    void targetOnlyPinnedRequirementSurvives() {
        String template = "[options]\ninstall_requires =\n  Black\n";
        String target = "[options]\ninstall_requires =\n  aiohttp==4.3\n";

        String actual = apply(strategy, template, target);

        assertTrue(actual.contains("    aiohttp==4.3\n"));
        assertTrue(actual.contains("    Black\n"));
        assertFalse(actual.contains("isort"));
    }

    private void assertCase(String name) throws Exception {
        Path target = Paths.get(CASES, name, "target");
        String targetText = Files.exists(target) ? read(name, "target") : null;
        String actual = apply(strategy, read(name, "template"), targetText);
        assertEquals(read(name, "expected"), actual, name);
    }

    private static String read(String name, String file) throws Exception {
        return Files.readString(Paths.get(CASES, name, file));
    }

    static String apply(Strategy strategy, String template, String target) {
        MergeResult result = strategy.apply(StrategyInput.builder()
                .path("setup.cfg")
                .template(template.getBytes(StandardCharsets.UTF_8))
                .target(target == null ? null : target.getBytes(StandardCharsets.UTF_8))
                .build());
        return result.asText();
    }
}
