package scaraplate.strategies;

import java.util.regex.Pattern;

public class SetupCfgMerge extends ConfigParserMerge {

    public SetupCfgMerge(MergeConfig config) {
        super(config);
    }

    public static SetupCfgMerge create(RawConfig raw) {
        if (raw.isEmpty()) {
            return new SetupCfgMerge(defaults("^.*$"));
        }
        if (raw.has("extras_prefix")) {
            raw.allowOnly("extras_prefix");
            String prefix = raw.string("extras_prefix", "");
            return new SetupCfgMerge(defaults("^" + Pattern.quote(prefix)));
        }
        return new SetupCfgMerge(MergeConfig.from(raw));
    }

    public static MergeConfig defaults(String extrasPattern) {
        return MergeConfig.builder()
                .mergeRequirement(KeyRule.of("^options$", "^install_requires$"))
                .mergeRequirement(KeyRule.of("^options\\.extras_require$", extrasPattern))
                .preserveKey(KeyRule.of("^tool:pytest$", "^testpaths$"))
                .preserveKey(KeyRule.of("^build$", "^executable$"))
                .preserveSection(SectionRule.of("^freebsd$"))
                .preserveSection(SectionRule.of("^infra\\."))
                .preserveSection(SectionRule.of("^mypy-"))
                .preserveSection(SectionRule.of("^options\\.data_files$"))
                .preserveSection(SectionRule.of("^options\\.entry_points$"))
                .build();
    }
}
