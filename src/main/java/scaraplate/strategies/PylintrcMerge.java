package scaraplate.strategies;

public class PylintrcMerge extends ConfigParserMerge {

    public static final MergeConfig DEFAULTS = MergeConfig.builder()
            .preserveKey(KeyRule.of("^MASTER$", "^extension-pkg-whitelist$"))
            .preserveKey(KeyRule.of("^TYPECHECK$", "^ignored-modules$"))
            .preserveKey(KeyRule.of("^TYPECHECK$", "^ignored-classes$"))
            .build();

    public PylintrcMerge(MergeConfig config) {
        super(config);
    }

    public static PylintrcMerge create(RawConfig raw) {
        if (raw.isEmpty()) {
            return new PylintrcMerge(DEFAULTS);
        }
        return new PylintrcMerge(MergeConfig.from(raw));
    }
}
