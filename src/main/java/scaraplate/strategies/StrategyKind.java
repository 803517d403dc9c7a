package scaraplate.strategies;

import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public enum StrategyKind implements StrategyFactory {
    OVERWRITE("Overwrite", config -> noOptions(config, new Overwrite())),
    IF_MISSING("IfMissing", config -> noOptions(config, new IfMissing())),
    IGNORE("Ignore", config -> noOptions(config, new Ignore())),
    IF_NEW_PROJECT("IfNewProject", config -> noOptions(config, new IfNewProject())),
    TEMPLATE_HASH("TemplateHash", TemplateHash::create),
    SORTED_UNIQUE_LINES("SortedUniqueLines", SortedUniqueLines::create),
    CONFIG_PARSER_MERGE("ConfigParserMerge", ConfigParserMerge::create),
    SETUP_CFG_MERGE("SetupCfgMerge", SetupCfgMerge::create),
    PYLINTRC_MERGE("PylintrcMerge", PylintrcMerge::create);

    private final String strategyName;
    private final StrategyFactory factory;

    public String strategyName() {
        return strategyName;
    }

    @Override
    public Strategy create(RawConfig config) {
        return factory.create(config);
    }

    private static Strategy noOptions(RawConfig config, Strategy strategy) {
        config.allowOnly();
        return strategy;
    }
}
