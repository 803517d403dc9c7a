package scaraplate.strategies;

import scaraplate.config.ConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class StrategyCatalog {

    private static final String BUILT_IN_PREFIX = "scaraplate.strategies.";

    private final Map<String, StrategyFactory> factories;

    private StrategyCatalog(Map<String, StrategyFactory> factories) {
        this.factories = Collections.unmodifiableMap(factories);
    }

    public static StrategyCatalog builtIn() {
        Map<String, StrategyFactory> factories = new LinkedHashMap<>();
        for (StrategyKind kind : StrategyKind.values()) {
            factories.put(kind.strategyName(), kind);
            factories.put(BUILT_IN_PREFIX + kind.strategyName(), kind);
        }
        return new StrategyCatalog(factories);
    }

    public StrategyCatalog with(String name, StrategyFactory factory) {
        if (factories.containsKey(name)) {
            throw new ConfigurationException("Strategy `" + name + "` is already registered");
        }
        Map<String, StrategyFactory> copy = new LinkedHashMap<>(factories);
        copy.put(name, factory);
        return new StrategyCatalog(copy);
    }

    public boolean contains(String name) {
        return factories.containsKey(name);
    }

    public Strategy create(String owner, String name, RawConfig config) {
        StrategyFactory factory = factories.get(name);
        if (factory == null) {
            throw new ConfigurationException(owner + ": unknown strategy `" + name + "`");
        }
        return factory.create(config);
    }
}
