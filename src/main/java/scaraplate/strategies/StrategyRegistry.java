package scaraplate.strategies;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import scaraplate.config.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public class StrategyRegistry {

    private static final Logger logger = LogManager.getLogger(StrategyRegistry.class);

    static final String DEFAULT_PATTERN = "";

    private final List<StrategyBinding> bindings;
    private final StrategyBinding defaultBinding;

    private StrategyRegistry(List<StrategyBinding> bindings, StrategyBinding defaultBinding) {
        this.bindings = Collections.unmodifiableList(bindings);
        this.defaultBinding = defaultBinding;
    }

    public static Builder builder() {
        return new Builder(StrategyCatalog.builtIn());
    }

    public static Builder builder(StrategyCatalog catalog) {
        return new Builder(catalog);
    }

    public StrategyBinding resolve(String relativePath) {
        for (StrategyBinding binding : bindings) {
            if (binding.matches(relativePath)) {
                return binding;
            }
        }
        return defaultBinding;
    }

    public List<StrategyBinding> getBindings() {
        return bindings;
    }

    public StrategyBinding getDefaultBinding() {
        return defaultBinding;
    }

    public static final class Builder {

        private final StrategyCatalog catalog;
        private final List<StrategyBinding> bindings = new ArrayList<>();
        private StrategyBinding defaultBinding;

        private Builder(StrategyCatalog catalog) {
            this.catalog = catalog;
        }

        public Builder bind(String pattern, String strategyName) {
            return bind(pattern, strategyName, Collections.emptyMap());
        }

        public Builder bind(String pattern, String strategyName, Map<String, Object> config) {
            String owner = "strategies_mapping[" + pattern + "]";
            Pattern compiled = compile(owner, pattern);
            Strategy strategy = catalog.create(owner, strategyName, new RawConfig(owner, config));
            bindings.add(new StrategyBinding(compiled, strategyName, strategy));
            return this;
        }

        public Builder defaultStrategy(String strategyName, Map<String, Object> config) {
            String owner = "default_strategy";
            Strategy strategy = catalog.create(owner, strategyName, new RawConfig(owner, config));
            defaultBinding = new StrategyBinding(Pattern.compile(DEFAULT_PATTERN), strategyName, strategy);
            return this;
        }

        public StrategyRegistry build() {
            StrategyBinding fallback = defaultBinding;
            if (fallback == null) {
                fallback = new StrategyBinding(Pattern.compile(DEFAULT_PATTERN),
                        StrategyKind.OVERWRITE.strategyName(), new Overwrite());
            }
            logger.debug("Built strategy registry with {} bindings, default strategy {}",
                    bindings.size(), fallback.getStrategyName());
            return new StrategyRegistry(new ArrayList<>(bindings), fallback);
        }

        private static Pattern compile(String owner, String pattern) {
            try {
                return Pattern.compile(pattern);
            } catch (PatternSyntaxException e) {
                throw new ConfigurationException(owner + ": invalid path pattern", e);
            }
        }
    }
}
