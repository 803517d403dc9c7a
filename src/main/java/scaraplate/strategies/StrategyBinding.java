package scaraplate.strategies;

import lombok.Getter;
import lombok.ToString;

import java.util.regex.Pattern;

@Getter
@ToString(exclude = "strategy")
public class StrategyBinding {

    private final Pattern pattern;
    private final String strategyName;
    private final Strategy strategy;

    public StrategyBinding(Pattern pattern, String strategyName, Strategy strategy) {
        this.pattern = pattern;
        this.strategyName = strategyName;
        this.strategy = strategy;
    }

    /**
     * Patterns are not anchored: use {@code ^...$} for an exact match.
     */
    public boolean matches(String relativePath) {
        return pattern.matcher(relativePath).find();
    }
}
