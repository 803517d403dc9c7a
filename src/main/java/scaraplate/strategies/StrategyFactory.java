package scaraplate.strategies;

@FunctionalInterface
public interface StrategyFactory {

    Strategy create(RawConfig config);
}
