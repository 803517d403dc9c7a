package scaraplate.strategies;

public interface Strategy {

    MergeResult apply(StrategyInput input);
}
