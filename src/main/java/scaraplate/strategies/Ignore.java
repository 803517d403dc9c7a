package scaraplate.strategies;

public class Ignore implements Strategy {

    @Override
    public MergeResult apply(StrategyInput input) {
        return MergeResult.skip();
    }
}
