package scaraplate.strategies;

public class Overwrite implements Strategy {

    @Override
    public MergeResult apply(StrategyInput input) {
        return MergeResult.bytes(input.getTemplate());
    }
}
