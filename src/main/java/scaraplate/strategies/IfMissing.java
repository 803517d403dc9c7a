package scaraplate.strategies;

public class IfMissing implements Strategy {

    @Override
    public MergeResult apply(StrategyInput input) {
        if (input.hasTarget()) {
            return MergeResult.bytes(input.getTarget());
        }
        return MergeResult.bytes(input.getTemplate());
    }
}
