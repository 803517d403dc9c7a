package scaraplate.strategies;

/**
 * Writes the template on the first rollup of a project only. Later rollups never touch
 * the file again, even when it has been removed from the target.
 */
public class IfNewProject implements Strategy {

    @Override
    public MergeResult apply(StrategyInput input) {
        if (input.isNewProject() && !input.hasTarget()) {
            return MergeResult.bytes(input.getTemplate());
        }
        return MergeResult.skip();
    }
}
