package scaraplate.strategies;

import scaraplate.newline.NewlineStyle;
import scaraplate.newline.Newlines;

public abstract class TextStrategy implements Strategy {

    @Override
    public MergeResult apply(StrategyInput input) {
        String template = input.templateText();
        String target = input.targetText();
        String merged = merge(template, target, input);
        if (merged == null) {
            return MergeResult.skip();
        }
        NewlineStyle style = Newlines.styleFor(template, target);
        return MergeResult.text(Newlines.normalize(merged, style));
    }

    protected abstract String merge(String template, String target, StrategyInput input);
}
