package scaraplate.strategies;

import lombok.Getter;
import scaraplate.parsers.LineDocument;
import scaraplate.parsers.LineItem;
import scaraplate.parsers.LineParser;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Combines the lines of the template and the target, keeps every distinct line once
 * and sorts them. Comment lines travel with the line below them.
 * <p>
 * The leading comment block (typically a license header) is taken from the template;
 * the target's block is used only when the template has none. Comments repeating a header
 * line are not emitted again above body lines.
 */
@Getter
public class SortedUniqueLines extends TextStrategy {

    public static final String DEFAULT_COMMENT_PATTERN = "^ *([;#%]|//)";

    private final Pattern commentPattern;

    public SortedUniqueLines(Pattern commentPattern) {
        this.commentPattern = commentPattern;
    }

    public static SortedUniqueLines create(RawConfig config) {
        config.allowOnly("comment_pattern");
        return new SortedUniqueLines(config.pattern("comment_pattern", DEFAULT_COMMENT_PATTERN));
    }

    @Override
    protected String merge(String template, String target, StrategyInput input) {
        LineDocument fromTemplate = LineParser.parse(template, commentPattern);
        LineDocument fromTarget = target == null ? null : LineParser.parse(target, commentPattern);

        LineDocument headerSource = fromTemplate;
        if (!fromTemplate.hasHeader() && fromTarget != null) {
            headerSource = fromTarget;
        }
        List<String> header = headerSource.getHeader();

        Map<String, Set<String>> body = new TreeMap<>();
        Set<String> orphans = new LinkedHashSet<>();
        collect(fromTemplate, body, orphans);
        if (fromTarget != null) {
            collect(fromTarget, body, orphans);
        }

        List<String> lines = new ArrayList<>(header);
        if (headerSource.isSeparated() && !(body.isEmpty() && orphans.isEmpty())) {
            lines.add("");
        }
        Set<String> headerLines = new LinkedHashSet<>(header);
        body.forEach((line, comments) -> {
            comments.stream().filter(c -> !headerLines.contains(c)).forEach(lines::add);
            lines.add(line);
        });
        lines.addAll(orphans);

        if (lines.isEmpty()) {
            return "";
        }
        StringJoiner out = new StringJoiner("\n", "", "\n");
        lines.forEach(out::add);
        return out.toString();
    }

    private static void collect(LineDocument document, Map<String, Set<String>> body, Set<String> orphans) {
        for (LineItem item : document.getItems()) {
            body.computeIfAbsent(item.getLine(), k -> new LinkedHashSet<>()).addAll(item.getComments());
        }
        orphans.addAll(document.getOrphans());
    }
}
