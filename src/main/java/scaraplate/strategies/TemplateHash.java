package scaraplate.strategies;

import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import scaraplate.newline.Newlines;
import scaraplate.template.TemplateMeta;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Appends the template commit to the written file as a comment footer, and skips the
 * file on later rollups for as long as the template commit stays the same.
 * <p>
 * Useful for files which have to diverge from the template but should be resynced
 * by hand whenever the template changes:
 * <pre>
 * ...file contents...
 *
 * # Generated by scaraplate
 * # From https://git.example.org/templates/python/commit/1111111111111111111111111111111111111111
 * </pre>
 */
@Getter
public class TemplateHash extends TextStrategy {

    static final String GENERATED_BY = "Generated by scaraplate";
    private static final String FROM = "From ";
    private static final String FROM_DIRTY = "From (dirty) ";

    private final String lineCommentStart;
    private final Integer maxLineLength;
    private final String maxLineLinterIgnoreMark;

    public TemplateHash(String lineCommentStart, Integer maxLineLength, String maxLineLinterIgnoreMark) {
        this.lineCommentStart = lineCommentStart;
        this.maxLineLength = maxLineLength;
        this.maxLineLinterIgnoreMark = maxLineLinterIgnoreMark;
    }

    public static TemplateHash create(RawConfig config) {
        config.allowOnly("line_comment_start", "max_line_length", "max_line_linter_ignore_mark");
        return new TemplateHash(
                config.string("line_comment_start", "#"),
                config.optionalInt("max_line_length", 10),
                config.string("max_line_linter_ignore_mark", "  # noqa"));
    }

    @Override
    protected String merge(String template, String target, StrategyInput input) {
        TemplateMeta meta = input.getTemplateMeta();
        Validate.validState(meta != null, "%s: TemplateHash requires template metadata", input.getPath());
        if (target != null && !meta.isDirty()) {
            Optional<String> recorded = recordedRevision(target);
            if (recorded.isPresent() && recorded.get().equals(meta.getCommitUrl())) {
                return null;
            }
        }
        return template + "\n" + footer(meta);
    }

    String footer(TemplateMeta meta) {
        List<String> lines = new ArrayList<>();
        lines.add(GENERATED_BY);
        lines.add((meta.isDirty() ? FROM_DIRTY : FROM) + meta.getCommitUrl());

        StringJoiner out = new StringJoiner("\n", "", "\n");
        for (String line : lines) {
            out.add(withLinterIgnore(lineCommentStart + " " + line));
        }
        return out.toString();
    }

    Optional<String> recordedRevision(String target) {
        List<String> lines = Newlines.lines(target);
        String prefix = lineCommentStart + " " + FROM;
        for (int i = lines.size() - 1; i > 0; i--) {
            String line = stripLinterIgnore(lines.get(i));
            String previous = lines.get(i - 1);
            if (line.startsWith(prefix) && previous.startsWith(lineCommentStart + " " + GENERATED_BY)) {
                return Optional.of(line.substring(prefix.length()).trim());
            }
        }
        return Optional.empty();
    }

    private String withLinterIgnore(String line) {
        if (maxLineLength != null && line.length() >= maxLineLength) {
            return line + maxLineLinterIgnoreMark;
        }
        return line;
    }

    private String stripLinterIgnore(String line) {
        return StringUtils.removeEnd(line, maxLineLinterIgnoreMark);
    }
}
