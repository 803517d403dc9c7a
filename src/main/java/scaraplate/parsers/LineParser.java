package scaraplate.parsers;

import scaraplate.newline.Newlines;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits line-oriented files ({@code MANIFEST.in}, {@code .gitignore}) into a {@link LineDocument}.
 * <p>
 * The header is the leading run of comment lines, ending at the first blank or body line.
 */
public final class LineParser {

    private LineParser() {
    }

    public static LineDocument parse(String text, Pattern commentPattern) {
        List<String> lines = Newlines.lines(text);
        int i = 0;
        while (i < lines.size() && lines.get(i).isBlank()) {
            i++;
        }

        List<String> header = new ArrayList<>();
        while (i < lines.size() && isComment(lines.get(i), commentPattern)) {
            header.add(lines.get(i));
            i++;
        }
        boolean separated = !header.isEmpty() && i < lines.size() && lines.get(i).isBlank();

        List<String> pending = new ArrayList<>();

        List<LineItem> items = new ArrayList<>();
        for (; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            if (isComment(line, commentPattern)) {
                pending.add(line);
                continue;
            }
            items.add(new LineItem(line, new ArrayList<>(pending)));
            pending.clear();
        }
        return new LineDocument(header, separated, items, pending);
    }

    private static boolean isComment(String line, Pattern commentPattern) {
        return commentPattern.matcher(line).lookingAt();
    }
}
