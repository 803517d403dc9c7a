package scaraplate.parsers;

import org.apache.commons.lang3.StringUtils;
import scaraplate.newline.Newlines;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class SectionParser {

    private static final Pattern SECTION_PATTERN = Pattern.compile("^\\[([^\\]]*)]\\s*$");
    private static final String INDENT = "    ";
    private static final String LINE_SEPARATOR = "\n";

    private SectionParser() {
    }

    public static SectionDocument parse(String text, String source) {
        ParseContext ctx = new ParseContext(source);
        List<String> lines = Newlines.lines(text);
        for (int i = 0; i < lines.size(); i++) {
            ctx.onLine(lines.get(i), i + 1);
        }
        ctx.flush();
        return ctx.document;
    }

    public static String dump(SectionDocument document) {
        if (document.isEmpty()) {
            return "";
        }
        StringJoiner out = new StringJoiner(LINE_SEPARATOR + LINE_SEPARATOR, "", LINE_SEPARATOR);
        for (String name : new TreeSet<>(document.names())) {
            out.add(dumpSection(document.get(name)));
        }
        return out.toString();
    }

    private static String dumpSection(Section section) {
        StringJoiner out = new StringJoiner(LINE_SEPARATOR);
        out.add("[" + section.getName() + "]");
        for (String key : new TreeSet<>(section.keys())) {
            String value = section.get(key);
            if (Section.isList(value)) {
                out.add(key + " =");
                for (String item : Section.items(value)) {
                    out.add(INDENT + item);
                }
            } else if (value.isEmpty()) {
                out.add(key + " =");
            } else {
                out.add(key + " = " + value);
            }
        }
        return out.toString();
    }

    private static boolean isComment(String stripped) {
        return stripped.startsWith("#") || stripped.startsWith(";");
    }

    private static int indentOf(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }

    private static final class ParseContext {
        private final String source;
        private final SectionDocument document = new SectionDocument();
        private Section section;
        private String key;
        private int keyIndent;
        private final List<String> valueLines = new ArrayList<>();

        ParseContext(String source) {
            this.source = source;
        }

        void onLine(String line, int lineNumber) {
            String stripped = line.trim();
            if (stripped.isEmpty()) {
                return;
            }
            if (isComment(stripped)) {
                return;
            }

            int indent = indentOf(line);
            if (key != null && indent > keyIndent) {
                valueLines.add(stripped);
                return;
            }
            if (indent > 0 && key == null && section != null) {
                throw new ParseException(source, lineNumber, "continuation line without a key: " + stripped);
            }

            Matcher matcher = SECTION_PATTERN.matcher(stripped);
            if (indent == 0 && matcher.matches()) {
                flush();
                onSectionHeader(matcher.group(1).trim(), lineNumber);
                return;
            }

            flush();
            onKeyValue(stripped, indent, lineNumber);
        }

        private void onSectionHeader(String name, int lineNumber) {
            if (name.isEmpty()) {
                throw new ParseException(source, lineNumber, "empty section name");
            }
            if (document.has(name)) {
                throw new ParseException(source, lineNumber, "duplicate section [" + name + "]");
            }
            section = document.getOrCreate(name);
        }

        private void onKeyValue(String stripped, int indent, int lineNumber) {
            if (section == null) {
                throw new ParseException(source, lineNumber, "entry outside of a section: " + stripped);
            }
            int eq = stripped.indexOf('=');
            int colon = stripped.indexOf(':');
            int delimiter = eq < 0 ? colon : (colon < 0 ? eq : Math.min(eq, colon));
            if (delimiter <= 0) {
                throw new ParseException(source, lineNumber, "expected `key = value`, got: " + stripped);
            }
            String k = stripped.substring(0, delimiter).trim();
            if (section.has(k)) {
                throw new ParseException(source, lineNumber,
                        "duplicate key `" + k + "` in section [" + section.getName() + "]");
            }
            key = k;
            keyIndent = indent;
            valueLines.add(stripped.substring(delimiter + 1).trim());
        }

        void flush() {
            if (key == null) {
                return;
            }
            String value = String.join(LINE_SEPARATOR, valueLines);
            if (valueLines.size() > 1 && StringUtils.isBlank(valueLines.get(0))) {
                value = LINE_SEPARATOR + String.join(LINE_SEPARATOR, valueLines.subList(1, valueLines.size()));
            }
            section.put(key, value);
            key = null;
            valueLines.clear();
        }
    }
}
