package scaraplate.newline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class Newlines {

    private Newlines() {
    }

    public static NewlineStyle styleFor(String template, String target) {
        if (target != null) {
            return NewlineStyle.detect(target);
        }
        return NewlineStyle.detect(template);
    }

    public static NewlineStyle styleFor(byte[] template, byte[] target) {
        byte[] source = target != null ? target : template;
        if (source == null) {
            return NewlineStyle.LF;
        }
        for (int i = 0; i + 1 < source.length; i++) {
            if (source[i] == '\r' && source[i + 1] == '\n') {
                return NewlineStyle.CRLF;
            }
        }
        return NewlineStyle.LF;
    }

    public static String normalize(String text, NewlineStyle style) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String lf = toLf(text);
        return style == NewlineStyle.LF ? lf : lf.replace("\n", style.getSeparator());
    }

    public static List<String> lines(String text) {
        if (text == null || text.isEmpty()) {
            return Collections.emptyList();
        }
        String[] arr = toLf(text).split("\n", -1);
        int len = arr.length;
        if (arr[len - 1].isEmpty()) {
            len--;
        }
        List<String> lines = new ArrayList<>(len);
        for (int i = 0; i < len; i++) {
            lines.add(arr[i]);
        }
        return lines;
    }

    private static String toLf(String s) {
        String x = s.replace("\r\n", "\n");
        return x.replace('\r', '\n');
    }
}
