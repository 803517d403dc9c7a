package scaraplate.newline;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum NewlineStyle {
    LF("\n"),
    CRLF("\r\n");

    private final String separator;

    /**
     * Any paired terminator makes the text CRLF. Empty or terminator-free text is LF.
     */
    public static NewlineStyle detect(String text) {
        if (text == null || text.isEmpty()) {
            return LF;
        }
        return text.contains(CRLF.separator) ? CRLF : LF;
    }
}
