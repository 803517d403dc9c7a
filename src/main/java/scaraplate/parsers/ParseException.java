package scaraplate.parsers;

import lombok.Getter;
import scaraplate.ScaraplateException;

@Getter
public class ParseException extends ScaraplateException {

    private final String source;
    private final int lineNumber;

    public ParseException(String source, int lineNumber, String message) {
        super(String.format("%s, line %d: %s", source, lineNumber, message));
        this.source = source;
        this.lineNumber = lineNumber;
    }
}
