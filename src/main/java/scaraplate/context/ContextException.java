package scaraplate.context;

import scaraplate.ScaraplateException;

public class ContextException extends ScaraplateException {

    public ContextException(String message) {
        super(message);
    }

    public ContextException(String message, Throwable cause) {
        super(message, cause);
    }
}
