package scaraplate;

public class ScaraplateException extends RuntimeException {

    public ScaraplateException(String message) {
        super(message);
    }

    public ScaraplateException(String message, Throwable cause) {
        super(message, cause);
    }
}
