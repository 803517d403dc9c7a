package scaraplate;

public class InvalidTemplateException extends ScaraplateException {

    public InvalidTemplateException(String message) {
        super(message);
    }
}
