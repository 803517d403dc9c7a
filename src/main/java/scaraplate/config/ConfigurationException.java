package scaraplate.config;

import scaraplate.ScaraplateException;

public class ConfigurationException extends ScaraplateException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
