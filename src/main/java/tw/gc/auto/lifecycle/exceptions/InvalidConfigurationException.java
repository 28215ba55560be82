package tw.gc.auto.lifecycle.exceptions;

public class InvalidConfigurationException extends LifecycleException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
