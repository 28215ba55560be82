package tw.gc.auto.lifecycle.exceptions;

public class UnknownEntityException extends LifecycleException {

    public UnknownEntityException(String kind, String id) {
        super("Unknown " + kind + ": " + id);
    }
}
