package mc.supervisor.exception;

/** Request was rejected before any state changed. */
public class InstanceValidationException extends SupervisorException {

    public InstanceValidationException(String message) {
        super(message);
    }
}
