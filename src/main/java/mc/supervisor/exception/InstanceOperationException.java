package mc.supervisor.exception;

/** An operation was accepted but failed while touching the filesystem, a process or the network. */
public class InstanceOperationException extends SupervisorException {

    public InstanceOperationException(String message) {
        super(message);
    }

    public InstanceOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
