package mc.supervisor.exception;

/** Base type for failures reported by supervisor operations. */
public class SupervisorException extends RuntimeException {

    public SupervisorException(String message) {
        super(message);
    }

    public SupervisorException(String message, Throwable cause) {
        super(message, cause);
    }
}
