package mc.supervisor.exception;

import mc.supervisor.model.InstanceStatus;

/** Operation not allowed in the instance's current lifecycle state. */
public class InstanceStateException extends SupervisorException {
    private final InstanceStatus status;

    public InstanceStateException(String message, InstanceStatus status) {
        super(message);
        this.status = status;
    }

    public InstanceStatus getStatus() {
        return status;
    }
}
