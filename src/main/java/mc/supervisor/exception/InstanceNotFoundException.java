package mc.supervisor.exception;

public class InstanceNotFoundException extends InstanceValidationException {

    public InstanceNotFoundException(String id) {
        super("server " + id + " not found");
    }
}
