package mc.supervisor.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum InstanceStatus {
    INSTALLING("Installing"),
    STOPPED("Stopped"),
    BOOTING("Booting"),
    RUNNING("Running"),
    CRASHED("Crashed"),
    ERROR("Error");

    private final String label;

    InstanceStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean isLive() {
        return this == RUNNING || this == BOOTING;
    }

    /** States in which the working directory may be modified or removed. */
    public boolean isIdle() {
        return this == STOPPED || this == CRASHED || this == ERROR;
    }
}
