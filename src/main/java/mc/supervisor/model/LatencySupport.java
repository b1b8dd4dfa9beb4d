package mc.supervisor.model;

public record LatencySupport(boolean supported, String reason) {

    public static LatencySupport available() {
        return new LatencySupport(true, "");
    }

    public static LatencySupport unavailable(String reason) {
        return new LatencySupport(false, reason);
    }
}
