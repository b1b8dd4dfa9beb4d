package mc.supervisor.model;

import java.time.Instant;

public record CrashReport(String name, long size, Instant modifiedAt, String cause) {
}
