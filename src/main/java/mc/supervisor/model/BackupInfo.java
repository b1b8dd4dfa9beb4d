package mc.supervisor.model;

import java.time.Instant;

public record BackupInfo(String name, long size, Instant createdAt) {
}
