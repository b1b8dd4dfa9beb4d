package mc.supervisor.model;

import java.time.Instant;

public record BackupScheduleInfo(BackupCadence schedule, Instant lastBackup, Instant nextBackup) {
}
