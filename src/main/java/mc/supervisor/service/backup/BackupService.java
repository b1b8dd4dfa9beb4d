package mc.supervisor.service.backup;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import mc.supervisor.exception.InstanceOperationException;
import mc.supervisor.exception.InstanceStateException;
import mc.supervisor.exception.InstanceValidationException;
import mc.supervisor.model.BackupCadence;
import mc.supervisor.model.BackupInfo;
import mc.supervisor.model.BackupScheduleInfo;
import mc.supervisor.model.InstanceConfig;
import mc.supervisor.model.InstanceStatus;
import mc.supervisor.service.InstanceRegistry;
import mc.supervisor.service.InstanceRuntime;
import mc.supervisor.service.LockHold;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

/** Per-instance backup archives and their recurring schedule. */
@Slf4j
@Service
@RequiredArgsConstructor
public class BackupService {
    private static final DateTimeFormatter NAME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");

    private final InstanceRegistry registry;
    private final BackupArchiveService archiveService;

    public BackupInfo createBackup(String id) {
        InstanceConfig config = registry.config(id);
        Path backupDir = registry.backupDirectory(config.getName());
        String base = "backup_" + LocalDateTime.now().format(NAME_FORMAT);
        Path archive = backupDir.resolve(base + BackupArchiveService.ARCHIVE_EXTENSION);
        for (int n = 1; Files.exists(archive); n++) {
            archive = backupDir.resolve(base + "_" + n + BackupArchiveService.ARCHIVE_EXTENSION);
        }
        try {
            archiveService.create(Paths.get(config.getDir()), archive);
            return new BackupInfo(archive.getFileName().toString(), Files.size(archive),
                    Files.getLastModifiedTime(archive).toInstant());
        } catch (IOException e) {
            throw new InstanceOperationException("backup failed: " + e.getMessage(), e);
        }
    }

    public List<BackupInfo> listBackups(String id) {
        InstanceConfig config = registry.config(id);
        try {
            return archiveService.list(registry.backupDirectory(config.getName()));
        } catch (IOException e) {
            throw new InstanceOperationException("failed to list backups: " + e.getMessage(), e);
        }
    }

    public void deleteBackup(String id, String name) {
        Path archive = resolveArchive(registry.config(id), name);
        try {
            archiveService.delete(archive);
            log.info("Deleted backup {} of server {}", name, id);
        } catch (IOException e) {
            throw new InstanceOperationException("failed to delete backup: " + e.getMessage(), e);
        }
    }

    /** Replaces the working directory with the archive's contents; the server must not be running. */
    public void restoreBackup(String id, String name) {
        InstanceConfig config = registry.config(id);
        InstanceRuntime runtime = registry.runtime(id);
        Path archive = resolveArchive(config, name);
        try (LockHold ignored = runtime.getLock().read()) {
            InstanceStatus status = runtime.getStatus();
            if (!status.isIdle()) {
                throw new InstanceStateException("server must be stopped to restore a backup", status);
            }
        }
        try {
            archiveService.extract(archive, Paths.get(config.getDir()));
            log.info("Restored backup {} into server {}", name, id);
        } catch (IOException e) {
            throw new InstanceOperationException("restore failed: " + e.getMessage(), e);
        }
    }

    /** Sets or clears the cadence. A new cadence without a previous stamp starts counting now. */
    public BackupScheduleInfo setSchedule(String id, String schedule) {
        BackupCadence cadence;
        try {
            cadence = BackupCadence.fromId(schedule);
        } catch (IllegalArgumentException e) {
            throw new InstanceValidationException(e.getMessage());
        }
        InstanceConfig updated = registry.update(id, config -> {
            config.setBackupSchedule(cadence);
            if (cadence == null) {
                config.setLastScheduledBackup(null);
            } else if (config.getLastScheduledBackup() == null || config.getLastScheduledBackup().isBlank()) {
                config.setLastScheduledBackup(Instant.now().toString());
            }
        });
        return describe(updated);
    }

    public BackupScheduleInfo getSchedule(String id) {
        return describe(registry.config(id));
    }

    public static Instant parseStamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private BackupScheduleInfo describe(InstanceConfig config) {
        Instant last = parseStamp(config.getLastScheduledBackup());
        BackupCadence cadence = config.getBackupSchedule();
        Instant next = cadence != null && last != null ? cadence.next(last) : null;
        return new BackupScheduleInfo(cadence, last, next);
    }

    private Path resolveArchive(InstanceConfig config, String name) {
        if (name == null || name.isBlank() || name.contains("/") || name.contains("\\") || name.contains("..")
                || !name.endsWith(BackupArchiveService.ARCHIVE_EXTENSION)) {
            throw new InstanceValidationException("invalid backup name: " + name);
        }
        Path archive = registry.backupDirectory(config.getName()).resolve(name);
        if (!Files.isRegularFile(archive)) {
            throw new InstanceValidationException("backup " + name + " not found");
        }
        return archive;
    }
}
