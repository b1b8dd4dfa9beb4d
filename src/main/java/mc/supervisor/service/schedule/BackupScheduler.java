package mc.supervisor.service.schedule;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import mc.supervisor.model.BackupCadence;
import mc.supervisor.model.InstanceConfig;
import mc.supervisor.service.InstanceRegistry;
import mc.supervisor.service.backup.BackupService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Minute-level check for recurring backups that have come due. The archives themselves are written
 * on the worker pool, at most one at a time per instance.
 */
@Slf4j
@Service
public class BackupScheduler {
    private final InstanceRegistry registry;
    private final BackupService backupService;
    private final TaskExecutor executor;

    private final AtomicBoolean stopped = new AtomicBoolean();
    private final Set<String> running = ConcurrentHashMap.newKeySet();

    @Autowired
    public BackupScheduler(InstanceRegistry registry, BackupService backupService,
                           ThreadPoolTaskExecutor supervisorExecutor) {
        this(registry, backupService, (TaskExecutor) supervisorExecutor);
    }

    BackupScheduler(InstanceRegistry registry, BackupService backupService, TaskExecutor executor) {
        this.registry = registry;
        this.backupService = backupService;
        this.executor = executor;
    }

    @Scheduled(fixedRate = 60000, initialDelay = 60000)
    public void runDueBackups() {
        if (!stopped.get()) {
            tick(Instant.now());
        }
    }

    void tick(Instant now) {
        for (InstanceConfig config : registry.configs()) {
            BackupCadence cadence = config.getBackupSchedule();
            if (cadence == null) {
                continue;
            }
            Instant last = BackupService.parseStamp(config.getLastScheduledBackup());
            if (last == null) {
                log.debug("Server {} has schedule {} but no valid last backup time", config.getId(), cadence.id());
                continue;
            }
            if (!now.isAfter(cadence.next(last))) {
                continue;
            }
            if (!running.add(config.getId())) {
                log.debug("Scheduled backup of server {} is still running", config.getId());
                continue;
            }
            try {
                executor.execute(() -> runBackup(config, cadence, now));
            } catch (RuntimeException e) {
                running.remove(config.getId());
                log.error("Could not queue scheduled backup for server {}", config.getName(), e);
            }
        }
    }

    private void runBackup(InstanceConfig config, BackupCadence cadence, Instant now) {
        try {
            log.info("Running scheduled {} backup for server {}", cadence.id(), config.getName());
            backupService.createBackup(config.getId());
            registry.update(config.getId(), c -> c.setLastScheduledBackup(now.toString()));
        } catch (Exception e) {
            log.error("Scheduled backup failed for server {}", config.getName(), e);
        } finally {
            running.remove(config.getId());
        }
    }

    @PreDestroy
    public void stop() {
        if (stopped.compareAndSet(false, true)) {
            log.info("Backup scheduler stopped");
        }
    }
}
