package mc.supervisor.service;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import mc.supervisor.dto.CloneInstanceRequest;
import mc.supervisor.dto.CreateInstanceRequest;
import mc.supervisor.dto.UpdateSettingsRequest;
import mc.supervisor.exception.InstanceOperationException;
import mc.supervisor.exception.InstanceStateException;
import mc.supervisor.exception.InstanceValidationException;
import mc.supervisor.model.InstanceConfig;
import mc.supervisor.model.InstanceInfo;
import mc.supervisor.model.InstanceStatus;
import mc.supervisor.model.ServerType;
import mc.supervisor.service.metrics.ServerCapabilities;
import mc.supervisor.service.server.GameVersion;
import mc.supervisor.service.server.InstallPipeline;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** Lifecycle-independent operations on managed instances: create, inspect, reconfigure, delete. */
@Slf4j
@Service
@RequiredArgsConstructor
public class InstanceService {
    static final List<String> WORLD_DIRS = List.of("world", "world_nether", "world_the_end");
    static final List<String> CONFIG_FILES = List.of(
            "server.properties", "bukkit.yml", "spigot.yml", "paper.yml", "paper-global.yml", "purpur.yml",
            "config", "banned-players.json", "banned-ips.json", "ops.json", "whitelist.json");

    private final InstanceRegistry registry;
    private final InstallPipeline installPipeline;
    private final ServerPropertiesService serverPropertiesService;
    private final ServerCapabilities capabilities;
    private final Validator validator;

    /** Registers the instance and starts installing it in the background. */
    public InstanceInfo create(CreateInstanceRequest request) {
        validate(request);
        ServerType type;
        try {
            type = ServerType.fromId(request.getType());
        } catch (IllegalArgumentException e) {
            throw new InstanceValidationException(e.getMessage());
        }

        InstanceConfig config = registry.register(InstanceConfig.builder()
                .name(request.getName().trim())
                .type(type)
                .version(request.getVersion() == null || request.getVersion().isBlank() ? "latest" : request.getVersion())
                .port(request.getPort())
                .minRam(request.getMinRam())
                .maxRam(request.getMaxRam())
                .maxPlayers(request.getMaxPlayers())
                .flags(request.getFlags())
                .alwaysPreTouch(request.isAlwaysPreTouch())
                .build());

        seedDirectory(config);
        installPipeline.install(config.getId(), config.getVersion());
        log.info("Created server {} ({} {})", config.getName(), type.id(), config.getVersion());
        return info(config.getId());
    }

    /**
     * Registers a new instance with the source's flavour, version and memory settings on another
     * port, copies the selected parts of the source directory into it and installs it.
     */
    public InstanceInfo cloneInstance(String sourceId, CloneInstanceRequest request) {
        validate(request);
        InstanceConfig source = registry.config(sourceId);
        InstanceConfig config = registry.register(InstanceConfig.builder()
                .name(request.getName().trim())
                .type(source.getType())
                .version(source.getVersion())
                .port(request.getPort())
                .minRam(source.getMinRam())
                .maxRam(source.getMaxRam())
                .maxPlayers(source.getMaxPlayers())
                .flags(source.getFlags())
                .alwaysPreTouch(source.isAlwaysPreTouch())
                .build());
        seedDirectory(config);

        Path sourceDir = Paths.get(source.getDir());
        Path dir = Paths.get(config.getDir());
        if (request.isCopyPlugins()) {
            copyEntries(sourceDir, dir, List.of("plugins"), config);
        }
        if (request.isCopyWorlds()) {
            copyEntries(sourceDir, dir, WORLD_DIRS, config);
        }
        if (request.isCopyConfig()) {
            copyEntries(sourceDir, dir, CONFIG_FILES, config);
            serverPropertiesService.updateProperties(dir, Map.of("server-port", String.valueOf(config.getPort())));
        }

        installPipeline.install(config.getId(), config.getVersion());
        log.info("Cloned server {} into {} on port {}", source.getName(), config.getName(), config.getPort());
        return info(config.getId());
    }

    public InstanceInfo info(String id) {
        InstanceConfig config = registry.config(id);
        InstanceRuntime runtime = registry.runtime(id);
        return toInfo(config, runtime);
    }

    public List<InstanceInfo> list() {
        List<InstanceInfo> infos = new ArrayList<>();
        for (InstanceConfig config : registry.configs()) {
            registry.findRuntime(config.getId()).ifPresent(runtime -> infos.add(toInfo(config, runtime)));
        }
        return infos;
    }

    public InstanceInfo rename(String id, String name) {
        String trimmed = name == null ? "" : name.trim();
        if (trimmed.isEmpty()) {
            throw new InstanceValidationException("server name cannot be empty");
        }
        InstanceConfig current = registry.config(id);
        Path oldBackups = registry.backupDirectory(current.getName());
        Path newBackups = registry.backupDirectory(trimmed);
        if (!oldBackups.equals(newBackups)) {
            migrateBackupDirectory(oldBackups, newBackups);
        }
        registry.update(id, config -> config.setName(trimmed));
        return info(id);
    }

    public InstanceInfo updateSettings(String id, UpdateSettingsRequest request) {
        validate(request);
        requireNotLive(id, "cannot change settings while server is running");
        InstanceConfig updated = registry.update(id, config -> {
            registry.requirePortFree(request.getPort(), id);
            config.setMinRam(request.getMinRam());
            config.setMaxRam(request.getMaxRam());
            config.setMaxPlayers(request.getMaxPlayers());
            config.setPort(request.getPort());
        });
        serverPropertiesService.updateProperties(Paths.get(updated.getDir()), Map.of(
                "max-players", String.valueOf(request.getMaxPlayers()),
                "server-port", String.valueOf(request.getPort())));
        return info(id);
    }

    public InstanceInfo setAutoStart(String id, boolean enabled) {
        registry.update(id, config -> config.setAutoStart(enabled));
        return info(id);
    }

    public InstanceInfo setFlags(String id, String flags, boolean alwaysPreTouch) {
        registry.update(id, config -> {
            config.setFlags(flags);
            config.setAlwaysPreTouch(alwaysPreTouch);
        });
        return info(id);
    }

    public void retryInstall(String id) {
        InstanceConfig config = registry.config(id);
        InstanceRuntime runtime = registry.runtime(id);
        try (LockHold ignored = runtime.getLock().write()) {
            if (runtime.getStatus() != InstanceStatus.ERROR) {
                throw new InstanceStateException("server " + id + " is not in error state (status: "
                        + runtime.getStatus().label() + ")", runtime.getStatus());
            }
            runtime.setStatus(InstanceStatus.INSTALLING);
            runtime.setInstallError(null);
        }
        installPipeline.install(id, config.getVersion());
    }

    public InstanceInfo updateVersion(String id, String version) {
        if (version == null || version.isBlank()) {
            throw new InstanceValidationException("version is required");
        }
        registry.config(id);
        InstanceRuntime runtime = registry.runtime(id);
        try (LockHold ignored = runtime.getLock().write()) {
            InstanceStatus status = runtime.getStatus();
            if (status == InstanceStatus.RUNNING) {
                throw new InstanceStateException("Can't update while server is running.", status);
            }
            if (status == InstanceStatus.BOOTING || status == InstanceStatus.INSTALLING) {
                throw new InstanceStateException("server is busy", status);
            }
            runtime.setStatus(InstanceStatus.INSTALLING);
            runtime.setInstallError(null);
        }
        installPipeline.install(id, version.trim());
        return info(id);
    }

    public List<GameVersion> getVersions(String type) {
        try {
            return installPipeline.getVersions(ServerType.fromId(type));
        } catch (IllegalArgumentException e) {
            throw new InstanceValidationException(e.getMessage());
        }
    }

    /** Deletes the instance with its working and backup directories. */
    public void delete(String id) {
        InstanceConfig config = registry.config(id);
        InstanceRuntime runtime = registry.remove(id, candidate -> {
            InstanceStatus status = candidate.getStatus();
            if (!status.isIdle()) {
                throw new InstanceStateException(
                        "cannot delete server " + id + " while it is " + status.label(), status);
            }
        });
        runtime.getConsole().closeAll();
        deleteRecursively(Paths.get(config.getDir()));
        deleteRecursively(registry.backupDirectory(config.getName()));
        log.info("Deleted server {} ({})", config.getName(), id);
    }

    private void seedDirectory(InstanceConfig config) {
        Path dir = Paths.get(config.getDir());
        try {
            if (!config.getType().isModded()) {
                Files.createDirectories(dir.resolve("plugins"));
            }
        } catch (IOException e) {
            log.warn("Could not create plugins directory for {}: {}", config.getName(), e.getMessage());
        }
        serverPropertiesService.writeInitialFiles(dir, config.getPort(), config.getMaxPlayers());
    }

    /** Copies each named entry that exists in {@code sourceDir}, replacing what the target already has. */
    private static void copyEntries(Path sourceDir, Path targetDir, List<String> names, InstanceConfig config) {
        for (String name : names) {
            Path source = sourceDir.resolve(name);
            if (!Files.exists(source)) {
                continue;
            }
            Path target = targetDir.resolve(name);
            try {
                deleteRecursively(target);
                copyRecursively(source, target);
            } catch (IOException e) {
                log.warn("Failed to copy {} into {}: {}", name, config.getName(), e.getMessage());
            }
        }
    }

    private static void copyRecursively(Path source, Path target) throws IOException {
        try (Stream<Path> walk = Files.walk(source)) {
            for (Path entry : walk.toList()) {
                Path destination = target.resolve(source.relativize(entry).toString());
                if (Files.isDirectory(entry)) {
                    Files.createDirectories(destination);
                } else {
                    Files.copy(entry, destination, StandardCopyOption.REPLACE_EXISTING);
                }
            }
        }
    }

    private void requireNotLive(String id, String message) {
        InstanceRuntime runtime = registry.runtime(id);
        try (LockHold ignored = runtime.getLock().read()) {
            if (runtime.getStatus().isLive()) {
                throw new InstanceStateException(message, runtime.getStatus());
            }
        }
    }

    private InstanceInfo toInfo(InstanceConfig config, InstanceRuntime runtime) {
        try (LockHold ignored = runtime.getLock().read()) {
            return InstanceInfo.builder()
                    .id(config.getId())
                    .name(config.getName())
                    .type(config.getType())
                    .version(config.getVersion())
                    .port(config.getPort())
                    .status(runtime.getStatus())
                    .cpu(runtime.getCpu())
                    .ramMb(runtime.getRamMb())
                    .tps(runtime.getTps())
                    .tpsAvailable(capabilities.tpsCommand(config) != null)
                    .minRam(config.getMinRam())
                    .maxRam(config.getMaxRam())
                    .maxPlayers(config.getMaxPlayers())
                    .players(runtime.getPlayers().size())
                    .pid(runtime.getPid())
                    .autoStart(config.isAutoStart())
                    .flags(config.getFlags())
                    .alwaysPreTouch(config.isAlwaysPreTouch())
                    .installError(runtime.getInstallError())
                    .restartAt(runtime.getRestartAt())
                    .dir(config.getDir())
                    .build();
        }
    }

    private <T> void validate(T request) {
        Set<ConstraintViolation<T>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            throw new InstanceValidationException(violations.stream()
                    .map(ConstraintViolation::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; ")));
        }
    }

    private void migrateBackupDirectory(Path oldDir, Path newDir) {
        if (!Files.isDirectory(oldDir)) {
            return;
        }
        try {
            if (!Files.exists(newDir)) {
                Files.createDirectories(newDir.getParent());
                Files.move(oldDir, newDir);
                return;
            }
            try (Stream<Path> entries = Files.list(oldDir)) {
                for (Path entry : entries.toList()) {
                    Files.move(entry, uniqueTarget(newDir, entry.getFileName().toString()));
                }
            }
            Files.deleteIfExists(oldDir);
        } catch (IOException e) {
            throw new InstanceOperationException("failed to move backup directory: " + e.getMessage(), e);
        }
    }

    private static Path uniqueTarget(Path dir, String name) {
        Path candidate = dir.resolve(name);
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        String extension = dot > 0 ? name.substring(dot) : "";
        for (int n = 1; Files.exists(candidate); n++) {
            candidate = dir.resolve(stem + "_" + n + extension);
        }
        return candidate;
    }

    private static void deleteRecursively(Path path) {
        if (!Files.exists(path)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(path)) {
            for (Path entry : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(entry);
            }
        } catch (IOException e) {
            log.warn("Failed to delete {}: {}", path, e.getMessage());
        }
    }
}
