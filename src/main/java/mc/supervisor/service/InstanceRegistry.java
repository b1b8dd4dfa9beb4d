package mc.supervisor.service;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import mc.supervisor.config.SupervisorProperties;
import mc.supervisor.exception.InstanceNotFoundException;
import mc.supervisor.exception.InstanceOperationException;
import mc.supervisor.exception.InstanceValidationException;
import mc.supervisor.model.InstanceConfig;
import mc.supervisor.model.InstanceStatus;
import mc.supervisor.repository.InstanceConfigRepository;
import mc.supervisor.service.console.ConsoleBuffer;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * The set of managed instances: durable configs plus one {@link InstanceRuntime} each.
 * Structural changes and config writes happen under the {@link RegistryLock} and are persisted
 * before the lock is released.
 */
@Slf4j
@Service
public class InstanceRegistry {
    private final InstanceConfigRepository repository;
    private final SupervisorProperties properties;

    private final RegistryLock lock = new RegistryLock();
    private final Map<String, InstanceConfig> configs = new LinkedHashMap<>();
    private final Map<String, InstanceRuntime> runtimes = new LinkedHashMap<>();

    public InstanceRegistry(InstanceConfigRepository repository, SupervisorProperties properties) {
        this.repository = repository;
        this.properties = properties;
    }

    @PostConstruct
    public void load() {
        try (LockHold ignored = lock.write()) {
            configs.clear();
            runtimes.clear();
            for (InstanceConfig config : repository.loadAll()) {
                configs.put(config.getId(), config);
                runtimes.put(config.getId(), newRuntime(config.getId(), InstanceStatus.STOPPED));
            }
        }
    }

    /**
     * Adds a new instance in {@link InstanceStatus#INSTALLING}. Assigns the id and working
     * directory, rejects a port already claimed by another instance, and persists.
     */
    public InstanceConfig register(InstanceConfig draft) {
        try (LockHold ignored = lock.write()) {
            requirePortFree(draft.getPort(), null);

            String id = newId();
            InstanceConfig config = draft.copy();
            config.setId(id);
            Path dir = allocateDirectory(config.getName(), id);
            config.setDir(dir.toString());
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                throw new InstanceOperationException("failed to create server directory: " + e.getMessage(), e);
            }

            configs.put(id, config);
            runtimes.put(id, newRuntime(id, InstanceStatus.INSTALLING));
            try {
                repository.saveAll(configs.values());
            } catch (RuntimeException e) {
                configs.remove(id);
                runtimes.remove(id);
                throw e;
            }
            log.info("Registered server {} ({}) on port {}", config.getName(), id, config.getPort());
            return config.copy();
        }
    }

    /** Applies {@code mutation} to the stored config and persists it. */
    public InstanceConfig update(String id, Consumer<InstanceConfig> mutation) {
        try (LockHold ignored = lock.write()) {
            InstanceConfig config = requireConfig(id);
            InstanceConfig edited = config.copy();
            mutation.accept(edited);
            configs.put(id, edited);
            try {
                repository.saveAll(configs.values());
            } catch (RuntimeException e) {
                configs.put(id, config);
                throw e;
            }
            return edited.copy();
        }
    }

    /**
     * Removes the instance after {@code precondition} accepted its runtime. The precondition runs
     * with both the registry lock and the instance lock held and rejects by throwing.
     */
    public InstanceRuntime remove(String id, Consumer<InstanceRuntime> precondition) {
        try (LockHold ignored = lock.write()) {
            InstanceConfig removed = requireConfig(id);
            InstanceRuntime runtime = runtimes.get(id);
            try (LockHold held = runtime.getLock().write()) {
                precondition.accept(runtime);
            }
            configs.remove(id);
            runtimes.remove(id);
            try {
                repository.saveAll(configs.values());
            } catch (RuntimeException e) {
                configs.put(id, removed);
                runtimes.put(id, runtime);
                throw e;
            }
            return runtime;
        }
    }

    public InstanceConfig config(String id) {
        try (LockHold ignored = lock.read()) {
            return requireConfig(id).copy();
        }
    }

    public InstanceRuntime runtime(String id) {
        return findRuntime(id).orElseThrow(() -> new InstanceNotFoundException(id));
    }

    public Optional<InstanceRuntime> findRuntime(String id) {
        try (LockHold ignored = lock.read()) {
            return Optional.ofNullable(runtimes.get(id));
        }
    }

    public List<InstanceConfig> configs() {
        try (LockHold ignored = lock.read()) {
            List<InstanceConfig> copies = new ArrayList<>();
            configs.values().forEach(config -> copies.add(config.copy()));
            return copies;
        }
    }

    public List<InstanceRuntime> runtimes() {
        try (LockHold ignored = lock.read()) {
            return new ArrayList<>(runtimes.values());
        }
    }

    /** Fails if another instance (other than {@code excludeId}) already uses {@code port}. */
    public void requirePortFree(int port, String excludeId) {
        try (LockHold ignored = lock.read()) {
            for (InstanceConfig other : configs.values()) {
                if (other.getPort() == port && !other.getId().equals(excludeId)) {
                    throw new InstanceValidationException(
                            String.format("port %d is already in use by server %s", port, other.getName()));
                }
            }
        }
    }

    public static String sanitizeName(String name) {
        String sanitized = name == null ? "" : name.trim().replace(' ', '_').replaceAll("[^a-zA-Z0-9_\\-.]", "");
        if (sanitized.isEmpty() || sanitized.equals(".") || sanitized.equals("..")) {
            return "server";
        }
        return sanitized;
    }

    public Path backupDirectory(String name) {
        return properties.backupsPath().resolve(sanitizeName(name));
    }

    private Path allocateDirectory(String name, String id) {
        Path dir = properties.serversPath().resolve(sanitizeName(name));
        boolean claimed = configs.values().stream().anyMatch(other -> dir.toString().equals(other.getDir()));
        if (claimed || Files.exists(dir)) {
            return properties.serversPath().resolve(sanitizeName(name) + "_" + id);
        }
        return dir;
    }

    private String newId() {
        String id;
        do {
            id = UUID.randomUUID().toString().substring(0, 8);
        } while (configs.containsKey(id));
        return id;
    }

    private InstanceConfig requireConfig(String id) {
        InstanceConfig config = configs.get(id);
        if (config == null) {
            throw new InstanceNotFoundException(id);
        }
        return config;
    }

    private InstanceRuntime newRuntime(String id, InstanceStatus status) {
        SupervisorProperties.Console console = properties.getConsole();
        return new InstanceRuntime(id, status,
                new ConsoleBuffer(console.getMaxHistory(), console.getTrimSize(), console.getSubscriberCapacity()));
    }
}
