package mc.supervisor.service.server;

import lombok.extern.slf4j.Slf4j;
import mc.supervisor.exception.InstanceOperationException;
import mc.supervisor.exception.InstanceValidationException;
import mc.supervisor.model.InstanceConfig;
import mc.supervisor.model.InstanceStatus;
import mc.supervisor.model.ServerType;
import mc.supervisor.service.InstanceRegistry;
import mc.supervisor.service.InstanceRuntime;
import mc.supervisor.service.LockHold;
import mc.supervisor.service.console.ConsolePipeline;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Fetches and installs server artifacts in the background. The instance is
 * {@link InstanceStatus#INSTALLING} throughout and ends {@link InstanceStatus#STOPPED} or
 * {@link InstanceStatus#ERROR} with the cause recorded.
 */
@Slf4j
@Service
public class InstallPipeline {
    static final String PROGRESS_PREFIX = "[Installer] ";
    private static final String LATEST = "latest";

    private final InstanceRegistry registry;
    private final ArtifactProviderRegistry providers;
    private final VersionCache versionCache;
    private final ConsolePipeline consolePipeline;
    private final TaskExecutor executor;

    @Autowired
    public InstallPipeline(InstanceRegistry registry, ArtifactProviderRegistry providers, VersionCache versionCache,
                           ConsolePipeline consolePipeline, ThreadPoolTaskExecutor supervisorExecutor) {
        this(registry, providers, versionCache, consolePipeline, (TaskExecutor) supervisorExecutor);
    }

    InstallPipeline(InstanceRegistry registry, ArtifactProviderRegistry providers, VersionCache versionCache,
                    ConsolePipeline consolePipeline, TaskExecutor executor) {
        this.registry = registry;
        this.providers = providers;
        this.versionCache = versionCache;
        this.consolePipeline = consolePipeline;
        this.executor = executor;
    }

    public void install(String id, String version) {
        executor.execute(() -> runInstall(id, version));
    }

    /** Version list for a flavour, served from the cache when fresh. */
    public List<GameVersion> getVersions(ServerType type) {
        ArtifactProvider provider = providers.find(type)
                .orElseThrow(() -> new InstanceValidationException("unsupported server type: " + type.id()));
        try {
            return fetchVersions(type, provider);
        } catch (IOException e) {
            throw new InstanceOperationException("failed to fetch versions: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InstanceOperationException("interrupted while fetching versions", e);
        }
    }

    void runInstall(String id, String requestedVersion) {
        Optional<InstanceRuntime> found = registry.findRuntime(id);
        if (found.isEmpty()) {
            log.warn("Install skipped, server {} no longer exists", id);
            return;
        }
        InstanceRuntime runtime = found.get();
        InstanceConfig config = registry.config(id);
        Consumer<String> progress = message -> consolePipeline.publish(runtime, PROGRESS_PREFIX + message);

        Optional<ArtifactProvider> provider = providers.find(config.getType());
        if (provider.isEmpty()) {
            fail(runtime, config, "unsupported server type: " + config.getType().id(), null);
            return;
        }

        String version = requestedVersion;
        if (version == null || version.isBlank() || LATEST.equalsIgnoreCase(version.trim())) {
            try {
                version = resolveLatest(config.getType(), provider.get());
            } catch (IOException | RuntimeException e) {
                fail(runtime, config, "Failed to resolve latest version", e);
                return;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail(runtime, config, "Failed to resolve latest version", e);
                return;
            }
        }

        Path dir = Paths.get(config.getDir());
        try {
            Files.createDirectories(dir);
            progress.accept("Installing " + config.getType().id() + " " + version + "...");
            provider.get().install(version, dir, progress);
        } catch (IOException | RuntimeException e) {
            // a stale list may point at a build that is gone upstream
            versionCache.evict(config.getType());
            fail(runtime, config, "Download failed: " + e.getMessage(), e);
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(runtime, config, "Download failed: interrupted", e);
            return;
        }

        String installedVersion = version;
        boolean runScript = (config.getType() == ServerType.FORGE || config.getType() == ServerType.NEOFORGE)
                && Files.exists(dir.resolve("run.sh"));
        try {
            registry.update(id, c -> {
                c.setVersion(installedVersion);
                if (runScript) {
                    c.setStartCommand(List.of("bash", "run.sh", "nogui"));
                }
            });
        } catch (RuntimeException e) {
            fail(runtime, config, "failed to persist config: " + e.getMessage(), e);
            return;
        }

        try (LockHold ignored = runtime.getLock().write()) {
            runtime.setStatus(InstanceStatus.STOPPED);
            runtime.setInstallError(null);
        }
        String message = "Installation complete! " + config.getType().id() + " " + installedVersion + " is ready to start.";
        progress.accept(message);
        log.info("[{}] {}", config.getName(), message);
    }

    private String resolveLatest(ServerType type, ArtifactProvider provider) throws IOException, InterruptedException {
        List<GameVersion> versions = fetchVersions(type, provider);
        if (versions.isEmpty()) {
            throw new IOException("no versions available");
        }
        return versions.stream()
                .filter(GameVersion::latest)
                .findFirst()
                .orElse(versions.get(0))
                .version();
    }

    private List<GameVersion> fetchVersions(ServerType type, ArtifactProvider provider)
            throws IOException, InterruptedException {
        Optional<List<GameVersion>> cached = versionCache.get(type);
        if (cached.isPresent()) {
            return cached.get();
        }
        List<GameVersion> versions = provider.fetchVersions();
        versionCache.put(type, versions);
        return versions;
    }

    private void fail(InstanceRuntime runtime, InstanceConfig config, String cause, Exception e) {
        try (LockHold ignored = runtime.getLock().write()) {
            runtime.setStatus(InstanceStatus.ERROR);
            runtime.setInstallError(cause);
        }
        consolePipeline.publish(runtime, PROGRESS_PREFIX + cause);
        if (e != null) {
            log.error("[{}] Installation failed: {}", config.getName(), cause, e);
        } else {
            log.error("[{}] Installation failed: {}", config.getName(), cause);
        }
    }
}
