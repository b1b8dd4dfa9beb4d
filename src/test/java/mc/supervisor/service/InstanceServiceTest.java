package mc.supervisor.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import mc.supervisor.config.SupervisorProperties;
import mc.supervisor.dto.CloneInstanceRequest;
import mc.supervisor.dto.CreateInstanceRequest;
import mc.supervisor.dto.UpdateSettingsRequest;
import mc.supervisor.exception.InstanceStateException;
import mc.supervisor.exception.InstanceValidationException;
import mc.supervisor.model.InstanceInfo;
import mc.supervisor.model.InstanceStatus;
import mc.supervisor.repository.InstanceConfigRepository;
import mc.supervisor.service.console.ConsoleSubscription;
import mc.supervisor.service.metrics.ServerCapabilities;
import mc.supervisor.service.server.InstallPipeline;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class InstanceServiceTest {

    @TempDir
    Path tempDir;

    private ValidatorFactory validatorFactory;
    private InstanceRegistry registry;
    private InstallPipeline installPipeline;
    private ServerPropertiesService serverPropertiesService;
    private InstanceService service;

    @BeforeEach
    void setUp() {
        SupervisorProperties properties = new SupervisorProperties();
        properties.setBaseDir(tempDir.toString());
        registry = new InstanceRegistry(new InstanceConfigRepository(new ObjectMapper(), properties), properties);
        registry.load();
        installPipeline = mock(InstallPipeline.class);
        serverPropertiesService = new ServerPropertiesService();
        validatorFactory = Validation.buildDefaultValidatorFactory();
        service = new InstanceService(registry, installPipeline, serverPropertiesService, new ServerCapabilities(),
                validatorFactory.getValidator());
    }

    @AfterEach
    void tearDown() {
        validatorFactory.close();
    }

    @Test
    void createSeedsDirectoryAndStartsInstall() throws Exception {
        InstanceInfo info = service.create(request("Survival", "paper", 25565));

        Path dir = Paths.get(info.getDir());
        assertThat(info.getStatus()).isEqualTo(InstanceStatus.INSTALLING);
        assertThat(Files.readString(dir.resolve("eula.txt"))).isEqualTo("eula=true\n");
        assertThat(dir.resolve("plugins")).isDirectory();
        assertThat(Files.readAllLines(dir.resolve("server.properties")))
                .contains("server-port=25565", "max-players=20");
        verify(installPipeline).install(info.getId(), "latest");
    }

    @Test
    void moddedServersGetNoPluginsDirectory() {
        InstanceInfo info = service.create(request("Modpack", "fabric", 25565));

        assertThat(Paths.get(info.getDir()).resolve("plugins")).doesNotExist();
    }

    @Test
    void createRejectsInvalidInput() {
        assertThatThrownBy(() -> service.create(request(" ", "paper", 25565)))
                .isInstanceOf(InstanceValidationException.class)
                .hasMessageContaining("Name cannot be empty");
        assertThatThrownBy(() -> service.create(request("Lobby", "bukkit", 25565)))
                .isInstanceOf(InstanceValidationException.class)
                .hasMessage("Unknown server type: bukkit");
        assertThatThrownBy(() -> service.create(request("Lobby", "paper", 80)))
                .isInstanceOf(InstanceValidationException.class)
                .hasMessageContaining("Port must be between");

        assertThat(registry.configs()).isEmpty();
        verify(installPipeline, never()).install(anyString(), anyString());
    }

    @Test
    void settingsCannotChangeWhileLive() {
        InstanceInfo info = service.create(request("Survival", "paper", 25565));
        setStatus(info.getId(), InstanceStatus.RUNNING);

        assertThatThrownBy(() -> service.updateSettings(info.getId(), settings(25570)))
                .isInstanceOf(InstanceStateException.class)
                .hasMessage("cannot change settings while server is running");
    }

    @Test
    void settingsUpdateRewritesServerProperties() throws Exception {
        InstanceInfo info = service.create(request("Survival", "paper", 25565));
        setStatus(info.getId(), InstanceStatus.STOPPED);

        InstanceInfo updated = service.updateSettings(info.getId(), settings(25570));

        assertThat(updated.getPort()).isEqualTo(25570);
        assertThat(updated.getMaxRam()).isEqualTo("4G");
        assertThat(Files.readAllLines(Paths.get(info.getDir()).resolve("server.properties")))
                .contains("server-port=25570", "max-players=50");
    }

    @Test
    void settingsUpdateRejectsPortOfAnotherServer() {
        InstanceInfo first = service.create(request("Survival", "paper", 25565));
        service.create(request("Creative", "paper", 25570));
        setStatus(first.getId(), InstanceStatus.STOPPED);

        assertThatThrownBy(() -> service.updateSettings(first.getId(), settings(25570)))
                .isInstanceOf(InstanceValidationException.class)
                .hasMessage("port 25570 is already in use by server Creative");
        assertThat(registry.config(first.getId()).getPort()).isEqualTo(25565);
    }

    @Test
    void renameMovesBackupDirectory() throws Exception {
        InstanceInfo info = service.create(request("Survival", "paper", 25565));
        Path oldBackups = registry.backupDirectory("Survival");
        Files.createDirectories(oldBackups);
        Files.writeString(oldBackups.resolve("backup_2024-01-01_00-00-00.zip"), "zip");

        InstanceInfo renamed = service.rename(info.getId(), "  Hardcore  ");

        assertThat(renamed.getName()).isEqualTo("Hardcore");
        assertThat(oldBackups).doesNotExist();
        assertThat(registry.backupDirectory("Hardcore").resolve("backup_2024-01-01_00-00-00.zip")).exists();
        assertThatThrownBy(() -> service.rename(info.getId(), "   "))
                .isInstanceOf(InstanceValidationException.class)
                .hasMessage("server name cannot be empty");
    }

    @Test
    void updateVersionChecksState() {
        InstanceInfo info = service.create(request("Survival", "paper", 25565));

        assertThatThrownBy(() -> service.updateVersion(info.getId(), ""))
                .isInstanceOf(InstanceValidationException.class)
                .hasMessage("version is required");
        assertThatThrownBy(() -> service.updateVersion(info.getId(), "1.21"))
                .isInstanceOf(InstanceStateException.class)
                .hasMessage("server is busy");

        setStatus(info.getId(), InstanceStatus.RUNNING);
        assertThatThrownBy(() -> service.updateVersion(info.getId(), "1.21"))
                .isInstanceOf(InstanceStateException.class)
                .hasMessage("Can't update while server is running.");

        setStatus(info.getId(), InstanceStatus.STOPPED);
        assertThat(service.updateVersion(info.getId(), "1.21").getStatus()).isEqualTo(InstanceStatus.INSTALLING);
        verify(installPipeline).install(info.getId(), "1.21");
    }

    @Test
    void retryInstallOnlyFromError() {
        InstanceInfo info = service.create(request("Survival", "paper", 25565));
        setStatus(info.getId(), InstanceStatus.STOPPED);

        assertThatThrownBy(() -> service.retryInstall(info.getId()))
                .isInstanceOf(InstanceStateException.class)
                .hasMessage("server " + info.getId() + " is not in error state (status: Stopped)");

        InstanceRuntime runtime = registry.runtime(info.getId());
        try (LockHold ignored = runtime.getLock().write()) {
            runtime.setStatus(InstanceStatus.ERROR);
            runtime.setInstallError("Download failed: timeout");
        }
        service.retryInstall(info.getId());

        InstanceInfo retried = service.info(info.getId());
        assertThat(retried.getStatus()).isEqualTo(InstanceStatus.INSTALLING);
        assertThat(retried.getInstallError()).isNull();
    }

    @Test
    void deleteRefusesLiveServers() {
        InstanceInfo info = service.create(request("Survival", "paper", 25565));
        setStatus(info.getId(), InstanceStatus.BOOTING);

        assertThatThrownBy(() -> service.delete(info.getId()))
                .isInstanceOf(InstanceStateException.class)
                .hasMessage("cannot delete server " + info.getId() + " while it is Booting");
        assertThat(Paths.get(info.getDir())).isDirectory();
    }

    @Test
    void deleteRemovesFilesAndClosesViewers() throws Exception {
        InstanceInfo info = service.create(request("Survival", "paper", 25565));
        setStatus(info.getId(), InstanceStatus.STOPPED);
        Path backups = registry.backupDirectory("Survival");
        Files.createDirectories(backups);
        ConsoleSubscription viewer;
        InstanceRuntime runtime = registry.runtime(info.getId());
        try (LockHold ignored = runtime.getLock().write()) {
            viewer = runtime.getConsole().subscribe(0);
        }

        service.delete(info.getId());

        assertThat(Paths.get(info.getDir())).doesNotExist();
        assertThat(backups).doesNotExist();
        assertThat(viewer.isClosed()).isTrue();
        assertThat(service.list()).isEmpty();
    }

    @Test
    void cloneCopiesSelectedPartsOntoTheNewPort() throws Exception {
        InstanceInfo source = service.create(request("Survival", "paper", 25565));
        Path sourceDir = Paths.get(source.getDir());
        Files.writeString(sourceDir.resolve("plugins").resolve("Essentials.jar"), "jar");
        Files.createDirectories(sourceDir.resolve("world").resolve("region"));
        Files.writeString(sourceDir.resolve("world").resolve("region").resolve("r.0.0.mca"), "chunks");
        Files.writeString(sourceDir.resolve("ops.json"), "[]");
        Files.writeString(sourceDir.resolve("server.properties"), "motd=Survival\nserver-port=25565\n");

        InstanceInfo clone = service.cloneInstance(source.getId(), CloneInstanceRequest.builder()
                .name("Survival Copy")
                .port(25570)
                .copyPlugins(true)
                .copyWorlds(true)
                .copyConfig(true)
                .build());

        Path dir = Paths.get(clone.getDir());
        assertThat(clone.getType()).isEqualTo(source.getType());
        assertThat(clone.getStatus()).isEqualTo(InstanceStatus.INSTALLING);
        assertThat(dir.resolve("plugins").resolve("Essentials.jar")).hasContent("jar");
        assertThat(dir.resolve("world").resolve("region").resolve("r.0.0.mca")).hasContent("chunks");
        assertThat(dir.resolve("ops.json")).exists();
        assertThat(Files.readAllLines(dir.resolve("server.properties")))
                .containsExactly("motd=Survival", "server-port=25570");
        verify(installPipeline).install(clone.getId(), "latest");
    }

    @Test
    void cloneWithoutCopiesStartsFromFreshFiles() throws Exception {
        InstanceInfo source = service.create(request("Survival", "paper", 25565));
        Files.writeString(Paths.get(source.getDir()).resolve("plugins").resolve("Essentials.jar"), "jar");

        InstanceInfo clone = service.cloneInstance(source.getId(), CloneInstanceRequest.builder()
                .name("Fresh")
                .port(25570)
                .build());

        Path dir = Paths.get(clone.getDir());
        assertThat(dir.resolve("plugins")).isEmptyDirectory();
        assertThat(Files.readAllLines(dir.resolve("server.properties"))).contains("server-port=25570");
    }

    @Test
    void cloneRejectsAPortInUse() {
        InstanceInfo source = service.create(request("Survival", "paper", 25565));

        assertThatThrownBy(() -> service.cloneInstance(source.getId(), CloneInstanceRequest.builder()
                .name("Copy")
                .port(25565)
                .build()))
                .isInstanceOf(InstanceValidationException.class)
                .hasMessage("port 25565 is already in use by server Survival");
        assertThatThrownBy(() -> service.cloneInstance(source.getId(), CloneInstanceRequest.builder()
                .name(" ")
                .port(25570)
                .build()))
                .isInstanceOf(InstanceValidationException.class)
                .hasMessage("Name cannot be empty");
        assertThat(service.list()).hasSize(1);
    }

    private void setStatus(String id, InstanceStatus status) {
        InstanceRuntime runtime = registry.runtime(id);
        try (LockHold ignored = runtime.getLock().write()) {
            runtime.setStatus(status);
        }
    }

    private static CreateInstanceRequest request(String name, String type, int port) {
        return CreateInstanceRequest.builder()
                .name(name)
                .type(type)
                .port(port)
                .build();
    }

    private static UpdateSettingsRequest settings(int port) {
        return UpdateSettingsRequest.builder()
                .minRam("2G")
                .maxRam("4G")
                .maxPlayers(50)
                .port(port)
                .build();
    }
}
