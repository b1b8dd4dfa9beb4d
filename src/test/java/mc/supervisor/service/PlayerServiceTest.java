package mc.supervisor.service;

import mc.supervisor.exception.InstanceValidationException;
import mc.supervisor.model.InstanceConfig;
import mc.supervisor.model.InstanceStatus;
import mc.supervisor.model.LatencySupport;
import mc.supervisor.model.PlayerInfo;
import mc.supervisor.model.PlayerSession;
import mc.supervisor.model.ServerType;
import mc.supervisor.service.console.ConsoleBuffer;
import mc.supervisor.service.metrics.ServerCapabilities;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class PlayerServiceTest {

    @TempDir
    Path tempDir;

    private InstanceRegistry registry;
    private ProcessSupervisor processSupervisor;
    private PlayerService playerService;
    private InstanceRuntime runtime;

    @BeforeEach
    void setUp() {
        registry = mock(InstanceRegistry.class);
        processSupervisor = mock(ProcessSupervisor.class);
        playerService = new PlayerService(registry, processSupervisor, new ServerCapabilities());
        runtime = new InstanceRuntime("abc12345", InstanceStatus.RUNNING, new ConsoleBuffer(10, 1, 10));
        when(registry.runtime("abc12345")).thenReturn(runtime);
        when(registry.config("abc12345")).thenReturn(InstanceConfig.builder()
                .id("abc12345")
                .type(ServerType.VANILLA)
                .dir(tempDir.toString())
                .build());
    }

    @Test
    void listsPlayersSortedByName() {
        Instant now = Instant.now();
        runtime.getPlayers().put("Zed", PlayerSession.joined("Zed", "10.0.0.9", now));
        PlayerSession alex = PlayerSession.joined("Alex", "10.0.0.1", now.minusSeconds(3 * 3600 + 120));
        alex.setLatency(31);
        alex.setWorld("Nether");
        runtime.getPlayers().put("Alex", alex);

        List<PlayerInfo> players = playerService.listPlayers("abc12345");

        assertThat(players).extracting(PlayerInfo::getName).containsExactly("Alex", "Zed");
        assertThat(players.get(0).getPing()).isEqualTo(31);
        assertThat(players.get(0).getWorld()).isEqualTo("Nether");
        assertThat(players.get(0).getOnlineTime()).startsWith("3h ");
        assertThat(players.get(1).getPing()).isEqualTo(-1);
    }

    @Test
    void noPlayersUnlessRunning() {
        runtime.getPlayers().put("Alex", PlayerSession.joined("Alex", null, Instant.now()));
        runtime.setStatus(InstanceStatus.BOOTING);

        assertThat(playerService.listPlayers("abc12345")).isEmpty();
    }

    @Test
    void formatsOnlineTime() {
        Instant now = Instant.parse("2024-05-01T12:00:00Z");

        assertThat(PlayerService.formatOnlineTime(now.minusSeconds(59), now)).isEqualTo("0m");
        assertThat(PlayerService.formatOnlineTime(now.minusSeconds(25 * 60), now)).isEqualTo("25m");
        assertThat(PlayerService.formatOnlineTime(now.minusSeconds(2 * 3600 + 5 * 60), now)).isEqualTo("2h 5m");
    }

    @Test
    void moderationGoesThroughTheConsole() {
        playerService.kickPlayer("abc12345", "Steve", "");
        playerService.kickPlayer("abc12345", "Steve", "spamming");
        playerService.banPlayer("abc12345", "Steve", null);
        playerService.killPlayer("abc12345", "Steve");

        verify(processSupervisor).sendCommand("abc12345", "kick Steve");
        verify(processSupervisor).sendCommand("abc12345", "kick Steve spamming");
        verify(processSupervisor).sendCommand("abc12345", "ban Steve");
        verify(processSupervisor).sendCommand("abc12345", "kill Steve");
    }

    @Test
    void namesAndReasonsCannotCarryASecondCommand() {
        assertThatThrownBy(() -> playerService.kickPlayer("abc12345", "x\nstop", null))
                .isInstanceOf(InstanceValidationException.class)
                .hasMessage("invalid player name: x stop");
        assertThatThrownBy(() -> playerService.killPlayer("abc12345", "Steve\rop Steve"))
                .isInstanceOf(InstanceValidationException.class);
        assertThatThrownBy(() -> playerService.banPlayer("abc12345", "Steve", "griefing\nop Alex"))
                .isInstanceOf(InstanceValidationException.class)
                .hasMessage("reason must be a single line");

        verifyNoInteractions(processSupervisor);
    }

    @Test
    void latencySupportPrefersWhatWasDetectedAtLaunch() {
        runtime.setLatencySupported(true);

        assertThat(playerService.getLatencySupport("abc12345")).isEqualTo(LatencySupport.available());
    }

    @Test
    void latencySupportFallsBackToDetection() {
        assertThat(playerService.getLatencySupport("abc12345"))
                .isEqualTo(LatencySupport.unavailable(ServerCapabilities.UNSUPPORTED_TYPE));
    }
}
