package mc.supervisor.service.metrics;

import mc.supervisor.config.SupervisorProperties;
import mc.supervisor.model.InstanceConfig;
import mc.supervisor.model.InstanceStatus;
import mc.supervisor.model.PlayerSession;
import mc.supervisor.model.ServerType;
import mc.supervisor.service.InstanceRegistry;
import mc.supervisor.service.InstanceRuntime;
import mc.supervisor.service.console.ConsoleBuffer;
import mc.supervisor.service.console.ConsolePipeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

import java.io.StringWriter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MetricsPollerTest {
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private ProcessMetricsSampler sampler;
    private ServerCapabilities capabilities;
    private SupervisorProperties.Metrics settings;
    private MetricsPoller poller;
    private InstanceRuntime runtime;
    private StringWriter stdin;
    private InstanceConfig config;

    @BeforeEach
    void setUp() {
        sampler = mock(ProcessMetricsSampler.class);
        capabilities = mock(ServerCapabilities.class);
        settings = new SupervisorProperties.Metrics();
        settings.setLatencyQuerySpacing(Duration.ZERO);
        poller = new MetricsPoller(mock(TaskScheduler.class), Runnable::run, sampler, capabilities, settings,
                Clock.fixed(NOW, ZoneOffset.UTC));

        config = InstanceConfig.builder().id("abc12345").name("survival").type(ServerType.PAPER).build();
        when(capabilities.tpsCommand(any())).thenReturn("tps");

        stdin = new StringWriter();
        runtime = new InstanceRuntime("abc12345", InstanceStatus.BOOTING, new ConsoleBuffer(100, 10, 100));
        runtime.setPid(4242);
        runtime.setStdin(stdin);
    }

    @Test
    void readyBannerLeadsToExactlyOneRosterQuery() {
        ConsolePipeline pipeline = new ConsolePipeline(mock(InstanceRegistry.class), Runnable::run,
                new SupervisorProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
        MetricsPoller.MetricsLoop loop = poller.newLoop(config, runtime);

        pipeline.process(runtime, "[12:00:00 INFO]: Done (5.0s)! For help, type \"help\"");
        loop.tick(NOW.plusSeconds(1));
        assertThat(stdin.toString()).isEmpty();

        loop.tick(NOW.plusSeconds(2));
        loop.tick(NOW.plusSeconds(4));
        loop.tick(NOW.plusSeconds(6));

        assertThat(stdin.toString()).isEqualTo("minecraft:list\n");
        assertThat(runtime.getLastRosterCommand()).isEqualTo(NOW.plusSeconds(2));
    }

    @Test
    void samplesResourceUsage() {
        when(sampler.sample(anyLong())).thenReturn(new ProcessMetricsSampler.Sample(12.5, 1024));

        poller.newLoop(config, runtime).tick(NOW);

        assertThat(runtime.getCpu()).isEqualTo(12.5);
        assertThat(runtime.getRamMb()).isEqualTo(1024);
    }

    @Test
    void doesNothingWithoutProcess() {
        runtime.setPid(0);
        runtime.setStatus(InstanceStatus.RUNNING);
        runtime.scheduleRosterRefresh(Duration.ZERO, NOW);

        poller.newLoop(config, runtime).tick(NOW);

        assertThat(stdin.toString()).isEmpty();
    }

    @Test
    void asksForTpsOnItsCadence() {
        runtime.setStatus(InstanceStatus.RUNNING);
        settings.setTpsEveryTicks(3);
        MetricsPoller.MetricsLoop loop = poller.newLoop(config, runtime);

        loop.tick(NOW);
        loop.tick(NOW.plusSeconds(2));
        assertThat(stdin.toString()).isEmpty();

        loop.tick(NOW.plusSeconds(4));
        assertThat(stdin.toString()).isEqualTo("tps\n");
        assertThat(runtime.getLastTpsCommand()).isEqualTo(NOW.plusSeconds(4));
    }

    @Test
    void proxiesAreNeverAskedForRoster() {
        InstanceConfig proxy = config.toBuilder().type(ServerType.VELOCITY).build();
        when(capabilities.tpsCommand(proxy)).thenReturn(null);
        runtime.setStatus(InstanceStatus.RUNNING);
        runtime.scheduleRosterRefresh(Duration.ZERO, NOW);

        poller.newLoop(proxy, runtime).tick(NOW);

        assertThat(stdin.toString()).isEmpty();
    }

    @Test
    void latencySweepSkipsExcludedPlayers() {
        runtime.setStatus(InstanceStatus.RUNNING);
        runtime.setLatencySupported(true);
        runtime.getPlayers().put("Alex", PlayerSession.joined("Alex", null, NOW));
        runtime.getPlayers().put("Steve", PlayerSession.joined("Steve", null, NOW));
        runtime.getLatencyExcluded().add("Alex");
        settings.setLatencyEveryTicks(1);
        settings.setRosterResyncEveryTicks(1000);

        poller.newLoop(config, runtime).tick(NOW);

        assertThat(stdin.toString()).isEqualTo("ping Steve\n");
        assertThat(runtime.getLastLatencyPlayer()).isEqualTo("Steve");
        assertThat(runtime.getLastLatencyCommand()).isEqualTo(NOW);
    }
}
