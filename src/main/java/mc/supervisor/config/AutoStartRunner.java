package mc.supervisor.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import mc.supervisor.model.InstanceConfig;
import mc.supervisor.service.InstanceRegistry;
import mc.supervisor.service.ProcessSupervisor;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Instant;

/** Starts every instance flagged {@code autoStart} shortly after the application is up. */
@Slf4j
@Component
@RequiredArgsConstructor
public class AutoStartRunner implements ApplicationRunner {
    private final InstanceRegistry registry;
    private final ProcessSupervisor processSupervisor;
    private final ThreadPoolTaskScheduler supervisorScheduler;
    private final SupervisorProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        supervisorScheduler.schedule(this::startAll, Instant.now().plus(properties.getAutoStartDelay()));
    }

    void startAll() {
        for (InstanceConfig config : registry.configs()) {
            if (!config.isAutoStart()) {
                continue;
            }
            try {
                processSupervisor.start(config.getId());
                log.info("Auto-started server {}", config.getName());
            } catch (RuntimeException e) {
                log.warn("Auto-start failed for {}: {}", config.getName(), e.getMessage());
            }
        }
    }
}
