package mc.supervisor.service.metrics;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import oshi.SystemInfo;
import oshi.software.os.OSProcess;
import oshi.software.os.OperatingSystem;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** CPU and resident memory of a child process, read through OSHI. */
@Slf4j
@Component
public class ProcessMetricsSampler {
    private static final long BYTES_PER_MB = 1024L * 1024L;

    private final OperatingSystem operatingSystem;
    private final Map<Long, OSProcess> previous = new ConcurrentHashMap<>();

    public ProcessMetricsSampler() {
        this.operatingSystem = new SystemInfo().getOperatingSystem();
    }

    public record Sample(double cpuPercent, long ramMb) {
    }

    /** Returns null when the process is gone. CPU is measured since the previous sample of the same pid. */
    public Sample sample(long pid) {
        OSProcess process = operatingSystem.getProcess((int) pid);
        if (process == null) {
            previous.remove(pid);
            return null;
        }
        OSProcess prior = previous.put(pid, process);
        double load = prior == null
                ? process.getProcessCpuLoadCumulative()
                : process.getProcessCpuLoadBetweenTicks(prior);
        double cpu = Math.round(load * 1000.0) / 10.0;
        return new Sample(cpu, process.getResidentSetSize() / BYTES_PER_MB);
    }
}
