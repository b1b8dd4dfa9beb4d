package mc.supervisor.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Named sets of extra JVM arguments for the launch command. */
public enum JvmFlagPreset {
    AIKARS("aikars", List.of(
            "--add-modules=jdk.incubator.vector",
            "-XX:+UseG1GC",
            "-XX:+ParallelRefProcEnabled",
            "-XX:MaxGCPauseMillis=200",
            "-XX:+UnlockExperimentalVMOptions",
            "-XX:+DisableExplicitGC",
            "-XX:G1HeapWastePercent=5",
            "-XX:G1MixedGCCountTarget=4",
            "-XX:InitiatingHeapOccupancyPercent=15",
            "-XX:G1MixedGCLiveThresholdPercent=90",
            "-XX:G1RSetUpdatingPauseTimePercent=5",
            "-XX:SurvivorRatio=32",
            "-XX:+PerfDisableSharedMem",
            "-XX:MaxTenuringThreshold=1",
            "-Dusing.aikars.flags=https://mcflags.emc.gs",
            "-Daikars.new.flags=true",
            "-XX:G1NewSizePercent=30",
            "-XX:G1MaxNewSizePercent=40",
            "-XX:G1HeapRegionSize=8M",
            "-XX:G1ReservePercent=20")),
    VELOCITY("velocity", List.of(
            "-XX:+UseG1GC",
            "-XX:G1HeapRegionSize=4M",
            "-XX:+UnlockExperimentalVMOptions",
            "-XX:+ParallelRefProcEnabled",
            "-XX:MaxInlineLevel=15")),
    MODDED("modded", List.of(
            "-XX:+UseG1GC",
            "-XX:+UnlockExperimentalVMOptions",
            "-XX:MaxGCPauseMillis=50",
            "-XX:+DisableExplicitGC",
            "-XX:G1NewSizePercent=30",
            "-XX:G1MaxNewSizePercent=40",
            "-XX:G1HeapRegionSize=16M",
            "-XX:InitiatingHeapOccupancyPercent=15",
            "-XX:G1MixedGCLiveThresholdPercent=50",
            "-XX:+PerfDisableSharedMem")),
    NONE("none", List.of("--add-modules=jdk.incubator.vector"));

    private final String id;
    private final List<String> flags;

    JvmFlagPreset(String id, List<String> flags) {
        this.id = id;
        this.flags = flags;
    }

    public String id() {
        return id;
    }

    /** Unknown or blank names fall back to {@link #NONE}. */
    public static JvmFlagPreset fromId(String value) {
        if (value == null) {
            return NONE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (JvmFlagPreset preset : values()) {
            if (preset.id.equals(normalized)) {
                return preset;
            }
        }
        return NONE;
    }

    public static List<String> resolve(String name, boolean alwaysPreTouch) {
        List<String> args = new ArrayList<>(fromId(name).flags);
        if (alwaysPreTouch) {
            args.add("-XX:+AlwaysPreTouch");
        }
        return args;
    }
}
