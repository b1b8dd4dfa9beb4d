package mc.supervisor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

public enum ServerType {
    PAPER("paper"),
    SPIGOT("spigot"),
    PURPUR("purpur"),
    FOLIA("folia"),
    VANILLA("vanilla"),
    FABRIC("fabric"),
    FORGE("forge"),
    NEOFORGE("neoforge"),
    VELOCITY("velocity"),
    WATERFALL("waterfall");

    private final String id;

    ServerType(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static ServerType fromId(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Server type is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.id.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown server type: " + value));
    }

    /** Paper and its forks, which expose Bukkit-style plugins and namespaced vanilla commands. */
    public boolean isPaperFamily() {
        return this == PAPER || this == SPIGOT || this == PURPUR || this == FOLIA;
    }

    public boolean isModded() {
        return this == FORGE || this == FABRIC || this == NEOFORGE;
    }

    public boolean isProxy() {
        return this == VELOCITY || this == WATERFALL;
    }

    public String rosterCommand() {
        return isPaperFamily() ? "minecraft:list" : "list";
    }

    /** Command reporting tick rate, or null when this flavour has none built in. */
    public String tpsCommand() {
        switch (this) {
            case PAPER:
            case SPIGOT:
            case PURPUR:
            case FOLIA:
                return "tps";
            case FORGE:
                return "forge tps";
            case NEOFORGE:
                return "neoforge tps";
            case FABRIC:
                return "fabric tps";
            default:
                return null;
        }
    }
}
