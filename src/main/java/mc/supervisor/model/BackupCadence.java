package mc.supervisor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Arrays;

public enum BackupCadence {
    DAILY("daily"),
    WEEKLY("weekly"),
    MONTHLY("monthly"),
    SIX_MONTHS("sixmonths"),
    YEARLY("yearly");

    private final String id;

    BackupCadence(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    /** Parses a cadence identifier; blank means no schedule and yields null. */
    @JsonCreator
    public static BackupCadence fromId(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return Arrays.stream(values())
                .filter(cadence -> cadence.id.equals(value.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("invalid backup schedule: " + value));
    }

    /** Next due time after {@code last}, using calendar arithmetic in UTC for month-based cadences. */
    public Instant next(Instant last) {
        ZonedDateTime from = last.atZone(ZoneOffset.UTC);
        switch (this) {
            case DAILY:
                return from.plusHours(24).toInstant();
            case WEEKLY:
                return from.plusDays(7).toInstant();
            case MONTHLY:
                return from.plusMonths(1).toInstant();
            case SIX_MONTHS:
                return from.plusMonths(6).toInstant();
            case YEARLY:
                return from.plusYears(1).toInstant();
            default:
                throw new IllegalStateException("Unhandled cadence " + this);
        }
    }
}
