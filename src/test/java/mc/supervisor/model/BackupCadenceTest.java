package mc.supervisor.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackupCadenceTest {

    @Test
    void parsesIdentifiers() {
        assertThat(BackupCadence.fromId("daily")).isEqualTo(BackupCadence.DAILY);
        assertThat(BackupCadence.fromId(" sixmonths ")).isEqualTo(BackupCadence.SIX_MONTHS);
        assertThat(BackupCadence.fromId("")).isNull();
        assertThat(BackupCadence.fromId(null)).isNull();
        assertThatThrownBy(() -> BackupCadence.fromId("hourly"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("invalid backup schedule");
    }

    @Test
    void monthBasedCadencesUseCalendarArithmetic() {
        Instant last = Instant.parse("2024-01-31T10:00:00Z");

        assertThat(BackupCadence.DAILY.next(last)).isEqualTo(Instant.parse("2024-02-01T10:00:00Z"));
        assertThat(BackupCadence.WEEKLY.next(last)).isEqualTo(Instant.parse("2024-02-07T10:00:00Z"));
        assertThat(BackupCadence.MONTHLY.next(last)).isEqualTo(Instant.parse("2024-02-29T10:00:00Z"));
        assertThat(BackupCadence.SIX_MONTHS.next(last)).isEqualTo(Instant.parse("2024-07-31T10:00:00Z"));
        assertThat(BackupCadence.YEARLY.next(last)).isEqualTo(Instant.parse("2025-01-31T10:00:00Z"));
    }
}
