package mc.supervisor.service.server;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class VersionOrderTest {

    @Test
    void sortsNumericallyNewestFirst() {
        List<String> versions = new ArrayList<>(List.of("1.9", "1.20.4", "1.20", "1.21", "1.8.9"));

        versions.sort(VersionOrder.NEWEST_FIRST);

        assertThat(versions).containsExactly("1.21", "1.20.4", "1.20", "1.9", "1.8.9");
    }

    @Test
    void recognisesStableReleases() {
        assertThat(VersionOrder.STABLE_RELEASE.matcher("1.20.4").matches()).isTrue();
        assertThat(VersionOrder.STABLE_RELEASE.matcher("1.21").matches()).isTrue();
        assertThat(VersionOrder.STABLE_RELEASE.matcher("24w14a").matches()).isFalse();
        assertThat(VersionOrder.STABLE_RELEASE.matcher("1.21-pre1").matches()).isFalse();
    }
}
