package mc.supervisor.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import mc.supervisor.config.SupervisorProperties;
import mc.supervisor.exception.InstanceValidationException;
import mc.supervisor.model.CrashReport;
import mc.supervisor.model.InstanceConfig;
import mc.supervisor.model.ServerType;
import mc.supervisor.repository.InstanceConfigRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CrashReportServiceTest {
    private static final String REPORT = "---- Minecraft Crash Report ----\n"
            + "// Why did you do that?\n\n"
            + "Time: 2024-05-01 12:00:00\n"
            + "Description: Exception in server tick loop\n\n"
            + "java.lang.NullPointerException\n";

    @TempDir
    Path tempDir;

    private CrashReportService service;
    private String id;
    private Path crashDir;

    @BeforeEach
    void setUp() throws Exception {
        SupervisorProperties properties = new SupervisorProperties();
        properties.setBaseDir(tempDir.toString());
        InstanceRegistry registry = new InstanceRegistry(new InstanceConfigRepository(new ObjectMapper(), properties),
                properties);
        registry.load();
        InstanceConfig config = registry.register(InstanceConfig.builder()
                .name("survival")
                .type(ServerType.PAPER)
                .port(25565)
                .build());
        id = config.getId();
        crashDir = Files.createDirectories(Paths.get(config.getDir()).resolve(CrashReportService.CRASH_DIR));
        service = new CrashReportService(registry);
    }

    @Test
    void noDirectoryMeansNoReports() throws Exception {
        Files.delete(crashDir);

        assertThat(service.listCrashReports(id)).isEmpty();
    }

    @Test
    void listsReportsNewestFirstWithTheirCause() throws Exception {
        write("crash-2024-05-01_12.00.00-server.txt", REPORT, "2024-05-01T12:00:00Z");
        write("crash-2024-05-02_08.30.00-server.txt", "no description here\n", "2024-05-02T08:30:00Z");
        write("notes.log", "ignored", "2024-05-03T00:00:00Z");

        List<CrashReport> reports = service.listCrashReports(id);

        assertThat(reports).extracting(CrashReport::name).containsExactly(
                "crash-2024-05-02_08.30.00-server.txt", "crash-2024-05-01_12.00.00-server.txt");
        assertThat(reports).extracting(CrashReport::cause).containsExactly("Unknown", "Exception in server tick loop");
        assertThat(reports.get(1).size()).isEqualTo(REPORT.length());
    }

    @Test
    void readsCopiesAndDeletesAReport() throws Exception {
        write("crash-a.txt", REPORT, "2024-05-01T12:00:00Z");

        assertThat(service.readCrashReport(id, "crash-a.txt")).isEqualTo(REPORT);

        assertThat(service.copyCrashReport(id, "crash-a.txt")).isEqualTo("crash-a-copy.txt");
        assertThat(crashDir.resolve("crash-a-copy.txt")).hasContent(REPORT);

        service.deleteCrashReport(id, "crash-a.txt");
        assertThat(crashDir.resolve("crash-a.txt")).doesNotExist();
    }

    @Test
    void namesOutsideTheCrashDirectoryAreRejected() throws Exception {
        Files.writeString(crashDir.getParent().resolve("eula.txt"), "eula=true\n");

        assertThatThrownBy(() -> service.readCrashReport(id, "../eula.txt"))
                .isInstanceOf(InstanceValidationException.class)
                .hasMessage("invalid crash report name: ../eula.txt");
        assertThatThrownBy(() -> service.deleteCrashReport(id, "missing.txt"))
                .isInstanceOf(InstanceValidationException.class)
                .hasMessage("crash report missing.txt not found");
    }

    private void write(String name, String content, String modified) throws Exception {
        Path file = crashDir.resolve(name);
        Files.writeString(file, content);
        Files.setLastModifiedTime(file, FileTime.from(Instant.parse(modified)));
    }
}
