package mc.supervisor.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import mc.supervisor.exception.InstanceOperationException;
import mc.supervisor.exception.InstanceValidationException;
import mc.supervisor.model.CrashReport;
import mc.supervisor.model.InstanceConfig;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/** Reports the game writes to {@code crash-reports/} when a server goes down. */
@Slf4j
@Service
@RequiredArgsConstructor
public class CrashReportService {
    static final String CRASH_DIR = "crash-reports";
    private static final String REPORT_EXTENSION = ".txt";
    private static final String DESCRIPTION_PREFIX = "Description: ";
    private static final int CAUSE_SCAN_LINES = 30;

    private final InstanceRegistry registry;

    /** Newest first. A missing directory means no reports. */
    public List<CrashReport> listCrashReports(String id) {
        Path dir = crashDirectory(registry.config(id));
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<CrashReport> reports = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            for (Path file : files.toList()) {
                String name = file.getFileName().toString();
                if (!name.endsWith(REPORT_EXTENSION) || !Files.isRegularFile(file)) {
                    continue;
                }
                BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
                reports.add(new CrashReport(name, attributes.size(), attributes.lastModifiedTime().toInstant(),
                        extractCause(file)));
            }
        } catch (IOException e) {
            throw new InstanceOperationException("failed to list crash reports: " + e.getMessage(), e);
        }
        reports.sort(Comparator.comparing(CrashReport::modifiedAt).reversed());
        return reports;
    }

    public String readCrashReport(String id, String name) {
        Path file = resolveReport(registry.config(id), name);
        try {
            return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InstanceOperationException("failed to read crash report: " + e.getMessage(), e);
        }
    }

    /** Duplicates a report as {@code <name>-copy.txt} and returns the new name. */
    public String copyCrashReport(String id, String name) {
        InstanceConfig config = registry.config(id);
        Path file = resolveReport(config, name);
        String copyName = name.substring(0, name.length() - REPORT_EXTENSION.length()) + "-copy" + REPORT_EXTENSION;
        try {
            Files.copy(file, crashDirectory(config).resolve(copyName));
            return copyName;
        } catch (IOException e) {
            throw new InstanceOperationException("failed to copy crash report: " + e.getMessage(), e);
        }
    }

    public void deleteCrashReport(String id, String name) {
        Path file = resolveReport(registry.config(id), name);
        try {
            Files.delete(file);
            log.info("Deleted crash report {} of server {}", name, id);
        } catch (IOException e) {
            throw new InstanceOperationException("failed to delete crash report: " + e.getMessage(), e);
        }
    }

    static String extractCause(Path file) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(file),
                StandardCharsets.UTF_8.newDecoder().onMalformedInput(CodingErrorAction.REPLACE)))) {
            String line;
            for (int i = 0; i < CAUSE_SCAN_LINES && (line = reader.readLine()) != null; i++) {
                if (line.startsWith(DESCRIPTION_PREFIX)) {
                    return line.substring(DESCRIPTION_PREFIX.length());
                }
            }
        } catch (IOException e) {
            log.debug("Could not read {}: {}", file, e.getMessage());
        }
        return "Unknown";
    }

    private static Path crashDirectory(InstanceConfig config) {
        return Paths.get(config.getDir()).resolve(CRASH_DIR);
    }

    private static Path resolveReport(InstanceConfig config, String name) {
        if (name == null || name.isBlank() || name.contains("/") || name.contains("\\") || name.contains("..")
                || !name.endsWith(REPORT_EXTENSION)) {
            throw new InstanceValidationException("invalid crash report name: " + name);
        }
        Path file = crashDirectory(config).resolve(name);
        if (!Files.isRegularFile(file)) {
            throw new InstanceValidationException("crash report " + name + " not found");
        }
        return file;
    }
}
