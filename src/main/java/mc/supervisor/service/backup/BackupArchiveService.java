package mc.supervisor.service.backup;

import lombok.extern.slf4j.Slf4j;
import mc.supervisor.model.BackupInfo;
import org.springframework.stereotype.Service;
import org.zeroturnaround.zip.ZipUtil;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/** Zip archives of instance directories. */
@Slf4j
@Service
public class BackupArchiveService {
    static final String ARCHIVE_EXTENSION = ".zip";
    private static final String EXCLUDED_DIR = "backups";

    /** Packs {@code sourceDir} into {@code archive}, leaving out a top-level {@code backups} directory. */
    public void create(Path sourceDir, Path archive) throws IOException {
        Files.createDirectories(archive.getParent());
        Path partial = archive.resolveSibling(archive.getFileName() + ".part");
        try {
            ZipUtil.pack(sourceDir.toFile(), partial.toFile(), name ->
                    name.equals(EXCLUDED_DIR) || name.startsWith(EXCLUDED_DIR + "/") ? null : name);
            Files.move(partial, archive);
        } catch (RuntimeException e) {
            Files.deleteIfExists(partial);
            throw new IOException("failed to create archive " + archive.getFileName() + ": " + e.getMessage(), e);
        }
        log.info("Created backup archive {} ({} bytes)", archive, Files.size(archive));
    }

    /** Archives in {@code dir}, newest first. */
    public List<BackupInfo> list(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(path -> path.getFileName().toString().endsWith(ARCHIVE_EXTENSION))
                    .filter(Files::isRegularFile)
                    .map(this::describe)
                    .sorted(Comparator.comparing(BackupInfo::createdAt).reversed()
                            .thenComparing(BackupInfo::name, Comparator.reverseOrder()))
                    .toList();
        }
    }

    /** Replaces the contents of {@code targetDir} with the archive's. */
    public void extract(Path archive, Path targetDir) throws IOException {
        if (Files.isDirectory(targetDir)) {
            try (Stream<Path> walk = Files.walk(targetDir)) {
                for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                    if (!path.equals(targetDir)) {
                        Files.delete(path);
                    }
                }
            }
        }
        Files.createDirectories(targetDir);
        try {
            ZipUtil.unpack(archive.toFile(), targetDir.toFile());
        } catch (RuntimeException e) {
            throw new IOException("failed to extract " + archive.getFileName() + ": " + e.getMessage(), e);
        }
        log.info("Extracted backup {} into {}", archive.getFileName(), targetDir);
    }

    public void delete(Path archive) throws IOException {
        Files.delete(archive);
    }

    private BackupInfo describe(Path path) {
        try {
            BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
            return new BackupInfo(path.getFileName().toString(), attributes.size(),
                    attributes.lastModifiedTime().toInstant());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
