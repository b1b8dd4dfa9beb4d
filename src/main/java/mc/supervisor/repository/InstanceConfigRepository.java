package mc.supervisor.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import mc.supervisor.config.SupervisorProperties;
import mc.supervisor.exception.InstanceOperationException;
import mc.supervisor.model.InstanceConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Flat JSON file holding every {@link InstanceConfig}. Writes go to a temporary sibling first and
 * are then moved over the live file so a crash never leaves a half-written registry.
 */
@Slf4j
@Repository
public class InstanceConfigRepository {
    private final ObjectMapper objectMapper;
    private final Path file;

    @Autowired
    public InstanceConfigRepository(ObjectMapper objectMapper, SupervisorProperties properties) {
        this(objectMapper, properties.registryFile());
    }

    public InstanceConfigRepository(ObjectMapper objectMapper, Path file) {
        this.objectMapper = objectMapper;
        this.file = file;
    }

    public List<InstanceConfig> loadAll() {
        if (!Files.exists(file)) {
            return new ArrayList<>();
        }
        try {
            List<InstanceConfig> configs = objectMapper.readValue(file.toFile(), new TypeReference<>() {});
            log.info("Loaded {} server definitions from {}", configs.size(), file);
            return configs;
        } catch (IOException e) {
            throw new InstanceOperationException("failed to read " + file + ": " + e.getMessage(), e);
        }
    }

    public void saveAll(Collection<InstanceConfig> configs) {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.createDirectories(file.getParent());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), new ArrayList<>(configs));
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new InstanceOperationException("failed to persist config: " + e.getMessage(), e);
        }
    }

    public Path getFile() {
        return file;
    }
}
