package mc.supervisor.service.server;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;

/** Source of server artifacts for one flavour. */
public interface ArtifactProvider {

    /** Available versions, newest first, with the recommended one flagged latest. */
    List<GameVersion> fetchVersions() throws IOException, InterruptedException;

    /** Puts a runnable server for {@code version} into {@code targetDir}, reporting progress as it goes. */
    void install(String version, Path targetDir, Consumer<String> progress) throws IOException, InterruptedException;
}
