package mc.supervisor.service.server;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

public class PurpurArtifactProvider implements ArtifactProvider {
    private static final String API_URL = "https://api.purpurmc.org/v2/purpur";

    private final ArtifactHttpClient http;

    public PurpurArtifactProvider(ArtifactHttpClient http) {
        this.http = http;
    }

    @Override
    public List<GameVersion> fetchVersions() throws IOException, InterruptedException {
        List<String> names = new ArrayList<>();
        http.getJson(API_URL).path("versions").forEach(node -> names.add(node.asText()));
        Collections.reverse(names);
        List<GameVersion> versions = new ArrayList<>();
        for (String name : names) {
            versions.add(new GameVersion(name, versions.isEmpty()));
        }
        return versions;
    }

    @Override
    public void install(String version, Path targetDir, Consumer<String> progress) throws IOException, InterruptedException {
        progress.accept("Downloading Purpur " + version + "...");
        http.download(API_URL + "/" + version + "/latest/download", targetDir.resolve("server.jar"));
    }
}
