package mc.supervisor.service.server;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/** Mojang's launcher manifest. Only full releases are offered. */
public class VanillaArtifactProvider implements ArtifactProvider {
    private static final String MANIFEST_URL = "https://piston-meta.mojang.com/mc/game/version_manifest_v2.json";

    private final ArtifactHttpClient http;

    public VanillaArtifactProvider(ArtifactHttpClient http) {
        this.http = http;
    }

    @Override
    public List<GameVersion> fetchVersions() throws IOException, InterruptedException {
        JsonNode manifest = http.getJson(MANIFEST_URL);
        String latest = manifest.path("latest").path("release").asText("");
        List<GameVersion> versions = new ArrayList<>();
        for (JsonNode node : manifest.path("versions")) {
            if ("release".equals(node.path("type").asText())) {
                String id = node.path("id").asText();
                versions.add(new GameVersion(id, id.equals(latest)));
            }
        }
        return versions;
    }

    @Override
    public void install(String version, Path targetDir, Consumer<String> progress) throws IOException, InterruptedException {
        progress.accept("Fetching Vanilla " + version + " metadata...");
        String metaUrl = null;
        for (JsonNode node : http.getJson(MANIFEST_URL).path("versions")) {
            if (version.equals(node.path("id").asText())) {
                metaUrl = node.path("url").asText();
                break;
            }
        }
        if (metaUrl == null || metaUrl.isBlank()) {
            throw new IOException("vanilla version " + version + " not found");
        }
        String serverUrl = http.getJson(metaUrl).path("downloads").path("server").path("url").asText("");
        if (serverUrl.isBlank()) {
            throw new IOException("server jar URL unavailable for vanilla " + version);
        }
        progress.accept("Downloading Vanilla " + version + "...");
        http.download(serverUrl, targetDir.resolve("server.jar"));
    }
}
