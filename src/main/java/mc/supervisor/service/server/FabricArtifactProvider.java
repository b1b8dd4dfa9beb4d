package mc.supervisor.service.server;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/** Fabric meta API; the server launcher jar bundles loader and installer. */
public class FabricArtifactProvider implements ArtifactProvider {
    private static final String META_URL = "https://meta.fabricmc.net/v2/versions";

    private final ArtifactHttpClient http;

    public FabricArtifactProvider(ArtifactHttpClient http) {
        this.http = http;
    }

    @Override
    public List<GameVersion> fetchVersions() throws IOException, InterruptedException {
        List<GameVersion> versions = new ArrayList<>();
        for (JsonNode node : http.getJson(META_URL + "/game")) {
            if (node.path("stable").asBoolean()) {
                versions.add(new GameVersion(node.path("version").asText(), versions.isEmpty()));
            }
        }
        return versions;
    }

    @Override
    public void install(String version, Path targetDir, Consumer<String> progress) throws IOException, InterruptedException {
        progress.accept("Fetching Fabric loader versions...");
        String loader = preferStable(http.getJson(META_URL + "/loader"), "loader");
        progress.accept("Fetching Fabric installer versions...");
        String installer = preferStable(http.getJson(META_URL + "/installer"), "installer");

        progress.accept(String.format("Downloading Fabric %s with loader %s (installer %s)...", version, loader, installer));
        http.download(String.format("%s/loader/%s/%s/%s/server/jar", META_URL, version, loader, installer),
                targetDir.resolve("server.jar"));
    }

    private static String preferStable(JsonNode entries, String kind) throws IOException {
        for (JsonNode entry : entries) {
            if (entry.path("stable").asBoolean()) {
                return entry.path("version").asText();
            }
        }
        if (entries.isArray() && !entries.isEmpty()) {
            return entries.get(0).path("version").asText();
        }
        throw new IOException("no Fabric " + kind + " versions available");
    }
}
