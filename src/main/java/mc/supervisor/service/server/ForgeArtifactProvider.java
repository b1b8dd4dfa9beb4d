package mc.supervisor.service.server;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.function.Consumer;

public class ForgeArtifactProvider extends InstallerArtifactProvider {
    private static final String PROMOTIONS_URL =
            "https://files.minecraftforge.net/net/minecraftforge/forge/promotions_slim.json";
    private static final String MAVEN_URL = "https://maven.minecraftforge.net/net/minecraftforge/forge/";

    public ForgeArtifactProvider(ArtifactHttpClient http, String javaCommand) {
        super(http, javaCommand);
    }

    @Override
    public List<GameVersion> fetchVersions() throws IOException, InterruptedException {
        TreeSet<String> releases = new TreeSet<>(VersionOrder.NEWEST_FIRST);
        http.getJson(PROMOTIONS_URL).path("promos").fieldNames().forEachRemaining(key -> {
            int dash = key.indexOf('-');
            if (dash > 0 && VersionOrder.STABLE_RELEASE.matcher(key.substring(0, dash)).matches()) {
                releases.add(key.substring(0, dash));
            }
        });
        List<GameVersion> versions = new ArrayList<>();
        for (String release : releases) {
            versions.add(new GameVersion(release, versions.isEmpty()));
        }
        return versions;
    }

    @Override
    public void install(String version, Path targetDir, Consumer<String> progress) throws IOException, InterruptedException {
        progress.accept("Fetching Forge version for MC " + version + "...");
        JsonNode promos = http.getJson(PROMOTIONS_URL).path("promos");
        String build = promos.path(version + "-recommended").asText("");
        if (build.isEmpty()) {
            build = promos.path(version + "-latest").asText("");
        }
        if (build.isEmpty()) {
            throw new IOException("no Forge build found for MC " + version);
        }
        String coordinate = version + "-" + build;
        downloadAndRunInstaller("Forge",
                MAVEN_URL + coordinate + "/forge-" + coordinate + "-installer.jar", targetDir, progress);
    }
}
