package mc.supervisor.service.server;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.function.Consumer;

/** NeoForge versions {@code X.Y.n} map to Minecraft {@code 1.X.Y}. */
public class NeoForgeArtifactProvider extends InstallerArtifactProvider {
    private static final String VERSIONS_URL =
            "https://maven.neoforged.net/api/maven/versions/releases/net/neoforged/neoforge";
    private static final String MAVEN_URL = "https://maven.neoforged.net/releases/net/neoforged/neoforge/";

    public NeoForgeArtifactProvider(ArtifactHttpClient http, String javaCommand) {
        super(http, javaCommand);
    }

    @Override
    public List<GameVersion> fetchVersions() throws IOException, InterruptedException {
        TreeSet<String> releases = new TreeSet<>(VersionOrder.NEWEST_FIRST);
        for (String neoVersion : stableVersions()) {
            String[] parts = neoVersion.split("\\.", 3);
            if (parts.length >= 2) {
                releases.add("1." + parts[0] + "." + parts[1]);
            }
        }
        List<GameVersion> versions = new ArrayList<>();
        for (String release : releases) {
            versions.add(new GameVersion(release, versions.isEmpty()));
        }
        return versions;
    }

    @Override
    public void install(String version, Path targetDir, Consumer<String> progress) throws IOException, InterruptedException {
        progress.accept("Fetching NeoForge version for MC " + version + "...");
        String[] parts = version.split("\\.", 3);
        if (parts.length < 3) {
            throw new IOException("invalid MC version format: " + version);
        }
        String prefix = parts[1] + "." + parts[2] + ".";
        String match = null;
        for (String candidate : stableVersions()) {
            if (candidate.startsWith(prefix)) {
                match = candidate;
            }
        }
        if (match == null) {
            throw new IOException("no NeoForge version found for MC " + version);
        }
        downloadAndRunInstaller("NeoForge",
                MAVEN_URL + match + "/neoforge-" + match + "-installer.jar", targetDir, progress);
    }

    private List<String> stableVersions() throws IOException, InterruptedException {
        List<String> stable = new ArrayList<>();
        for (JsonNode node : http.getJson(VERSIONS_URL).path("versions")) {
            String value = node.asText();
            if (!value.contains("-beta") && !value.contains("-alpha") && !value.contains("+")) {
                stable.add(value);
            }
        }
        return stable;
    }
}
