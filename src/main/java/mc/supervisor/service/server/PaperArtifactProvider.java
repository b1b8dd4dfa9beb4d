package mc.supervisor.service.server;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/** PaperMC fill API, shared by Paper, Folia, Velocity and Waterfall. */
public class PaperArtifactProvider implements ArtifactProvider {
    private static final String API_URL = "https://fill.papermc.io/v3/projects/";

    private final String project;
    private final ArtifactHttpClient http;

    public PaperArtifactProvider(String project, ArtifactHttpClient http) {
        this.project = project;
        this.http = http;
    }

    @Override
    public List<GameVersion> fetchVersions() throws IOException, InterruptedException {
        JsonNode versionGroups = http.getJson(API_URL + project).path("versions");
        List<String> groups = new ArrayList<>();
        versionGroups.fieldNames().forEachRemaining(groups::add);
        groups.sort(VersionOrder.NEWEST_FIRST);

        Set<String> candidates = new LinkedHashSet<>();
        for (String group : groups) {
            List<String> members = new ArrayList<>();
            versionGroups.path(group).forEach(node -> members.add(node.asText()));
            members.sort(VersionOrder.NEWEST_FIRST);
            for (String version : members) {
                if (!version.contains("-pre") && !version.contains("-rc")) {
                    candidates.add(version);
                }
            }
        }

        List<GameVersion> versions = new ArrayList<>();
        for (String version : candidates) {
            if (stableBuild(builds(version)) != null) {
                versions.add(new GameVersion(version, versions.isEmpty()));
            }
        }
        return versions;
    }

    @Override
    public void install(String version, Path targetDir, Consumer<String> progress) throws IOException, InterruptedException {
        progress.accept("Fetching builds for " + project + " " + version + "...");
        JsonNode builds = builds(version);
        if (!builds.isArray() || builds.isEmpty()) {
            throw new IOException("no builds available for " + project + " " + version);
        }
        JsonNode selected = stableBuild(builds);
        if (selected == null) {
            selected = builds.get(0);
        }
        String url = downloadUrl(selected.path("downloads"));
        if (url == null) {
            throw new IOException("no download URL found for build " + selected.path("id").asText());
        }
        progress.accept(String.format("Downloading %s %s (build #%s)...", project, version, selected.path("id").asText()));
        http.download(url, targetDir.resolve("server.jar"));
    }

    private JsonNode builds(String version) throws IOException, InterruptedException {
        return http.getJson(API_URL + project + "/versions/" + version + "/builds");
    }

    private static JsonNode stableBuild(JsonNode builds) {
        for (JsonNode build : builds) {
            if ("stable".equalsIgnoreCase(build.path("channel").asText())) {
                return build;
            }
        }
        return null;
    }

    private static String downloadUrl(JsonNode downloads) {
        for (String key : List.of("server:default", "application")) {
            String url = downloads.path(key).path("url").asText("");
            if (!url.isEmpty()) {
                return url;
            }
        }
        Iterator<Map.Entry<String, JsonNode>> fields = downloads.fields();
        while (fields.hasNext()) {
            String url = fields.next().getValue().path("url").asText("");
            if (!url.isEmpty()) {
                return url;
            }
        }
        return null;
    }
}
