package mc.supervisor.service.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import mc.supervisor.config.SupervisorProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;

/** Thin JSON and download helper shared by the artifact providers. */
@Slf4j
@Component
public class ArtifactHttpClient {
    private static final Duration API_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration DOWNLOAD_TIMEOUT = Duration.ofMinutes(10);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String userAgent;

    public ArtifactHttpClient(ObjectMapper objectMapper, SupervisorProperties properties) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.getHttp().getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.objectMapper = objectMapper;
        this.userAgent = properties.getHttp().getUserAgent();
    }

    public JsonNode getJson(String url) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .timeout(API_TIMEOUT)
                .header("User-Agent", userAgent)
                .header("Accept", "application/json")
                .GET()
                .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            throw new IOException("API request to " + url + " failed with status " + response.statusCode());
        }
        return objectMapper.readTree(response.body());
    }

    /** Downloads {@code url} to {@code destination}; a partial file is removed on failure. */
    public void download(String url, Path destination) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .timeout(DOWNLOAD_TIMEOUT)
                .header("User-Agent", userAgent)
                .GET()
                .build();
        HttpResponse<InputStream> response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        try (InputStream body = response.body()) {
            if (response.statusCode() != 200) {
                String detail = new String(body.readNBytes(1024), StandardCharsets.UTF_8).trim();
                throw new IOException("download from " + url + " failed with status " + response.statusCode()
                        + (detail.isEmpty() ? "" : ": " + detail));
            }
            Path partial = destination.resolveSibling(destination.getFileName() + ".part");
            try {
                Files.copy(body, partial, StandardCopyOption.REPLACE_EXISTING);
                Files.move(partial, destination, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                Files.deleteIfExists(partial);
                throw e;
            }
        }
        log.info("Successfully downloaded {} to {}", url, destination);
    }
}
