package mc.supervisor.service.server;

public record GameVersion(String version, boolean latest) {
}
