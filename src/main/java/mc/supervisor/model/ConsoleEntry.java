package mc.supervisor.model;

public record ConsoleEntry(long seq, String line) {
}
