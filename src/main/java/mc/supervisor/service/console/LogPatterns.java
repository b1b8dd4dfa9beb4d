package mc.supervisor.service.console;

import java.util.regex.Pattern;

public interface LogPatterns {
    // Java names and Floodgate-prefixed Bedrock names
    String PLAYER_NAME = "([^\\s\\[\\]:]+)";
    String OWNER_NAME = "([^\\s\\[\\]:']+)";

    Pattern ANSI_PATTERN = Pattern.compile("\u001B\\[[0-9;]*m");
    Pattern COLOR_CODE_PATTERN = Pattern.compile("§[0-9a-fk-or]");

    // Player events
    Pattern PLAYER_JOIN_PATTERN = Pattern.compile(PLAYER_NAME + "\\[/([0-9a-fA-F:.]+):\\d+\\] logged in");
    Pattern PLAYER_LEAVE_PATTERN = Pattern.compile(PLAYER_NAME + " left the game");

    // Tick rate replies
    Pattern TPS_PATTERN = Pattern.compile("TPS from last 1m, 5m, 15m: \\*?([0-9.]+)");
    Pattern FORGE_TPS_PATTERN = Pattern.compile("(?i)overall:\\s*(?:tps[:=]\\s*)?([0-9.]+)\\s*tps\\b|overall:.*\\btps[:=]\\s*([0-9.]+)");
    Pattern SIMPLE_TPS_PATTERN = Pattern.compile("(?i)\\bTPS[:=]\\s*([0-9.]+)");

    // Roster replies
    Pattern DIMENSION_PATTERN = Pattern.compile(PLAYER_NAME + " has the following entity data: \"minecraft:(\\w+)\"");
    Pattern LIST_PATTERN = Pattern.compile("There are (\\d+) of a max of (\\d+) players online:\\s*(.*)");

    // Latency replies, tried in order
    Pattern PING_OF_PATTERN = Pattern.compile("(?i)ping of " + PLAYER_NAME + " (?:is|was) ([0-9]+)");
    Pattern PING_POSSESSIVE_PATTERN = Pattern.compile("(?i)" + OWNER_NAME + "'?s ping(?: is|:)? ([0-9]+)");
    Pattern PING_HAS_PATTERN = Pattern.compile("(?i)" + PLAYER_NAME + " has (?:a )?ping(?: of)? ([0-9]+)");
    Pattern LATENCY_PATTERN = Pattern.compile("(?i)" + PLAYER_NAME + "'s latency is ([0-9]+)\\s*ms");
    Pattern PING_NOT_FOUND_PATTERN = Pattern.compile("(?i)player not found or offline");

    String READY_MARKER = "Done (";
    String COMMAND_ECHO = "issued server command: /";
}
