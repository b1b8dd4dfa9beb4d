package mc.supervisor.service.console;

import lombok.extern.slf4j.Slf4j;
import mc.supervisor.service.console.ConsoleEvent.CommandEcho;
import mc.supervisor.service.console.ConsoleEvent.LatencyReported;
import mc.supervisor.service.console.ConsoleEvent.LatencyTargetMissing;
import mc.supervisor.service.console.ConsoleEvent.PlayerJoined;
import mc.supervisor.service.console.ConsoleEvent.PlayerLeft;
import mc.supervisor.service.console.ConsoleEvent.RosterReported;
import mc.supervisor.service.console.ConsoleEvent.ServerReady;
import mc.supervisor.service.console.ConsoleEvent.TpsReported;
import mc.supervisor.service.console.ConsoleEvent.WorldReported;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static mc.supervisor.service.console.LogPatterns.*;

/**
 * Turns one line of server output into the state changes it implies. Stateless: whether a reply
 * should be hidden and which player a latency error refers to is decided by the caller.
 */
@Slf4j
public final class ConsoleLineParser {

    private static final List<Pattern> LATENCY_PATTERNS = List.of(
            PING_OF_PATTERN, PING_POSSESSIVE_PATTERN, PING_HAS_PATTERN, LATENCY_PATTERN);

    private ConsoleLineParser() {
    }

    public static String clean(String line) {
        String text = ANSI_PATTERN.matcher(line).replaceAll("");
        text = COLOR_CODE_PATTERN.matcher(text).replaceAll("");
        int end = text.length();
        while (end > 0 && (text.charAt(end - 1) == ' ' || text.charAt(end - 1) == '\r')) {
            end--;
        }
        return text.substring(0, end);
    }

    public static List<ConsoleEvent> parse(String line) {
        String clean = clean(line);
        List<ConsoleEvent> events = new ArrayList<>();

        if (clean.contains(READY_MARKER) && (clean.contains("! For help,") || clean.contains(")!"))) {
            events.add(new ServerReady());
        }

        Matcher join = PLAYER_JOIN_PATTERN.matcher(clean);
        if (join.find()) {
            events.add(new PlayerJoined(join.group(1), join.group(2)));
        }

        Matcher leave = PLAYER_LEAVE_PATTERN.matcher(clean);
        if (leave.find()) {
            events.add(new PlayerLeft(leave.group(1)));
        }

        parseTps(clean, events);

        Matcher dimension = DIMENSION_PATTERN.matcher(clean);
        if (dimension.find()) {
            events.add(new WorldReported(dimension.group(1), worldLabel(dimension.group(2))));
        }

        Matcher list = LIST_PATTERN.matcher(clean);
        if (list.find()) {
            events.add(new RosterReported(splitNames(list.group(3))));
        }

        parseLatency(clean, events);
        parseEchoes(clean, events);
        return events;
    }

    private static void parseTps(String clean, List<ConsoleEvent> events) {
        Matcher paper = TPS_PATTERN.matcher(clean);
        if (paper.find()) {
            addTps(paper.group(1), events);
        }
        Matcher forge = FORGE_TPS_PATTERN.matcher(clean);
        if (forge.find()) {
            addTps(forge.group(1) != null ? forge.group(1) : forge.group(2), events);
        }
        Matcher simple = SIMPLE_TPS_PATTERN.matcher(clean);
        if (simple.find()) {
            addTps(simple.group(1), events);
        }
    }

    private static void addTps(String value, List<ConsoleEvent> events) {
        try {
            events.add(new TpsReported(Double.parseDouble(value)));
        } catch (NumberFormatException e) {
            // still a reply to the tps command even if the number is garbled
            log.debug("Unparseable TPS value '{}'", value);
            events.add(new CommandEcho(CommandFamily.TPS));
        }
    }

    private static void parseLatency(String clean, List<ConsoleEvent> events) {
        for (Pattern pattern : LATENCY_PATTERNS) {
            Matcher matcher = pattern.matcher(clean);
            if (matcher.find()) {
                try {
                    events.add(new LatencyReported(matcher.group(1), Integer.parseInt(matcher.group(2))));
                } catch (NumberFormatException e) {
                    events.add(new CommandEcho(CommandFamily.LATENCY));
                }
                return;
            }
        }
        if (PING_NOT_FOUND_PATTERN.matcher(clean).find()) {
            events.add(new LatencyTargetMissing());
        }
    }

    private static void parseEchoes(String clean, List<ConsoleEvent> events) {
        if (clean.contains(COMMAND_ECHO + "tps")) {
            events.add(new CommandEcho(CommandFamily.TPS));
        }
        if (clean.contains(COMMAND_ECHO + "minecraft:list")
                || clean.contains(COMMAND_ECHO + "list")
                || clean.contains(COMMAND_ECHO + "data")
                || clean.contains("No entity was found")) {
            events.add(new CommandEcho(CommandFamily.ROSTER));
        }
        if (clean.contains(COMMAND_ECHO + "ping") || clean.contains(COMMAND_ECHO + "essentials:ping")) {
            events.add(new CommandEcho(CommandFamily.LATENCY));
        }
    }

    static String worldLabel(String dimension) {
        switch (dimension) {
            case "overworld":
                return "Overworld";
            case "the_nether":
                return "Nether";
            case "the_end":
                return "The End";
            default:
                return dimension;
        }
    }

    private static List<String> splitNames(String names) {
        String trimmed = names == null ? "" : names.trim();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(trimmed.split(","))
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .toList();
    }
}
