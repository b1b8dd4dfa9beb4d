package mc.supervisor.service.console;

/**
 * Groups of commands the supervisor issues on its own. Replies to them are hidden from viewers
 * for a short window after the supervisor last sent one.
 */
public enum CommandFamily {
    TPS,
    ROSTER,
    LATENCY
}
