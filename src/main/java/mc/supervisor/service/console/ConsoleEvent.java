package mc.supervisor.service.console;

import java.util.List;

/** Something a console line says about the server's state. */
public interface ConsoleEvent {

    /** Family of supervisor-issued command this event answers, or null if it is ordinary output. */
    default CommandFamily family() {
        return null;
    }

    record ServerReady() implements ConsoleEvent {
    }

    record PlayerJoined(String name, String address) implements ConsoleEvent {
    }

    record PlayerLeft(String name) implements ConsoleEvent {
    }

    record TpsReported(double tps) implements ConsoleEvent {
        @Override
        public CommandFamily family() {
            return CommandFamily.TPS;
        }
    }

    record WorldReported(String name, String world) implements ConsoleEvent {
        @Override
        public CommandFamily family() {
            return CommandFamily.ROSTER;
        }
    }

    /** Authoritative list of online names. */
    record RosterReported(List<String> names) implements ConsoleEvent {
        @Override
        public CommandFamily family() {
            return CommandFamily.ROSTER;
        }
    }

    record LatencyReported(String name, int latency) implements ConsoleEvent {
        @Override
        public CommandFamily family() {
            return CommandFamily.LATENCY;
        }
    }

    /** The last latency query named a player the server does not know. */
    record LatencyTargetMissing() implements ConsoleEvent {
        @Override
        public CommandFamily family() {
            return CommandFamily.LATENCY;
        }
    }

    /** The server echoed one of the supervisor's own commands back. */
    record CommandEcho(CommandFamily echoed) implements ConsoleEvent {
        @Override
        public CommandFamily family() {
            return echoed;
        }
    }
}
