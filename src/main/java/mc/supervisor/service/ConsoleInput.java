package mc.supervisor.service;

import java.io.IOException;
import java.io.Writer;

/** Writes command lines to a child's stdin without holding the instance lock during the write. */
public final class ConsoleInput {

    private ConsoleInput() {
    }

    /** Returns false if the instance has no open stdin. */
    public static boolean writeLine(InstanceRuntime runtime, String text) throws IOException {
        Writer stdin;
        try (LockHold ignored = runtime.getLock().read()) {
            stdin = runtime.getStdin();
        }
        if (stdin == null) {
            return false;
        }
        synchronized (stdin) {
            stdin.write(text);
            stdin.write('\n');
            stdin.flush();
        }
        return true;
    }
}
