package mc.supervisor.service.server;

import java.util.Comparator;
import java.util.regex.Pattern;

/** Numeric ordering of dotted Minecraft version strings. */
final class VersionOrder {
    static final Pattern STABLE_RELEASE = Pattern.compile("^\\d+\\.\\d+(\\.\\d+)?$");

    static final Comparator<String> NEWEST_FIRST = (a, b) -> compare(b, a);

    private VersionOrder() {
    }

    static int compare(String a, String b) {
        String[] left = a.split("\\.");
        String[] right = b.split("\\.");
        for (int i = 0; i < Math.max(left.length, right.length); i++) {
            int l = i < left.length ? leadingNumber(left[i]) : 0;
            int r = i < right.length ? leadingNumber(right[i]) : 0;
            if (l != r) {
                return Integer.compare(l, r);
            }
        }
        return 0;
    }

    private static int leadingNumber(String part) {
        int end = 0;
        while (end < part.length() && Character.isDigit(part.charAt(end))) {
            end++;
        }
        return end == 0 ? 0 : Integer.parseInt(part.substring(0, Math.min(end, 9)));
    }
}
