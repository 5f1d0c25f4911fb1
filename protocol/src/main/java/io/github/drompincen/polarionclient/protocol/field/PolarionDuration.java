package io.github.drompincen.polarionclient.protocol.field;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses and formats Polarion durations such as {@code "2d 3h 30m"}.
 * A day is 24 hours; units are d, h, m and s.
 */
public final class PolarionDuration {

    private static final Pattern PART = Pattern.compile("(\\d+)\\s*([dhms])");

    private PolarionDuration() {}

    public static Duration parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Duration text is empty");
        }
        String trimmed = text.trim();
        Matcher m = PART.matcher(trimmed);
        Duration total = Duration.ZERO;
        int consumed = 0;
        while (m.find()) {
            if (!trimmed.substring(consumed, m.start()).isBlank()) {
                throw new IllegalArgumentException("Invalid duration: " + text);
            }
            long amount = Long.parseLong(m.group(1));
            total = switch (m.group(2)) {
                case "d" -> total.plusDays(amount);
                case "h" -> total.plusHours(amount);
                case "m" -> total.plusMinutes(amount);
                default -> total.plusSeconds(amount);
            };
            consumed = m.end();
        }
        if (consumed == 0 || !trimmed.substring(consumed).isBlank()) {
            throw new IllegalArgumentException("Invalid duration: " + text);
        }
        return total;
    }

    public static String format(Duration duration) {
        if (duration == null || duration.isZero()) {
            return "0s";
        }
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Negative duration: " + duration);
        }
        StringBuilder sb = new StringBuilder();
        append(sb, duration.toDays(), 'd');
        append(sb, duration.toHoursPart(), 'h');
        append(sb, duration.toMinutesPart(), 'm');
        append(sb, duration.toSecondsPart(), 's');
        return sb.toString();
    }

    private static void append(StringBuilder sb, long amount, char unit) {
        if (amount == 0) {
            return;
        }
        if (sb.length() > 0) {
            sb.append(' ');
        }
        sb.append(amount).append(unit);
    }
}
