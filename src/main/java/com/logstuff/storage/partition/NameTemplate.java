package com.logstuff.storage.partition;

import java.time.ZonedDateTime;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.List;

/**
 * strftime-style table name template, e.g. {@code logs_%Y_%m}.
 *
 * <p>Supported directives: {@code %Y} year, {@code %m} month, {@code %d} day of month,
 * {@code %H} hour, {@code %M} minute, {@code %j} day of year, {@code %G} ISO week-based
 * year, {@code %V} ISO week, {@code %q} quarter (1-4) and {@code %%}.
 */
public final class NameTemplate {

    private final String pattern;
    private final List<Object> parts;

    private NameTemplate(String pattern, List<Object> parts) {
        this.pattern = pattern;
        this.parts = parts;
    }

    /**
     * @throws PartitionResolutionException on an unknown or dangling directive
     */
    public static NameTemplate parse(String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            throw new PartitionResolutionException("Name template must not be empty", pattern);
        }
        List<Object> parts = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c != '%') {
                literal.append(c);
                continue;
            }
            if (i + 1 >= pattern.length()) {
                throw new PartitionResolutionException("Dangling '%' at end of name template", pattern);
            }
            char directive = pattern.charAt(++i);
            if (directive == '%') {
                literal.append('%');
                continue;
            }
            if ("YmdHMjGVq".indexOf(directive) < 0) {
                throw new PartitionResolutionException("Unsupported directive %" + directive, pattern);
            }
            if (literal.length() > 0) {
                parts.add(literal.toString());
                literal.setLength(0);
            }
            parts.add(directive);
        }
        if (literal.length() > 0) {
            parts.add(literal.toString());
        }
        return new NameTemplate(pattern, List.copyOf(parts));
    }

    public String format(ZonedDateTime time) {
        StringBuilder sb = new StringBuilder();
        for (Object part : parts) {
            if (part instanceof String) {
                sb.append((String) part);
                continue;
            }
            switch ((Character) part) {
                case 'Y' -> sb.append(pad(time.getYear(), 4));
                case 'm' -> sb.append(pad(time.getMonthValue(), 2));
                case 'd' -> sb.append(pad(time.getDayOfMonth(), 2));
                case 'H' -> sb.append(pad(time.getHour(), 2));
                case 'M' -> sb.append(pad(time.getMinute(), 2));
                case 'j' -> sb.append(pad(time.getDayOfYear(), 3));
                case 'G' -> sb.append(pad(time.get(IsoFields.WEEK_BASED_YEAR), 4));
                case 'V' -> sb.append(pad(time.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR), 2));
                case 'q' -> sb.append(time.get(IsoFields.QUARTER_OF_YEAR));
                default -> throw new IllegalStateException("Unexpected directive " + part);
            }
        }
        return sb.toString();
    }

    public String getPattern() {
        return pattern;
    }

    private static String pad(int value, int width) {
        String digits = Integer.toString(value);
        if (digits.length() >= width) {
            return digits;
        }
        return "0".repeat(width - digits.length()) + digits;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof NameTemplate && pattern.equals(((NameTemplate) o).pattern));
    }

    @Override
    public int hashCode() {
        return pattern.hashCode();
    }

    @Override
    public String toString() {
        return pattern;
    }
}
