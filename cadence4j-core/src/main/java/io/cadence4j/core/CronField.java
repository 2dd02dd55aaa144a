package io.cadence4j.core;

import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One parsed field of a five-field cron expression.
 *
 * <p>Supported selectors:
 * <ul>
 *   <li>{@code *}: any value</li>
 *   <li>{@code n}: a literal value (leading zeros allowed, e.g. {@code 00})</li>
 *   <li>{@code *}{@code /n}: every value where {@code value % n == 0}</li>
 *   <li>{@code a-b}: inclusive range</li>
 *   <li>{@code a,b,c-d}: list of literals and ranges</li>
 * </ul>
 */
public final class CronField {

    private final String name;
    private final String source;
    private final int min;
    private final int max;
    private final boolean wildcard;
    private final int step;
    private final SortedSet<Integer> values;

    private CronField(String name, String source, int min, int max, boolean wildcard, int step, SortedSet<Integer> values) {
        this.name = name;
        this.source = source;
        this.min = min;
        this.max = max;
        this.wildcard = wildcard;
        this.step = step;
        this.values = values;
    }

    public static CronField parse(String name, String source, int min, int max) {
        Objects.requireNonNull(source, name + " field must not be null");
        String s = source.trim();
        if (s.isEmpty()) {
            throw new CronFormatException("Empty " + name + " field");
        }

        if ("*".equals(s)) {
            return new CronField(name, s, min, max, true, 0, null);
        }

        if (s.startsWith("*/")) {
            int step = parseNumber(name, s.substring(2));
            if (step <= 0 || step > max) {
                throw new CronFormatException("Invalid step for " + name + " field: " + s);
            }
            return new CronField(name, s, min, max, false, step, null);
        }

        SortedSet<Integer> values = new TreeSet<>();
        for (String part : s.split(",", -1)) {
            if (part.isEmpty()) {
                throw new CronFormatException("Invalid list in " + name + " field: " + s);
            }
            int dash = part.indexOf('-');
            if (dash > 0) {
                int from = checkRange(name, parseNumber(name, part.substring(0, dash)), min, max);
                int to = checkRange(name, parseNumber(name, part.substring(dash + 1)), min, max);
                if (from > to) {
                    throw new CronFormatException("Invalid range in " + name + " field: " + part);
                }
                for (int v = from; v <= to; v++) {
                    values.add(v);
                }
            } else {
                values.add(checkRange(name, parseNumber(name, part), min, max));
            }
        }
        return new CronField(name, s, min, max, false, 0, Collections.unmodifiableSortedSet(values));
    }

    /**
     * Field matching an explicit set of values, used when weekdays are appended to a rule.
     */
    public static CronField of(String name, SortedSet<Integer> values, int min, int max) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("values must not be empty");
        }
        StringBuilder sb = new StringBuilder();
        for (Integer v : values) {
            checkRange(name, v, min, max);
            if (sb.length() > 0) {
                sb.append(',');
            }
            sb.append(v);
        }
        return new CronField(name, sb.toString(), min, max, false, 0,
                Collections.unmodifiableSortedSet(new TreeSet<>(values)));
    }

    public boolean matches(int value) {
        if (wildcard) {
            return true;
        }
        if (step > 0) {
            return value % step == 0;
        }
        return values.contains(value);
    }

    public boolean isWildcard() {
        return wildcard;
    }

    /**
     * Every value of the field's range this field matches, in ascending order.
     */
    public SortedSet<Integer> expand() {
        if (values != null) {
            return values;
        }
        SortedSet<Integer> all = new TreeSet<>();
        for (int v = min; v <= max; v++) {
            if (matches(v)) {
                all.add(v);
            }
        }
        return Collections.unmodifiableSortedSet(all);
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return source;
    }

    private static int parseNumber(String name, String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            throw new CronFormatException("Invalid value in " + name + " field: " + raw);
        }
    }

    private static int checkRange(String name, int value, int min, int max) {
        if (value < min || value > max) {
            throw new CronFormatException(
                    name + " value out of range [" + min + "-" + max + "]: " + value);
        }
        return value;
    }
}
