package com.umitunal.cronlite.schedule;

import com.umitunal.cronlite.core.InvalidExpressionException;

import java.util.BitSet;
import java.util.List;
import java.util.Locale;

/**
 * One parsed field of a cron expression: the set of values it accepts.
 */
final class CronField {

    enum Type {
        SECOND("second", 0, 59, List.of()),
        MINUTE("minute", 0, 59, List.of()),
        HOUR("hour", 0, 23, List.of()),
        DAY_OF_MONTH("day-of-month", 1, 31, List.of()),
        MONTH("month", 1, 12, List.of("JAN", "FEB", "MAR", "APR", "MAY", "JUN",
                                      "JUL", "AUG", "SEP", "OCT", "NOV", "DEC")),
        DAY_OF_WEEK("day-of-week", 0, 7, List.of("SUN", "MON", "TUE", "WED", "THU", "FRI", "SAT"));

        private final String label;
        private final int min;
        private final int max;
        private final List<String> names;

        Type(String label, int min, int max, List<String> names) {
            this.label = label;
            this.min = min;
            this.max = max;
            this.names = names;
        }

        boolean allowsQuestionMark() {
            return this == DAY_OF_MONTH || this == DAY_OF_WEEK;
        }

        // Sunday is both 0 and 7; wildcards only need 0-6
        int wildcardMax() {
            return this == DAY_OF_WEEK ? 6 : max;
        }
    }

    private final Type type;
    private final BitSet values;
    private final boolean restricted;

    private CronField(Type type, BitSet values, boolean restricted) {
        this.type = type;
        this.values = values;
        this.restricted = restricted;
    }

    static CronField parse(Type type, String text, String expression) {
        if (text.equals("?") && !type.allowsQuestionMark()) {
            throw invalid(expression, type, "'?' is only allowed in day fields");
        }

        BitSet values = new BitSet(type.max + 1);
        for (String part : text.split(",", -1)) {
            if (part.isEmpty()) {
                throw invalid(expression, type, "empty list element in '" + text + "'");
            }
            parsePart(type, part, values, expression);
        }

        if (type == Type.DAY_OF_WEEK && values.get(7)) {
            values.clear(7);
            values.set(0);
        }

        boolean restricted = !text.startsWith("*") && !text.equals("?");
        return new CronField(type, values, restricted);
    }

    private static void parsePart(Type type, String part, BitSet values, String expression) {
        String range = part;
        int step = 1;
        boolean stepped = false;

        int slash = part.indexOf('/');
        if (slash >= 0) {
            range = part.substring(0, slash);
            step = parseNumber(type, part.substring(slash + 1), expression);
            stepped = true;
            if (step <= 0) {
                throw invalid(expression, type, "step must be positive in '" + part + "'");
            }
        }

        int low;
        int high;
        if (range.equals("*") || range.equals("?")) {
            low = type.min;
            high = type.wildcardMax();
        } else {
            int dash = range.indexOf('-');
            if (dash > 0) {
                low = parseValue(type, range.substring(0, dash), expression);
                high = parseValue(type, range.substring(dash + 1), expression);
                if (low > high) {
                    throw invalid(expression, type, "inverted range '" + range + "'");
                }
            } else {
                low = parseValue(type, range, expression);
                high = stepped ? type.wildcardMax() : low;
            }
        }

        for (int value = low; value <= high; value += step) {
            values.set(value);
        }
    }

    private static int parseValue(Type type, String token, String expression) {
        int index = type.names.indexOf(token.toUpperCase(Locale.ROOT));
        if (index >= 0) {
            return type == Type.MONTH ? index + 1 : index;
        }

        int value = parseNumber(type, token, expression);
        if (value < type.min || value > type.max) {
            throw invalid(expression, type,
                    String.format("value %d out of range [%d, %d]", value, type.min, type.max));
        }
        return value;
    }

    private static int parseNumber(Type type, String token, String expression) {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw invalid(expression, type, "unrecognized token '" + token + "'");
        }
    }

    private static InvalidExpressionException invalid(String expression, Type type, String reason) {
        return new InvalidExpressionException(expression, type.label + " field: " + reason);
    }

    boolean matches(int value) {
        return values.get(value);
    }

    /**
     * Smallest accepted value >= from, or -1.
     */
    int nextOrSame(int from) {
        return values.nextSetBit(from);
    }

    /**
     * False when the field was written as a wildcard.
     */
    boolean isRestricted() {
        return restricted;
    }

    Type getType() {
        return type;
    }

    @Override
    public String toString() {
        return type.label + "=" + values;
    }
}
