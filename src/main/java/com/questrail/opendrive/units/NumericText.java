package com.questrail.opendrive.units;

import java.util.regex.Pattern;

/**
 * NumericText
 * -----------------------------------------------------------------------------
 * Canonical text form of floating-point attribute values.
 *
 * <h2>Accepted grammar</h2>
 * <pre>
 *   [+-]? ( digits ( '.' digits? )? | '.' digits ) ( [eE] [+-]? digits )?
 * </pre>
 * <p>plus the XML Schema special values {@code INF}, {@code -INF} and
 * {@code NaN}. Leading and trailing whitespace is tolerated (attribute values
 * are whitespace-collapsed by the schema); anything else, including hexadecimal
 * literals, type suffixes and trailing garbage, is rejected. A literal whose
 * magnitude overflows a {@code double} is rejected rather than silently becoming
 * infinite.</p>
 *
 * <h2>Output form</h2>
 * <p>Finite values are written with {@link Double#toString(double)}, which
 * re-parses to exactly the same {@code double}. Non-finite values use the
 * XML Schema tokens. No unit suffix is ever written; the unit of a field is
 * fixed by its position in the schema.</p>
 */
public final class NumericText
{
    private static final Pattern DECIMAL =
            Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private NumericText() {
    }

    /**
     * Parses a decimal literal.
     *
     * @param raw attribute text
     * @return the parsed value
     * @throws NumberFormatException if {@code raw} is not a decimal literal or overflows
     */
    public static double parse(String raw) {
        if (raw == null) {
            throw new NumberFormatException("null numeric text");
        }
        String text = raw.strip();
        switch (text) {
            case "INF", "+INF" -> {
                return Double.POSITIVE_INFINITY;
            }
            case "-INF" -> {
                return Double.NEGATIVE_INFINITY;
            }
            case "NaN" -> {
                return Double.NaN;
            }
            default -> {
            }
        }
        if (!DECIMAL.matcher(text).matches()) {
            throw new NumberFormatException("not a decimal literal: '" + raw + "'");
        }
        double value = Double.parseDouble(text);
        if (Double.isInfinite(value)) {
            throw new NumberFormatException("magnitude out of range: '" + raw + "'");
        }
        return value;
    }

    /**
     * Parses an integer attribute ({@code xs:int} / {@code xs:integer} subset).
     *
     * @throws NumberFormatException if {@code raw} is not an integer literal
     */
    public static int parseInt(String raw) {
        if (raw == null) {
            throw new NumberFormatException("null integer text");
        }
        String text = raw.strip();
        if (text.startsWith("+")) {
            text = text.substring(1);
        }
        return Integer.parseInt(text);
    }

    public static String format(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (value == Double.POSITIVE_INFINITY) {
            return "INF";
        }
        if (value == Double.NEGATIVE_INFINITY) {
            return "-INF";
        }
        return Double.toString(value);
    }

    public static String format(int value) {
        return Integer.toString(value);
    }
}
