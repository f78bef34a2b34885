package nl.bytesoflife.deltascad.value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Literal formatting shared by all SCAD values.
 * Output is locale-independent and never uses exponent notation.
 */
public final class ScadFormat {

    /** Decimal places kept for lengths, angles and other real numbers. */
    public static final int UNIT_PRECISION = 8;

    private ScadFormat() {
    }

    public static String number(double value) {
        return number(value, UNIT_PRECISION);
    }

    /**
     * Format a real number with at most {@code precision} decimal places.
     * Trailing zeros and a trailing decimal point are removed and negative zero prints as {@code 0}.
     *
     * @param value     the number, must be finite
     * @param precision number of decimal places to round to (half-even on the exact binary value)
     * @return the literal
     */
    public static String number(double value, int precision) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Cannot format non-finite number: " + value);
        }
        if (precision < 0) {
            throw new IllegalArgumentException("Precision must be >= 0");
        }
        BigDecimal rounded = new BigDecimal(value).setScale(precision, RoundingMode.HALF_EVEN);
        if (rounded.signum() == 0) {
            return "0";
        }
        return rounded.stripTrailingZeros().toPlainString();
    }

    static void requireFinite(String what, double... values) {
        for (double v : values) {
            if (!Double.isFinite(v)) {
                throw new IllegalArgumentException("Non-finite " + what + " component: " + v);
            }
        }
    }

    public static String integer(long value) {
        return Long.toString(value);
    }

    public static String bool(boolean value) {
        return value ? "true" : "false";
    }

    /**
     * Double-quote a string, escaping backslashes and double quotes.
     */
    public static String quote(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 2);
        sb.append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        sb.append('"');
        return sb.toString();
    }
}
