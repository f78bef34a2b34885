package nl.bytesoflife.deltascad.sentence;

import nl.bytesoflife.deltascad.model.ScadOptions;
import nl.bytesoflife.deltascad.value.ScadValue;

/**
 * Size of a round shape, either a radius ({@code r}) or a diameter ({@code d}).
 */
public record RoundSize(String parameterName, double value) {

    public RoundSize {
        if (!"r".equals(parameterName) && !"d".equals(parameterName)) {
            throw new IllegalArgumentException("Round size must be 'r' or 'd', got '" + parameterName + "'");
        }
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Round size must be finite, got " + value);
        }
    }

    public static RoundSize radius(double r) {
        return new RoundSize("r", r);
    }

    public static RoundSize diameter(double d) {
        return new RoundSize("d", d);
    }

    /**
     * Add this size as an option, with {@code suffix} appended to its name ({@code r1}, {@code d2}).
     */
    public void addTo(ScadOptions options, String suffix) {
        options.add(parameterName + suffix, ScadValue.of(value));
    }

    public void addTo(ScadOptions options) {
        addTo(options, "");
    }
}
