package nl.bytesoflife.deltascad.value;

/**
 * Color argument of {@code color()}.
 * Numeric colors are passed as {@code c = [...]}; named colors are passed positionally.
 */
public sealed interface Color extends ScadValue permits Color.Rgb, Color.Rgba, Color.Named {

    /**
     * @return the parameter name to use in SCAD code, empty for a positional argument
     */
    String parameterName();

    static Rgb rgb(double r, double g, double b) {
        return new Rgb(r, g, b);
    }

    static Rgba rgba(double r, double g, double b, double a) {
        return new Rgba(r, g, b, a);
    }

    static Named named(String name) {
        return new Named(name);
    }

    record Rgb(double r, double g, double b) implements Color {
        public Rgb {
            ScadFormat.requireFinite("color", r, g, b);
        }

        @Override
        public String parameterName() {
            return "c";
        }

        @Override
        public String repr() {
            return ScadValue.vector(r, g, b).repr();
        }
    }

    record Rgba(double r, double g, double b, double a) implements Color {
        public Rgba {
            ScadFormat.requireFinite("color", r, g, b, a);
        }

        @Override
        public String parameterName() {
            return "c";
        }

        @Override
        public String repr() {
            return ScadValue.vector(r, g, b, a).repr();
        }
    }

    /**
     * A color name or hex code such as {@code "red"} or {@code "#C0FFEE"}.
     */
    record Named(String name) implements Color {
        public Named {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Color name must not be blank");
            }
        }

        @Override
        public String parameterName() {
            return "";
        }

        @Override
        public String repr() {
            return ScadFormat.quote(name);
        }
    }
}
