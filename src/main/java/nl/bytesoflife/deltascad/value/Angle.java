package nl.bytesoflife.deltascad.value;

/**
 * An angle, held in degrees since that is the unit SCAD uses.
 */
public record Angle(double degrees) implements ScadValue {

    public Angle {
        if (!Double.isFinite(degrees)) {
            throw new IllegalArgumentException("Angle must be finite, got " + degrees);
        }
    }

    public static Angle deg(double degrees) {
        return new Angle(degrees);
    }

    public static Angle rad(double radians) {
        return new Angle(Math.toDegrees(radians));
    }

    public double radians() {
        return Math.toRadians(degrees);
    }

    @Override
    public String repr() {
        return ScadFormat.number(degrees);
    }
}
