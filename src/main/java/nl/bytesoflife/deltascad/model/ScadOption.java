package nl.bytesoflife.deltascad.model;

import nl.bytesoflife.deltascad.value.ScadValue;

/**
 * One argument of a SCAD call. An empty name makes the argument positional.
 */
public record ScadOption(String name, ScadValue value) {

    public ScadOption {
        if (name == null) {
            throw new IllegalArgumentException("Option name must not be null, use \"\" for positional");
        }
        if (value == null) {
            throw new IllegalArgumentException("Option '" + name + "' has no value");
        }
    }

    public static ScadOption positional(ScadValue value) {
        return new ScadOption("", value);
    }

    public boolean isPositional() {
        return name.isEmpty();
    }

    @Override
    public String toString() {
        return isPositional() ? value.repr() : name + " = " + value.repr();
    }
}
