package nl.bytesoflife.deltascad.model;

import nl.bytesoflife.deltascad.value.ScadValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the options of a statement in output order, dropping absent ones.
 */
public final class ScadOptions {

    private final List<ScadOption> options = new ArrayList<>();

    public ScadOptions add(String name, ScadValue value) {
        options.add(new ScadOption(name, value));
        return this;
    }

    public ScadOptions positional(ScadValue value) {
        options.add(ScadOption.positional(value));
        return this;
    }

    public ScadOptions addIfPresent(String name, ScadValue value) {
        if (value != null) {
            add(name, value);
        }
        return this;
    }

    public ScadOptions number(String name, Double value) {
        return value == null ? this : add(name, ScadValue.of(value.doubleValue()));
    }

    public ScadOptions integer(String name, Long value) {
        return value == null ? this : add(name, ScadValue.of(value.longValue()));
    }

    public ScadOptions bool(String name, Boolean value) {
        return value == null ? this : add(name, ScadValue.of(value.booleanValue()));
    }

    public ScadOptions text(String name, String value) {
        return value == null ? this : add(name, ScadValue.text(value));
    }

    /**
     * The {@code $fa}, {@code $fn} and {@code $fs} resolution options, in that order.
     */
    public ScadOptions resolution(Double fa, Long fn, Double fs) {
        return number("$fa", fa).integer("$fn", fn).number("$fs", fs);
    }

    public List<ScadOption> toList() {
        return List.copyOf(options);
    }
}
