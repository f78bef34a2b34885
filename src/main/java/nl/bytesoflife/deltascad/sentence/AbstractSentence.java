package nl.bytesoflife.deltascad.sentence;

import nl.bytesoflife.deltascad.model.Dimension;
import nl.bytesoflife.deltascad.model.ScadOption;
import nl.bytesoflife.deltascad.model.ScadOptions;
import nl.bytesoflife.deltascad.model.ScadSentence;
import nl.bytesoflife.deltascad.render.ScadRenderer;

import java.util.List;
import java.util.Objects;

/**
 * Common state of catalog sentences. Options are formatted once, at construction.
 */
public abstract class AbstractSentence implements ScadSentence {

    private final String name;
    private final Dimension dimension;
    private final List<ScadOption> options;

    protected AbstractSentence(String name, Dimension dimension, ScadOptions options) {
        this.name = name;
        this.dimension = dimension;
        this.options = options.toList();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Dimension dimension() {
        return dimension;
    }

    @Override
    public List<ScadOption> options() {
        return options;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AbstractSentence that = (AbstractSentence) o;
        return name.equals(that.name) && dimension == that.dimension && options.equals(that.options);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), name, dimension, options);
    }

    @Override
    public String toString() {
        return ScadRenderer.header(this);
    }
}
