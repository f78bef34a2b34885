package nl.bytesoflife.deltascad.sentence;

import nl.bytesoflife.deltascad.model.Dimension;
import nl.bytesoflife.deltascad.model.ModifierBody;
import nl.bytesoflife.deltascad.model.ScadOptions;

/**
 * Base class for sentences that apply to a child.
 */
public abstract class ModifierSentence extends AbstractSentence implements ModifierBody {

    private final Dimension childDimension;

    protected ModifierSentence(String name, Dimension dimension, Dimension childDimension, ScadOptions options) {
        super(name, dimension, options);
        this.childDimension = childDimension;
    }

    /**
     * A modifier whose child has the same dimension as its output.
     */
    protected ModifierSentence(String name, Dimension dimension, ScadOptions options) {
        this(name, dimension, dimension, options);
    }

    @Override
    public Dimension childDimension() {
        return childDimension;
    }
}
