package nl.bytesoflife.deltascad.sentence;

import nl.bytesoflife.deltascad.model.Dimension;
import nl.bytesoflife.deltascad.model.PrimitiveBody;
import nl.bytesoflife.deltascad.model.ScadOptions;

/**
 * Base class for leaf sentences.
 */
public abstract class PrimitiveSentence extends AbstractSentence implements PrimitiveBody {

    protected PrimitiveSentence(String name, Dimension dimension, ScadOptions options) {
        super(name, dimension, options);
    }
}
