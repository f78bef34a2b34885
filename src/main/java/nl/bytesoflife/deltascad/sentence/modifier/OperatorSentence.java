package nl.bytesoflife.deltascad.sentence.modifier;

import nl.bytesoflife.deltascad.model.Dimension;
import nl.bytesoflife.deltascad.model.ScadOptions;
import nl.bytesoflife.deltascad.sentence.ModifierSentence;

/**
 * A parameterless operator such as {@code union()}. It takes the dimension of its child.
 */
public abstract class OperatorSentence extends ModifierSentence {

    protected OperatorSentence(String name) {
        super(name, Dimension.MIXED, new ScadOptions());
    }
}
