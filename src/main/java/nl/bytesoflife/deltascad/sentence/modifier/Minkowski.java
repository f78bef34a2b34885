package nl.bytesoflife.deltascad.sentence.modifier;

/**
 * {@code minkowski()}: Minkowski sum of the children.
 */
public final class Minkowski extends OperatorSentence {

    public Minkowski() {
        super("minkowski");
    }
}
