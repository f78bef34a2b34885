package nl.bytesoflife.deltascad.sentence.modifier;

/**
 * {@code hull()}: Convex hull of the children.
 */
public final class Hull extends OperatorSentence {

    public Hull() {
        super("hull");
    }
}
