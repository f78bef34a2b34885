package nl.bytesoflife.deltascad.sentence.modifier;

/**
 * {@code difference()}: The first child minus all following ones.
 */
public final class Difference extends OperatorSentence {

    public Difference() {
        super("difference");
    }
}
