package nl.bytesoflife.deltascad.sentence.modifier;

public final class Intersection extends OperatorSentence {

    public Intersection() {
        super("intersection");
    }
}
