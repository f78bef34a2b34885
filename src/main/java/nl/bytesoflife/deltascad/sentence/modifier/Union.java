package nl.bytesoflife.deltascad.sentence.modifier;

public final class Union extends OperatorSentence {

    public Union() {
        super("union");
    }
}
