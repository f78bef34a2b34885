package nl.bytesoflife.deltascad.model;

/**
 * Thrown by the eager composition paths when a child's dimension does not fit.
 * The recoverable paths report the same {@link DimensionMismatch} through {@link CompositionResult}.
 */
public class DimensionMismatchException extends ScadException {

    private final DimensionMismatch mismatch;

    public DimensionMismatchException(DimensionMismatch mismatch) {
        this(mismatch.describe(), mismatch);
    }

    public DimensionMismatchException(String message, DimensionMismatch mismatch) {
        super(message);
        this.mismatch = mismatch;
    }

    public DimensionMismatch getMismatch() {
        return mismatch;
    }
}
