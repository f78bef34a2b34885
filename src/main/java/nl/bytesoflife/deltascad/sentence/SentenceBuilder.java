package nl.bytesoflife.deltascad.sentence;

import nl.bytesoflife.deltascad.model.MissingParameterException;

/**
 * Mutable staging object for one sentence. It can be built once; a failed build
 * (missing required parameter) may be corrected and retried.
 *
 * @param <T> the sentence type produced
 */
public abstract class SentenceBuilder<T> {

    private final String statementType;
    private boolean built;

    protected SentenceBuilder(String statementType) {
        this.statementType = statementType;
    }

    /**
     * @return the finished sentence
     * @throws MissingParameterException if a required parameter was not set
     * @throws IllegalStateException     if this builder was already built
     */
    public final T build() {
        if (built) {
            throw new IllegalStateException(statementType + " builder has already been built");
        }
        T result = create();
        built = true;
        return result;
    }

    protected abstract T create();

    protected <V> V require(V value, String fieldName) {
        if (value == null) {
            throw new MissingParameterException(statementType, fieldName);
        }
        return value;
    }

    /**
     * @throws IllegalArgumentException if {@code value} is NaN or infinite
     */
    protected double finite(double value, String fieldName) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(statementType + "." + fieldName + " must be finite, got " + value);
        }
        return value;
    }
}
