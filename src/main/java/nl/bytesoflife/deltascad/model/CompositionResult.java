package nl.bytesoflife.deltascad.model;

import java.util.Optional;

/**
 * Outcome of a recoverable composition: either the composed node or the mismatch that prevented it.
 */
public sealed interface CompositionResult permits CompositionResult.Success, CompositionResult.Failure {

    boolean isSuccess();

    Optional<ScadNode> toOptional();

    /**
     * @return the composed node
     * @throws DimensionMismatchException if the composition failed
     */
    ScadNode orElseThrow();

    record Success(ScadNode node) implements CompositionResult {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<ScadNode> toOptional() {
            return Optional.of(node);
        }

        @Override
        public ScadNode orElseThrow() {
            return node;
        }
    }

    record Failure(DimensionMismatch mismatch) implements CompositionResult {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<ScadNode> toOptional() {
            return Optional.empty();
        }

        @Override
        public ScadNode orElseThrow() {
            throw new DimensionMismatchException(mismatch);
        }
    }
}
