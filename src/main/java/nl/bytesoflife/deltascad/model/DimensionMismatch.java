package nl.bytesoflife.deltascad.model;

import java.util.List;
import java.util.Optional;

/**
 * A child whose dimension does not fit where it was placed.
 *
 * @param expected   dimension required at that position
 * @param actual     dimension of the offending child
 * @param childIndex position of the child among its siblings
 */
public record DimensionMismatch(Dimension expected, Dimension actual, int childIndex) {

    /**
     * Check a single child against the dimension its parent requires.
     */
    public static Optional<DimensionMismatch> check(Dimension required, ScadNode child, int childIndex) {
        if (child.dimension().isCompatibleWith(required)) {
            return Optional.empty();
        }
        return Optional.of(new DimensionMismatch(required, child.dimension(), childIndex));
    }

    /**
     * Check that the children of a block agree. The first concrete dimension sets the expectation.
     */
    public static Optional<DimensionMismatch> checkSiblings(List<ScadNode> children) {
        Dimension expected = Dimension.MIXED;
        for (int i = 0; i < children.size(); i++) {
            Dimension actual = children.get(i).dimension();
            if (!actual.isCompatibleWith(expected)) {
                return Optional.of(new DimensionMismatch(expected, actual, i));
            }
            expected = expected.join(actual);
        }
        return Optional.empty();
    }

    public String describe() {
        return "Dimension mismatch at child " + childIndex + ": expected " + expected + ", got " + actual;
    }
}
