package nl.bytesoflife.deltascad.model;

/**
 * A sentence applied to one child, e.g. {@code translate()} or {@code union()}.
 * The child dimension may differ from the produced dimension:
 * {@code linear_extrude()} makes 3D output from a 2D child.
 * A modifier whose {@link #dimension()} is {@link Dimension#MIXED} takes the dimension of its child.
 */
public interface ModifierBody extends ScadSentence {

    /**
     * @return the dimension required of the child
     */
    Dimension childDimension();
}
