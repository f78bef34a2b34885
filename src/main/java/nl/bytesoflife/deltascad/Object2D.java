package nl.bytesoflife.deltascad;

import nl.bytesoflife.deltascad.model.Dimension;
import nl.bytesoflife.deltascad.model.PrimitiveBody;
import nl.bytesoflife.deltascad.model.ScadNode;

/**
 * Handle for a 2D node, e.g. a {@code square()} or anything transformed from one.
 */
public final class Object2D extends TypedObject<Object2D> {

    private Object2D(ScadNode node) {
        super(node, Dimension.TWO_D);
    }

    /**
     * @throws IllegalArgumentException if the node is not 2D
     */
    public static Object2D of(ScadNode node) {
        return new Object2D(node);
    }

    /**
     * @throws IllegalArgumentException if the primitive is not 2D
     */
    public static Object2D of(PrimitiveBody body) {
        return new Object2D(Scad.primitive(body));
    }

    @Override
    Object2D wrap(ScadNode node) {
        return new Object2D(node);
    }
}
