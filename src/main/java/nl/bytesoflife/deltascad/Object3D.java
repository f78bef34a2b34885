package nl.bytesoflife.deltascad;

import nl.bytesoflife.deltascad.model.Dimension;
import nl.bytesoflife.deltascad.model.PrimitiveBody;
import nl.bytesoflife.deltascad.model.ScadNode;

/**
 * Handle for a 3D node, e.g. a {@code cube()} or anything transformed from one.
 */
public final class Object3D extends TypedObject<Object3D> {

    private Object3D(ScadNode node) {
        super(node, Dimension.THREE_D);
    }

    /**
     * @throws IllegalArgumentException if the node is not 3D
     */
    public static Object3D of(ScadNode node) {
        return new Object3D(node);
    }

    /**
     * @throws IllegalArgumentException if the primitive is not 3D
     */
    public static Object3D of(PrimitiveBody body) {
        return new Object3D(Scad.primitive(body));
    }

    @Override
    Object3D wrap(ScadNode node) {
        return new Object3D(node);
    }
}
