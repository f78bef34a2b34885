package nl.bytesoflife.deltascad;

import nl.bytesoflife.deltascad.model.Dimension;
import nl.bytesoflife.deltascad.model.ScadNode;

import java.util.Objects;

/**
 * A node whose dimension is fixed in its Java type, so boolean operations between
 * a 2D and a 3D object do not compile.
 *
 * @param <T> the concrete handle type
 */
public abstract class TypedObject<T extends TypedObject<T>> {

    private final ScadNode node;

    TypedObject(ScadNode node, Dimension dimension) {
        Objects.requireNonNull(node, "node");
        if (node.dimension() != dimension) {
            throw new IllegalArgumentException("Expected an " + dimension.getLabel() + " node, got "
                    + node.dimension().getLabel());
        }
        this.node = node;
    }

    abstract T wrap(ScadNode node);

    public ScadNode node() {
        return node;
    }

    public T union(T other) {
        return wrap(Scad.union(node, other.node()));
    }

    public T difference(T other) {
        return wrap(Scad.difference(node, other.node()));
    }

    public T intersection(T other) {
        return wrap(Scad.intersection(node, other.node()));
    }

    public T commented(String comment) {
        return wrap(node.commented(comment));
    }

    public String toCode() {
        return node.toCode();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return node.equals(((TypedObject<?>) o).node);
    }

    @Override
    public int hashCode() {
        return node.hashCode();
    }

    @Override
    public String toString() {
        return node.toString();
    }
}
