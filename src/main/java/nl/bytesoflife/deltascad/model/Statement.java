package nl.bytesoflife.deltascad.model;

import java.util.List;
import java.util.Objects;

/**
 * Payload of a {@link ScadNode}: a primitive, a modifier with one child, or a block of siblings.
 * Construction validates dimensions, so every statement that exists is sound.
 */
public sealed interface Statement permits Statement.Primitive, Statement.Modifier, Statement.Block {

    Dimension dimension();

    List<ScadNode> children();

    record Primitive(PrimitiveBody body) implements Statement {
        public Primitive {
            Objects.requireNonNull(body, "body");
        }

        @Override
        public Dimension dimension() {
            return body.dimension();
        }

        @Override
        public List<ScadNode> children() {
            return List.of();
        }
    }

    /**
     * @throws DimensionMismatchException if the child does not have the dimension the body requires
     */
    record Modifier(ModifierBody body, ScadNode child) implements Statement {
        public Modifier {
            Objects.requireNonNull(body, "body");
            Objects.requireNonNull(child, "child");
            DimensionMismatch.check(body.childDimension(), child, 0).ifPresent(m -> {
                throw new DimensionMismatchException(m);
            });
        }

        @Override
        public Dimension dimension() {
            return body.dimension() == Dimension.MIXED ? child.dimension() : body.dimension();
        }

        @Override
        public List<ScadNode> children() {
            return List.of(child);
        }
    }

    /**
     * @throws DimensionMismatchException if the children do not share one dimension
     */
    record Block(List<ScadNode> children) implements Statement {
        public Block {
            children = List.copyOf(children);
            DimensionMismatch.checkSiblings(children).ifPresent(m -> {
                throw new DimensionMismatchException(m);
            });
        }

        @Override
        public Dimension dimension() {
            Dimension result = Dimension.MIXED;
            for (ScadNode child : children) {
                result = result.join(child.dimension());
            }
            return result;
        }

        public boolean isEmpty() {
            return children.isEmpty();
        }
    }
}
