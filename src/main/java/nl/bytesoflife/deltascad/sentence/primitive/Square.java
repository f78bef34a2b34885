package nl.bytesoflife.deltascad.sentence.primitive;

import nl.bytesoflife.deltascad.model.Dimension;
import nl.bytesoflife.deltascad.model.ScadOptions;
import nl.bytesoflife.deltascad.sentence.PrimitiveSentence;
import nl.bytesoflife.deltascad.sentence.SentenceBuilder;
import nl.bytesoflife.deltascad.value.ScadValue;
import org.locationtech.jts.geom.Coordinate;

import java.util.function.Consumer;

/**
 * {@code square()}: a square or rectangle in the first quadrant, or centered on the origin.
 */
public final class Square extends PrimitiveSentence {

    private Square(Builder b) {
        super("square", Dimension.TWO_D, new ScadOptions()
                .add("size", b.size)
                .bool("center", b.center));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Square buildWith(Consumer<Builder> config) {
        Builder builder = builder();
        config.accept(builder);
        return builder.build();
    }

    public static final class Builder extends SentenceBuilder<Square> {
        private ScadValue size;
        private Boolean center;

        private Builder() {
            super("Square");
        }

        /** Edge length of a square. */
        public Builder size(double size) {
            this.size = ScadValue.of(size);
            return this;
        }

        /** Width and height of a rectangle. */
        public Builder size(double x, double y) {
            this.size = ScadValue.vector(x, y);
            return this;
        }

        public Builder size(Coordinate size) {
            this.size = ScadValue.point2(size);
            return this;
        }

        public Builder center(boolean center) {
            this.center = center;
            return this;
        }

        @Override
        protected Square create() {
            require(size, "size");
            return new Square(this);
        }
    }
}
