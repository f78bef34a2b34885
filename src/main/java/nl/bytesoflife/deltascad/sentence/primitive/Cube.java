package nl.bytesoflife.deltascad.sentence.primitive;

import nl.bytesoflife.deltascad.model.Dimension;
import nl.bytesoflife.deltascad.model.ScadOptions;
import nl.bytesoflife.deltascad.sentence.PrimitiveSentence;
import nl.bytesoflife.deltascad.sentence.SentenceBuilder;
import nl.bytesoflife.deltascad.value.ScadValue;
import org.locationtech.jts.geom.Coordinate;

import java.util.function.Consumer;

/**
 * {@code cube()}: a cube or box in the first octant, or centered on the origin.
 */
public final class Cube extends PrimitiveSentence {

    private Cube(Builder b) {
        super("cube", Dimension.THREE_D, new ScadOptions()
                .add("size", b.size)
                .bool("center", b.center));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Cube buildWith(Consumer<Builder> config) {
        Builder builder = builder();
        config.accept(builder);
        return builder.build();
    }

    public static final class Builder extends SentenceBuilder<Cube> {
        private ScadValue size;
        private Boolean center;

        private Builder() {
            super("Cube");
        }

        public Builder size(double size) {
            this.size = ScadValue.of(size);
            return this;
        }

        public Builder size(double x, double y, double z) {
            this.size = ScadValue.vector(x, y, z);
            return this;
        }

        public Builder size(Coordinate size) {
            this.size = ScadValue.point3(size);
            return this;
        }

        public Builder center(boolean center) {
            this.center = center;
            return this;
        }

        @Override
        protected Cube create() {
            require(size, "size");
            return new Cube(this);
        }
    }
}
