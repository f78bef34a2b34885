package nl.bytesoflife.deltascad.sentence.modifier;

import nl.bytesoflife.deltascad.model.Dimension;
import nl.bytesoflife.deltascad.model.ScadOptions;
import nl.bytesoflife.deltascad.sentence.ModifierSentence;
import nl.bytesoflife.deltascad.sentence.SentenceBuilder;
import nl.bytesoflife.deltascad.value.ScadValue;

import java.util.function.Consumer;

/**
 * {@code linear_extrude()}: sweeps a 2D child along a direction, producing a 3D object.
 */
public final class LinearExtrude extends ModifierSentence {

    private LinearExtrude(Builder b) {
        super("linear_extrude", Dimension.THREE_D, Dimension.TWO_D, new ScadOptions()
                .number("height", b.height)
                .addIfPresent("v", b.v)
                .bool("center", b.center)
                .number("twist", b.twist)
                .integer("convexity", b.convexity)
                .integer("slices", b.slices)
                .number("scale", b.scale)
                .integer("$fn", b.fn));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static LinearExtrude buildWith(Consumer<Builder> config) {
        Builder builder = builder();
        config.accept(builder);
        return builder.build();
    }

    public static final class Builder extends SentenceBuilder<LinearExtrude> {
        private Double height;
        private ScadValue v;
        private Boolean center;
        private Double twist;
        private Long convexity;
        private Long slices;
        private Double scale;
        private Long fn;

        private Builder() {
            super("LinearExtrude");
        }

        public Builder height(double height) {
            this.height = finite(height, "height");
            return this;
        }

        /** Extrusion direction. */
        public Builder v(double x, double y, double z) {
            this.v = ScadValue.vector(x, y, z);
            return this;
        }

        public Builder center(boolean center) {
            this.center = center;
            return this;
        }

        /** Twist over the full height, in degrees. */
        public Builder twist(double twist) {
            this.twist = finite(twist, "twist");
            return this;
        }

        public Builder convexity(long convexity) {
            this.convexity = convexity;
            return this;
        }

        public Builder slices(long slices) {
            this.slices = slices;
            return this;
        }

        /** Scale of the top face relative to the bottom one. */
        public Builder scale(double scale) {
            this.scale = finite(scale, "scale");
            return this;
        }

        public Builder fn(long fn) {
            this.fn = fn;
            return this;
        }

        @Override
        protected LinearExtrude create() {
            require(height, "height");
            return new LinearExtrude(this);
        }
    }
}
