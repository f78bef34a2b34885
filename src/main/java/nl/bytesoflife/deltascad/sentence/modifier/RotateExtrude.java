package nl.bytesoflife.deltascad.sentence.modifier;

import nl.bytesoflife.deltascad.model.Dimension;
import nl.bytesoflife.deltascad.model.ScadOptions;
import nl.bytesoflife.deltascad.sentence.ModifierSentence;
import nl.bytesoflife.deltascad.sentence.SentenceBuilder;

import java.util.function.Consumer;

/**
 * {@code rotate_extrude()}: revolves a 2D child around the Z axis.
 */
public final class RotateExtrude extends ModifierSentence {

    private RotateExtrude(Builder b) {
        super("rotate_extrude", Dimension.THREE_D, Dimension.TWO_D, new ScadOptions()
                .number("angle", b.angle)
                .number("start", b.start)
                .integer("convexity", b.convexity)
                .resolution(b.fa, b.fn, b.fs));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RotateExtrude buildWith(Consumer<Builder> config) {
        Builder builder = builder();
        config.accept(builder);
        return builder.build();
    }

    public static final class Builder extends SentenceBuilder<RotateExtrude> {
        private Double angle;
        private Double start;
        private Long convexity;
        private Double fa;
        private Long fn;
        private Double fs;

        private Builder() {
            super("RotateExtrude");
        }

        /** Sweep angle in degrees, 360 when absent. */
        public Builder angle(double angle) {
            this.angle = finite(angle, "angle");
            return this;
        }

        public Builder start(double start) {
            this.start = finite(start, "start");
            return this;
        }

        public Builder convexity(long convexity) {
            this.convexity = convexity;
            return this;
        }

        public Builder fa(double fa) {
            this.fa = finite(fa, "fa");
            return this;
        }

        public Builder fn(long fn) {
            this.fn = fn;
            return this;
        }

        public Builder fs(double fs) {
            this.fs = finite(fs, "fs");
            return this;
        }

        @Override
        protected RotateExtrude create() {
            return new RotateExtrude(this);
        }
    }
}
