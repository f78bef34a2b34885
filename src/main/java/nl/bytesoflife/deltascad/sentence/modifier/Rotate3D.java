package nl.bytesoflife.deltascad.sentence.modifier;

import nl.bytesoflife.deltascad.model.Dimension;
import nl.bytesoflife.deltascad.model.ScadOptions;
import nl.bytesoflife.deltascad.sentence.ModifierSentence;
import nl.bytesoflife.deltascad.sentence.SentenceBuilder;
import nl.bytesoflife.deltascad.value.Angle;
import nl.bytesoflife.deltascad.value.ScadValue;

import java.util.function.Consumer;

/**
 * {@code rotate(a = ..., v = ...)} in 3D space.
 * The angle is either one angle about the axis {@code v} (Z when absent)
 * or three angles applied about X, Y and Z in that order.
 */
public final class Rotate3D extends ModifierSentence {

    private Rotate3D(Builder b) {
        super("rotate", Dimension.THREE_D, new ScadOptions()
                .add("a", b.a)
                .addIfPresent("v", b.v));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Rotate3D buildWith(Consumer<Builder> config) {
        Builder builder = builder();
        config.accept(builder);
        return builder.build();
    }

    public static final class Builder extends SentenceBuilder<Rotate3D> {
        private ScadValue a;
        private ScadValue v;

        private Builder() {
            super("Rotate3D");
        }

        public Builder a(Angle a) {
            this.a = a;
            return this;
        }

        public Builder a(Angle x, Angle y, Angle z) {
            this.a = ScadValue.vector(x, y, z);
            return this;
        }

        public Builder deg(double degrees) {
            return a(Angle.deg(degrees));
        }

        public Builder deg(double x, double y, double z) {
            return a(Angle.deg(x), Angle.deg(y), Angle.deg(z));
        }

        public Builder rad(double radians) {
            return a(Angle.rad(radians));
        }

        public Builder rad(double x, double y, double z) {
            return a(Angle.rad(x), Angle.rad(y), Angle.rad(z));
        }

        /** Rotation axis, used with a single angle. */
        public Builder v(double x, double y, double z) {
            this.v = ScadValue.vector(x, y, z);
            return this;
        }

        @Override
        protected Rotate3D create() {
            require(a, "a");
            return new Rotate3D(this);
        }
    }
}
