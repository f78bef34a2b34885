package nl.bytesoflife.deltascad.sentence.modifier;

import nl.bytesoflife.deltascad.model.Dimension;
import nl.bytesoflife.deltascad.model.ScadOptions;
import nl.bytesoflife.deltascad.sentence.ModifierSentence;
import nl.bytesoflife.deltascad.sentence.SentenceBuilder;
import nl.bytesoflife.deltascad.value.Angle;

import java.util.function.Consumer;

/**
 * {@code rotate(a)} in the XY plane. The angle is always written in degrees.
 */
public final class Rotate2D extends ModifierSentence {

    private Rotate2D(Builder b) {
        super("rotate", Dimension.TWO_D, new ScadOptions().positional(b.a));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Rotate2D buildWith(Consumer<Builder> config) {
        Builder builder = builder();
        config.accept(builder);
        return builder.build();
    }

    public static final class Builder extends SentenceBuilder<Rotate2D> {
        private Angle a;

        private Builder() {
            super("Rotate2D");
        }

        public Builder a(Angle a) {
            this.a = a;
            return this;
        }

        public Builder deg(double degrees) {
            return a(Angle.deg(degrees));
        }

        public Builder rad(double radians) {
            return a(Angle.rad(radians));
        }

        @Override
        protected Rotate2D create() {
            require(a, "a");
            return new Rotate2D(this);
        }
    }
}
