package nl.bytesoflife.deltascad.sentence.modifier;

import nl.bytesoflife.deltascad.model.Dimension;
import nl.bytesoflife.deltascad.model.ScadOptions;
import nl.bytesoflife.deltascad.sentence.ModifierSentence;
import nl.bytesoflife.deltascad.sentence.SentenceBuilder;
import nl.bytesoflife.deltascad.value.ScadValue;
import org.locationtech.jts.geom.util.AffineTransformation;

import java.util.function.Consumer;

/**
 * {@code multmatrix(m = ...)} with a 2D affine transformation.
 * SCAD only accepts 3D matrices, so Z passes through unchanged.
 */
public final class MultMatrix2D extends ModifierSentence {

    private MultMatrix2D(Builder b) {
        super("multmatrix", Dimension.TWO_D, new ScadOptions()
                .add("m", ScadValue.matrix(b.m)));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static MultMatrix2D buildWith(Consumer<Builder> config) {
        Builder builder = builder();
        config.accept(builder);
        return builder.build();
    }

    public static final class Builder extends SentenceBuilder<MultMatrix2D> {
        private AffineTransformation m;

        private Builder() {
            super("MultMatrix2D");
        }

        public Builder m(AffineTransformation m) {
            this.m = new AffineTransformation(m);
            return this;
        }

        /**
         * Matrix entries in row order: {@code x' = m00 x + m01 y + m02}, {@code y' = m10 x + m11 y + m12}.
         */
        public Builder m(double m00, double m01, double m02, double m10, double m11, double m12) {
            this.m = new AffineTransformation(m00, m01, m02, m10, m11, m12);
            return this;
        }

        @Override
        protected MultMatrix2D create() {
            require(m, "m");
            return new MultMatrix2D(this);
        }
    }
}
