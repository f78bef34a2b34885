package nl.bytesoflife.deltascad.sentence.modifier;

import nl.bytesoflife.deltascad.model.Dimension;
import nl.bytesoflife.deltascad.model.ScadOptions;
import nl.bytesoflife.deltascad.sentence.ModifierSentence;
import nl.bytesoflife.deltascad.sentence.SentenceBuilder;
import nl.bytesoflife.deltascad.value.ScadValue;

import java.util.function.Consumer;

/**
 * {@code mirror([x, y, z])}; the vector is the normal of the mirror plane through the origin.
 */
public final class Mirror3D extends ModifierSentence {

    private Mirror3D(Builder b) {
        super("mirror", Dimension.THREE_D, new ScadOptions().positional(b.v));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Mirror3D buildWith(Consumer<Builder> config) {
        Builder builder = builder();
        config.accept(builder);
        return builder.build();
    }

    public static final class Builder extends SentenceBuilder<Mirror3D> {
        private ScadValue v;

        private Builder() {
            super("Mirror3D");
        }

        public Builder v(double x, double y, double z) {
            this.v = ScadValue.vector(x, y, z);
            return this;
        }

        @Override
        protected Mirror3D create() {
            require(v, "v");
            return new Mirror3D(this);
        }
    }
}
