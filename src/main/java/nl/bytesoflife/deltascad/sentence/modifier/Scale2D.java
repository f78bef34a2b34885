package nl.bytesoflife.deltascad.sentence.modifier;

import nl.bytesoflife.deltascad.model.Dimension;
import nl.bytesoflife.deltascad.model.ScadOptions;
import nl.bytesoflife.deltascad.sentence.ModifierSentence;
import nl.bytesoflife.deltascad.sentence.SentenceBuilder;
import nl.bytesoflife.deltascad.value.ScadValue;

import java.util.function.Consumer;

/**
 * {@code scale([x, y])} applied to a 2D child.
 */
public final class Scale2D extends ModifierSentence {

    private Scale2D(Builder b) {
        super("scale", Dimension.TWO_D, new ScadOptions().positional(b.v));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Scale2D buildWith(Consumer<Builder> config) {
        Builder builder = builder();
        config.accept(builder);
        return builder.build();
    }

    public static final class Builder extends SentenceBuilder<Scale2D> {
        private ScadValue v;

        private Builder() {
            super("Scale2D");
        }

        public Builder v(double x, double y) {
            this.v = ScadValue.vector(x, y);
            return this;
        }

        /** Uniform scale. */
        public Builder v(double factor) {
            return v(factor, factor);
        }

        @Override
        protected Scale2D create() {
            require(v, "v");
            return new Scale2D(this);
        }
    }
}
