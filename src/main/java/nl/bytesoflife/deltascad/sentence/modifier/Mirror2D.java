package nl.bytesoflife.deltascad.sentence.modifier;

import nl.bytesoflife.deltascad.model.Dimension;
import nl.bytesoflife.deltascad.model.ScadOptions;
import nl.bytesoflife.deltascad.sentence.ModifierSentence;
import nl.bytesoflife.deltascad.sentence.SentenceBuilder;
import nl.bytesoflife.deltascad.value.ScadValue;

import java.util.function.Consumer;

/**
 * {@code mirror([x, y])}; the vector is the normal of the mirror line.
 */
public final class Mirror2D extends ModifierSentence {

    private Mirror2D(Builder b) {
        super("mirror", Dimension.TWO_D, new ScadOptions().positional(b.v));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Mirror2D buildWith(Consumer<Builder> config) {
        Builder builder = builder();
        config.accept(builder);
        return builder.build();
    }

    public static final class Builder extends SentenceBuilder<Mirror2D> {
        private ScadValue v;

        private Builder() {
            super("Mirror2D");
        }

        public Builder v(double x, double y) {
            this.v = ScadValue.vector(x, y);
            return this;
        }

        @Override
        protected Mirror2D create() {
            require(v, "v");
            return new Mirror2D(this);
        }
    }
}
