package nl.bytesoflife.deltascad.sentence.modifier;

import nl.bytesoflife.deltascad.model.Dimension;
import nl.bytesoflife.deltascad.model.ScadOptions;
import nl.bytesoflife.deltascad.sentence.ModifierSentence;
import nl.bytesoflife.deltascad.sentence.SentenceBuilder;
import nl.bytesoflife.deltascad.value.ScadValue;

import java.util.function.Consumer;

/**
 * {@code resize([x, y], auto = ...)} applied to a 2D child.
 * A size of 0 keeps that axis unless auto is set for it.
 */
public final class Resize2D extends ModifierSentence {

    private Resize2D(Builder b) {
        super("resize", Dimension.TWO_D, new ScadOptions()
                .positional(b.size)
                .addIfPresent("auto", b.auto));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Resize2D buildWith(Consumer<Builder> config) {
        Builder builder = builder();
        config.accept(builder);
        return builder.build();
    }

    public static final class Builder extends SentenceBuilder<Resize2D> {
        private ScadValue size;
        private ScadValue auto;

        private Builder() {
            super("Resize2D");
        }

        public Builder size(double x, double y) {
            this.size = ScadValue.vector(x, y);
            return this;
        }

        public Builder auto(boolean auto) {
            this.auto = ScadValue.of(auto);
            return this;
        }

        public Builder auto(boolean x, boolean y) {
            this.auto = ScadValue.vector(x, y);
            return this;
        }

        @Override
        protected Resize2D create() {
            require(size, "size");
            return new Resize2D(this);
        }
    }
}
