package nl.bytesoflife.deltascad.sentence.modifier;

import nl.bytesoflife.deltascad.model.Dimension;
import nl.bytesoflife.deltascad.model.ScadOptions;
import nl.bytesoflife.deltascad.sentence.ModifierSentence;
import nl.bytesoflife.deltascad.sentence.SentenceBuilder;
import nl.bytesoflife.deltascad.value.ScadValue;

import java.util.function.Consumer;

/**
 * {@code resize([x, y, z], auto = ...)} applied to a 3D child.
 */
public final class Resize3D extends ModifierSentence {

    private Resize3D(Builder b) {
        super("resize", Dimension.THREE_D, new ScadOptions()
                .positional(b.size)
                .addIfPresent("auto", b.auto));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Resize3D buildWith(Consumer<Builder> config) {
        Builder builder = builder();
        config.accept(builder);
        return builder.build();
    }

    public static final class Builder extends SentenceBuilder<Resize3D> {
        private ScadValue size;
        private ScadValue auto;

        private Builder() {
            super("Resize3D");
        }

        public Builder size(double x, double y, double z) {
            this.size = ScadValue.vector(x, y, z);
            return this;
        }

        public Builder auto(boolean auto) {
            this.auto = ScadValue.of(auto);
            return this;
        }

        public Builder auto(boolean x, boolean y, boolean z) {
            this.auto = ScadValue.vector(x, y, z);
            return this;
        }

        @Override
        protected Resize3D create() {
            require(size, "size");
            return new Resize3D(this);
        }
    }
}
