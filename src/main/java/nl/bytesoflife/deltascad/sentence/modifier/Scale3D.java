package nl.bytesoflife.deltascad.sentence.modifier;

import nl.bytesoflife.deltascad.model.Dimension;
import nl.bytesoflife.deltascad.model.ScadOptions;
import nl.bytesoflife.deltascad.sentence.ModifierSentence;
import nl.bytesoflife.deltascad.sentence.SentenceBuilder;
import nl.bytesoflife.deltascad.value.ScadValue;

import java.util.function.Consumer;

public final class Scale3D extends ModifierSentence {

    private Scale3D(Builder b) {
        super("scale", Dimension.THREE_D, new ScadOptions().positional(b.v));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Scale3D buildWith(Consumer<Builder> config) {
        Builder builder = builder();
        config.accept(builder);
        return builder.build();
    }

    public static final class Builder extends SentenceBuilder<Scale3D> {
        private ScadValue v;

        private Builder() {
            super("Scale3D");
        }

        public Builder v(double x, double y, double z) {
            this.v = ScadValue.vector(x, y, z);
            return this;
        }

        public Builder v(double factor) {
            return v(factor, factor, factor);
        }

        @Override
        protected Scale3D create() {
            require(v, "v");
            return new Scale3D(this);
        }
    }
}
