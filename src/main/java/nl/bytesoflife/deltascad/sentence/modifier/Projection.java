package nl.bytesoflife.deltascad.sentence.modifier;

import nl.bytesoflife.deltascad.model.Dimension;
import nl.bytesoflife.deltascad.model.ScadOptions;
import nl.bytesoflife.deltascad.sentence.ModifierSentence;
import nl.bytesoflife.deltascad.sentence.SentenceBuilder;

import java.util.function.Consumer;

/**
 * {@code projection()}: flattens a 3D child onto the XY plane.
 * With {@code cut = true} only the slice at z = 0 is kept.
 */
public final class Projection extends ModifierSentence {

    private Projection(Builder b) {
        super("projection", Dimension.TWO_D, Dimension.THREE_D, new ScadOptions()
                .bool("cut", b.cut));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Projection buildWith(Consumer<Builder> config) {
        Builder builder = builder();
        config.accept(builder);
        return builder.build();
    }

    public static final class Builder extends SentenceBuilder<Projection> {
        private Boolean cut;

        private Builder() {
            super("Projection");
        }

        public Builder cut(boolean cut) {
            this.cut = cut;
            return this;
        }

        @Override
        protected Projection create() {
            return new Projection(this);
        }
    }
}
