package nl.bytesoflife.deltascad.sentence.modifier;

import nl.bytesoflife.deltascad.model.Dimension;
import nl.bytesoflife.deltascad.model.ScadOptions;
import nl.bytesoflife.deltascad.sentence.ModifierSentence;
import nl.bytesoflife.deltascad.sentence.SentenceBuilder;
import nl.bytesoflife.deltascad.value.ScadValue;
import org.locationtech.jts.geom.Coordinate;

import java.util.function.Consumer;

/**
 * {@code translate([x, y, z])} applied to a 3D child.
 */
public final class Translate3D extends ModifierSentence {

    private Translate3D(Builder b) {
        super("translate", Dimension.THREE_D, new ScadOptions()
                .positional(ScadValue.point3(b.v)));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Translate3D buildWith(Consumer<Builder> config) {
        Builder builder = builder();
        config.accept(builder);
        return builder.build();
    }

    public static final class Builder extends SentenceBuilder<Translate3D> {
        private Coordinate v;

        private Builder() {
            super("Translate3D");
        }

        public Builder v(double x, double y, double z) {
            return v(new Coordinate(x, y, z));
        }

        /**
         * @param v offset; its Z ordinate must be set
         */
        public Builder v(Coordinate v) {
            this.v = v;
            return this;
        }

        @Override
        protected Translate3D create() {
            require(v, "v");
            return new Translate3D(this);
        }
    }
}
