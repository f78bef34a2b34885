package nl.bytesoflife.deltascad.sentence.modifier;

import nl.bytesoflife.deltascad.model.Dimension;
import nl.bytesoflife.deltascad.model.ScadOptions;
import nl.bytesoflife.deltascad.sentence.ModifierSentence;
import nl.bytesoflife.deltascad.sentence.SentenceBuilder;
import nl.bytesoflife.deltascad.value.ScadValue;
import org.locationtech.jts.geom.Coordinate;

import java.util.function.Consumer;

/**
 * {@code translate([x, y])} applied to a 2D child.
 */
public final class Translate2D extends ModifierSentence {

    private Translate2D(Builder b) {
        super("translate", Dimension.TWO_D, new ScadOptions()
                .positional(ScadValue.point2(b.v)));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Translate2D buildWith(Consumer<Builder> config) {
        Builder builder = builder();
        config.accept(builder);
        return builder.build();
    }

    public static final class Builder extends SentenceBuilder<Translate2D> {
        private Coordinate v;

        private Builder() {
            super("Translate2D");
        }

        public Builder v(double x, double y) {
            return v(new Coordinate(x, y));
        }

        public Builder v(Coordinate v) {
            this.v = v;
            return this;
        }

        @Override
        protected Translate2D create() {
            require(v, "v");
            return new Translate2D(this);
        }
    }
}
