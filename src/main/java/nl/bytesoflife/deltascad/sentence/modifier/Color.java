package nl.bytesoflife.deltascad.sentence.modifier;

import nl.bytesoflife.deltascad.model.Dimension;
import nl.bytesoflife.deltascad.model.ScadOptions;
import nl.bytesoflife.deltascad.sentence.ModifierSentence;
import nl.bytesoflife.deltascad.sentence.SentenceBuilder;

import java.util.function.Consumer;

/**
 * {@code color()} for a child of either dimension.
 */
public final class Color extends ModifierSentence {

    private Color(Builder b) {
        super("color", Dimension.MIXED, new ScadOptions()
                .add(b.c.parameterName(), b.c)
                .number("a", b.a));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Color buildWith(Consumer<Builder> config) {
        Builder builder = builder();
        config.accept(builder);
        return builder.build();
    }

    public static final class Builder extends SentenceBuilder<Color> {
        private nl.bytesoflife.deltascad.value.Color c;
        private Double a;

        private Builder() {
            super("Color");
        }

        public Builder c(nl.bytesoflife.deltascad.value.Color c) {
            this.c = c;
            return this;
        }

        public Builder rgb(double r, double g, double b) {
            return c(nl.bytesoflife.deltascad.value.Color.rgb(r, g, b));
        }

        public Builder rgba(double r, double g, double b, double a) {
            return c(nl.bytesoflife.deltascad.value.Color.rgba(r, g, b, a));
        }

        public Builder named(String name) {
            return c(nl.bytesoflife.deltascad.value.Color.named(name));
        }

        /** Alpha, for colors that do not carry their own. */
        public Builder a(double a) {
            this.a = finite(a, "a");
            return this;
        }

        @Override
        protected Color create() {
            require(c, "c");
            return new Color(this);
        }
    }
}
