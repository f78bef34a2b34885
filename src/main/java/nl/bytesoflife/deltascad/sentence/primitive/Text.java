package nl.bytesoflife.deltascad.sentence.primitive;

import nl.bytesoflife.deltascad.model.Dimension;
import nl.bytesoflife.deltascad.model.ScadOptions;
import nl.bytesoflife.deltascad.sentence.PrimitiveSentence;
import nl.bytesoflife.deltascad.sentence.SentenceBuilder;
import nl.bytesoflife.deltascad.value.ScadValue;

import java.util.function.Consumer;

/**
 * {@code text()}: a 2D outline of a string.
 */
public final class Text extends PrimitiveSentence {

    private Text(Builder b) {
        super("text", Dimension.TWO_D, new ScadOptions()
                .positional(ScadValue.text(b.text))
                .text("font", b.font)
                .number("size", b.size)
                .text("halign", b.halign)
                .text("valign", b.valign)
                .number("spacing", b.spacing)
                .text("direction", b.direction)
                .text("language", b.language)
                .text("script", b.script)
                .integer("$fn", b.fn));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Text buildWith(Consumer<Builder> config) {
        Builder builder = builder();
        config.accept(builder);
        return builder.build();
    }

    public static final class Builder extends SentenceBuilder<Text> {
        private String text;
        private String font;
        private Double size;
        private String halign;
        private String valign;
        private Double spacing;
        private String direction;
        private String language;
        private String script;
        private Long fn;

        private Builder() {
            super("Text");
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        /** Font name, e.g. {@code "Liberation Sans:style=Bold"}. */
        public Builder font(String font) {
            this.font = font;
            return this;
        }

        public Builder size(double size) {
            this.size = finite(size, "size");
            return this;
        }

        /** {@code "left"}, {@code "center"} or {@code "right"}. */
        public Builder halign(String halign) {
            this.halign = halign;
            return this;
        }

        /** {@code "top"}, {@code "center"}, {@code "baseline"} or {@code "bottom"}. */
        public Builder valign(String valign) {
            this.valign = valign;
            return this;
        }

        public Builder spacing(double spacing) {
            this.spacing = finite(spacing, "spacing");
            return this;
        }

        /** {@code "ltr"}, {@code "rtl"}, {@code "ttb"} or {@code "btt"}. */
        public Builder direction(String direction) {
            this.direction = direction;
            return this;
        }

        public Builder language(String language) {
            this.language = language;
            return this;
        }

        public Builder script(String script) {
            this.script = script;
            return this;
        }

        public Builder fn(long fn) {
            this.fn = fn;
            return this;
        }

        @Override
        protected Text create() {
            require(text, "text");
            return new Text(this);
        }
    }
}
