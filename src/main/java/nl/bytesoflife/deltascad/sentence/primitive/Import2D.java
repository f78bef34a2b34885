package nl.bytesoflife.deltascad.sentence.primitive;

import nl.bytesoflife.deltascad.model.Dimension;
import nl.bytesoflife.deltascad.model.ScadOptions;
import nl.bytesoflife.deltascad.sentence.PrimitiveSentence;
import nl.bytesoflife.deltascad.sentence.SentenceBuilder;
import nl.bytesoflife.deltascad.value.ScadValue;

import java.util.function.Consumer;

/**
 * {@code import()} of a 2D file (SVG, DXF).
 */
public final class Import2D extends PrimitiveSentence {

    private Import2D(Builder b) {
        super("import", Dimension.TWO_D, new ScadOptions()
                .positional(ScadValue.text(b.file))
                .integer("convexity", b.convexity)
                .text("id", b.id)
                .text("layer", b.layer)
                .resolution(b.fa, b.fn, b.fs));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Import2D buildWith(Consumer<Builder> config) {
        Builder builder = builder();
        config.accept(builder);
        return builder.build();
    }

    public static final class Builder extends SentenceBuilder<Import2D> {
        private String file;
        private Long convexity;
        private String id;
        private String layer;
        private Double fa;
        private Long fn;
        private Double fs;

        private Builder() {
            super("Import2D");
        }

        public Builder file(String file) {
            this.file = file;
            return this;
        }

        public Builder convexity(long convexity) {
            this.convexity = convexity;
            return this;
        }

        /** SVG element id to import. */
        public Builder id(String id) {
            this.id = id;
            return this;
        }

        /** DXF layer to import. */
        public Builder layer(String layer) {
            this.layer = layer;
            return this;
        }

        public Builder fa(double fa) {
            this.fa = finite(fa, "fa");
            return this;
        }

        public Builder fn(long fn) {
            this.fn = fn;
            return this;
        }

        public Builder fs(double fs) {
            this.fs = finite(fs, "fs");
            return this;
        }

        @Override
        protected Import2D create() {
            require(file, "file");
            return new Import2D(this);
        }
    }
}
