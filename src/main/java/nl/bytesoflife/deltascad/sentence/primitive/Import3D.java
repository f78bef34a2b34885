package nl.bytesoflife.deltascad.sentence.primitive;

import nl.bytesoflife.deltascad.model.Dimension;
import nl.bytesoflife.deltascad.model.ScadOptions;
import nl.bytesoflife.deltascad.sentence.PrimitiveSentence;
import nl.bytesoflife.deltascad.sentence.SentenceBuilder;
import nl.bytesoflife.deltascad.value.ScadValue;

import java.util.function.Consumer;

/**
 * {@code import()} of a 3D file (STL, OFF, 3MF).
 */
public final class Import3D extends PrimitiveSentence {

    private Import3D(Builder b) {
        super("import", Dimension.THREE_D, new ScadOptions()
                .positional(ScadValue.text(b.file))
                .integer("convexity", b.convexity)
                .resolution(b.fa, b.fn, b.fs));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Import3D buildWith(Consumer<Builder> config) {
        Builder builder = builder();
        config.accept(builder);
        return builder.build();
    }

    public static final class Builder extends SentenceBuilder<Import3D> {
        private String file;
        private Long convexity;
        private Double fa;
        private Long fn;
        private Double fs;

        private Builder() {
            super("Import3D");
        }

        public Builder file(String file) {
            this.file = file;
            return this;
        }

        public Builder convexity(long convexity) {
            this.convexity = convexity;
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
        protected Import3D create() {
            require(file, "file");
            return new Import3D(this);
        }
    }
}
