package nl.bytesoflife.deltascad.sentence.primitive;

import nl.bytesoflife.deltascad.model.Dimension;
import nl.bytesoflife.deltascad.model.ScadOptions;
import nl.bytesoflife.deltascad.sentence.PrimitiveSentence;
import nl.bytesoflife.deltascad.sentence.RoundSize;
import nl.bytesoflife.deltascad.sentence.SentenceBuilder;

import java.util.function.Consumer;

/**
 * {@code sphere()} centered on the origin.
 */
public final class Sphere extends PrimitiveSentence {

    private Sphere(Builder b) {
        super("sphere", Dimension.THREE_D, options(b));
    }

    private static ScadOptions options(Builder b) {
        ScadOptions options = new ScadOptions();
        b.size.addTo(options);
        return options.resolution(b.fa, b.fn, b.fs);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Sphere buildWith(Consumer<Builder> config) {
        Builder builder = builder();
        config.accept(builder);
        return builder.build();
    }

    public static final class Builder extends SentenceBuilder<Sphere> {
        private RoundSize size;
        private Double fa;
        private Long fn;
        private Double fs;

        private Builder() {
            super("Sphere");
        }

        public Builder r(double radius) {
            this.size = RoundSize.radius(radius);
            return this;
        }

        public Builder d(double diameter) {
            this.size = RoundSize.diameter(diameter);
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
        protected Sphere create() {
            require(size, "size");
            return new Sphere(this);
        }
    }
}
