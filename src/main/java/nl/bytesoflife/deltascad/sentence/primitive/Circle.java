package nl.bytesoflife.deltascad.sentence.primitive;

import nl.bytesoflife.deltascad.model.Dimension;
import nl.bytesoflife.deltascad.model.ScadOptions;
import nl.bytesoflife.deltascad.sentence.PrimitiveSentence;
import nl.bytesoflife.deltascad.sentence.RoundSize;
import nl.bytesoflife.deltascad.sentence.SentenceBuilder;

import java.util.function.Consumer;

/**
 * {@code circle()} centered on the origin.
 */
public final class Circle extends PrimitiveSentence {

    private Circle(Builder b) {
        super("circle", Dimension.TWO_D, options(b));
    }

    private static ScadOptions options(Builder b) {
        ScadOptions options = new ScadOptions();
        b.size.addTo(options);
        return options.resolution(b.fa, b.fn, b.fs);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Circle buildWith(Consumer<Builder> config) {
        Builder builder = builder();
        config.accept(builder);
        return builder.build();
    }

    public static final class Builder extends SentenceBuilder<Circle> {
        private RoundSize size;
        private Double fa;
        private Long fn;
        private Double fs;

        private Builder() {
            super("Circle");
        }

        public Builder r(double radius) {
            this.size = RoundSize.radius(radius);
            return this;
        }

        public Builder d(double diameter) {
            this.size = RoundSize.diameter(diameter);
            return this;
        }

        /** {@code $fa}: minimum fragment angle. */
        public Builder fa(double fa) {
            this.fa = finite(fa, "fa");
            return this;
        }

        /** {@code $fn}: fixed number of fragments. */
        public Builder fn(long fn) {
            this.fn = fn;
            return this;
        }

        /** {@code $fs}: minimum fragment size. */
        public Builder fs(double fs) {
            this.fs = finite(fs, "fs");
            return this;
        }

        @Override
        protected Circle create() {
            require(size, "size");
            return new Circle(this);
        }
    }
}
