package nl.bytesoflife.deltascad.sentence.primitive;

import nl.bytesoflife.deltascad.model.Dimension;
import nl.bytesoflife.deltascad.model.ScadOptions;
import nl.bytesoflife.deltascad.sentence.PrimitiveSentence;
import nl.bytesoflife.deltascad.sentence.RoundSize;
import nl.bytesoflife.deltascad.sentence.SentenceBuilder;

import java.util.function.Consumer;

/**
 * {@code cylinder()}: a cylinder or cone standing on the XY plane.
 * The size is either one radius/diameter or a bottom and top pair ({@code r1, r2} / {@code d1, d2}).
 */
public final class Cylinder extends PrimitiveSentence {

    private Cylinder(Builder b) {
        super("cylinder", Dimension.THREE_D, options(b));
    }

    private static ScadOptions options(Builder b) {
        ScadOptions options = new ScadOptions().number("h", b.h);
        if (b.top == null) {
            b.bottom.addTo(options);
        } else {
            b.bottom.addTo(options, "1");
            b.top.addTo(options, "2");
        }
        return options
                .bool("center", b.center)
                .resolution(b.fa, b.fn, b.fs);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Cylinder buildWith(Consumer<Builder> config) {
        Builder builder = builder();
        config.accept(builder);
        return builder.build();
    }

    public static final class Builder extends SentenceBuilder<Cylinder> {
        private Double h;
        private RoundSize bottom;
        private RoundSize top;
        private Boolean center;
        private Double fa;
        private Long fn;
        private Double fs;

        private Builder() {
            super("Cylinder");
        }

        public Builder h(double height) {
            this.h = finite(height, "h");
            return this;
        }

        public Builder r(double radius) {
            this.bottom = RoundSize.radius(radius);
            this.top = null;
            return this;
        }

        /** Cone with bottom radius {@code r1} and top radius {@code r2}. */
        public Builder r(double r1, double r2) {
            this.bottom = RoundSize.radius(r1);
            this.top = RoundSize.radius(r2);
            return this;
        }

        public Builder d(double diameter) {
            this.bottom = RoundSize.diameter(diameter);
            this.top = null;
            return this;
        }

        public Builder d(double d1, double d2) {
            this.bottom = RoundSize.diameter(d1);
            this.top = RoundSize.diameter(d2);
            return this;
        }

        public Builder center(boolean center) {
            this.center = center;
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
        protected Cylinder create() {
            require(h, "h");
            require(bottom, "size");
            return new Cylinder(this);
        }
    }
}
