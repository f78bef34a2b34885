package nl.bytesoflife.deltascad.sentence.modifier;

import nl.bytesoflife.deltascad.model.Dimension;
import nl.bytesoflife.deltascad.model.ScadOptions;
import nl.bytesoflife.deltascad.sentence.ModifierSentence;
import nl.bytesoflife.deltascad.sentence.SentenceBuilder;
import nl.bytesoflife.deltascad.value.ScadValue;

import java.util.function.Consumer;

/**
 * {@code offset()} of a 2D outline, either radial ({@code r}) or by a fixed distance ({@code delta}).
 */
public final class Offset extends ModifierSentence {

    private Offset(Builder b) {
        super("offset", Dimension.TWO_D, new ScadOptions()
                .add(b.sizeName, ScadValue.of(b.size.doubleValue()))
                .bool("chamfer", b.chamfer)
                .resolution(b.fa, b.fn, b.fs));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Offset buildWith(Consumer<Builder> config) {
        Builder builder = builder();
        config.accept(builder);
        return builder.build();
    }

    public static final class Builder extends SentenceBuilder<Offset> {
        private String sizeName;
        private Double size;
        private Boolean chamfer;
        private Double fa;
        private Long fn;
        private Double fs;

        private Builder() {
            super("Offset");
        }

        /** Radial offset. Replaces a previously set delta. */
        public Builder r(double r) {
            this.size = finite(r, "r");
            this.sizeName = "r";
            return this;
        }

        /** Straight offset. Replaces a previously set radius. */
        public Builder delta(double delta) {
            this.size = finite(delta, "delta");
            this.sizeName = "delta";
            return this;
        }

        /** Only affects delta offsets. */
        public Builder chamfer(boolean chamfer) {
            this.chamfer = chamfer;
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
        protected Offset create() {
            require(size, "r|delta");
            return new Offset(this);
        }
    }
}
