package nl.bytesoflife.deltascad.sentence.primitive;

import nl.bytesoflife.deltascad.model.Dimension;
import nl.bytesoflife.deltascad.model.ScadOptions;
import nl.bytesoflife.deltascad.sentence.PrimitiveSentence;
import nl.bytesoflife.deltascad.sentence.SentenceBuilder;

import java.util.function.Consumer;

/**
 * {@code surface()}: a height map read from a data or image file.
 */
public final class Surface extends PrimitiveSentence {

    private Surface(Builder b) {
        super("surface", Dimension.THREE_D, new ScadOptions()
                .text("file", b.file)
                .bool("center", b.center)
                .bool("invert", b.invert)
                .integer("convexity", b.convexity));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Surface buildWith(Consumer<Builder> config) {
        Builder builder = builder();
        config.accept(builder);
        return builder.build();
    }

    public static final class Builder extends SentenceBuilder<Surface> {
        private String file;
        private Boolean center;
        private Boolean invert;
        private Long convexity;

        private Builder() {
            super("Surface");
        }

        public Builder file(String file) {
            this.file = file;
            return this;
        }

        public Builder center(boolean center) {
            this.center = center;
            return this;
        }

        /** Invert the colors of an image height map. */
        public Builder invert(boolean invert) {
            this.invert = invert;
            return this;
        }

        public Builder convexity(long convexity) {
            this.convexity = convexity;
            return this;
        }

        @Override
        protected Surface create() {
            require(file, "file");
            return new Surface(this);
        }
    }
}
