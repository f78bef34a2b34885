package nl.bytesoflife.deltascad.sentence.modifier;

import nl.bytesoflife.deltascad.model.Dimension;
import nl.bytesoflife.deltascad.model.ScadOptions;
import nl.bytesoflife.deltascad.sentence.ModifierSentence;
import nl.bytesoflife.deltascad.sentence.SentenceBuilder;
import nl.bytesoflife.deltascad.value.ScadValue;

import java.util.function.Consumer;

/**
 * {@code multmatrix(m = ...)} with the upper 3x4 part of a 3D affine matrix.
 */
public final class MultMatrix3D extends ModifierSentence {

    private static final int ROWS = 3;
    private static final int COLUMNS = 4;

    private MultMatrix3D(Builder b) {
        super("multmatrix", Dimension.THREE_D, new ScadOptions()
                .add("m", ScadValue.matrix(b.m)));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static MultMatrix3D buildWith(Consumer<Builder> config) {
        Builder builder = builder();
        config.accept(builder);
        return builder.build();
    }

    public static final class Builder extends SentenceBuilder<MultMatrix3D> {
        private double[][] m;

        private Builder() {
            super("MultMatrix3D");
        }

        /**
         * @param rows three rows of four entries each
         * @throws IllegalArgumentException if the matrix is not 3x4
         */
        public Builder m(double[][] rows) {
            if (rows.length != ROWS) {
                throw new IllegalArgumentException("multmatrix needs " + ROWS + " rows, got " + rows.length);
            }
            double[][] copy = new double[ROWS][];
            for (int i = 0; i < ROWS; i++) {
                if (rows[i].length != COLUMNS) {
                    throw new IllegalArgumentException("multmatrix row " + i + " needs " + COLUMNS
                            + " entries, got " + rows[i].length);
                }
                copy[i] = rows[i].clone();
            }
            this.m = copy;
            return this;
        }

        @Override
        protected MultMatrix3D create() {
            require(m, "m");
            return new MultMatrix3D(this);
        }
    }
}
