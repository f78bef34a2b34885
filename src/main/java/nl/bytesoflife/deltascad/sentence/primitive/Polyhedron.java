package nl.bytesoflife.deltascad.sentence.primitive;

import nl.bytesoflife.deltascad.model.Dimension;
import nl.bytesoflife.deltascad.model.ScadOptions;
import nl.bytesoflife.deltascad.sentence.PrimitiveSentence;
import nl.bytesoflife.deltascad.sentence.SentenceBuilder;
import nl.bytesoflife.deltascad.value.ScadValue;
import org.locationtech.jts.geom.Coordinate;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * {@code polyhedron()} from 3D points and faces indexing into them.
 */
public final class Polyhedron extends PrimitiveSentence {

    private Polyhedron(Builder b, List<List<Integer>> faces) {
        super("polyhedron", Dimension.THREE_D, new ScadOptions()
                .add("points", ScadValue.points3(b.points))
                .addIfPresent("faces", faces == null ? null : ScadValue.indexLists(faces))
                .integer("convexity", b.convexity));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Polyhedron buildWith(Consumer<Builder> config) {
        Builder builder = builder();
        config.accept(builder);
        return builder.build();
    }

    public static final class Builder extends SentenceBuilder<Polyhedron> {
        private List<Coordinate> points;
        private List<List<Integer>> faces;
        private Long convexity;

        private Builder() {
            super("Polyhedron");
        }

        /**
         * @param points points with all three ordinates set
         */
        public Builder points(List<Coordinate> points) {
            this.points = List.copyOf(points);
            return this;
        }

        /**
         * Points given as {@code {x, y, z}} triples.
         */
        public Builder points(double[]... xyz) {
            List<Coordinate> list = new ArrayList<>(xyz.length);
            for (double[] p : xyz) {
                if (p.length != 3) {
                    throw new IllegalArgumentException("Polyhedron point needs 3 ordinates, got " + p.length);
                }
                list.add(new Coordinate(p[0], p[1], p[2]));
            }
            this.points = list;
            return this;
        }

        /**
         * Faces as point indices, clockwise when seen from outside.
         */
        public Builder faces(List<List<Integer>> faces) {
            this.faces = faces;
            return this;
        }

        public Builder convexity(long convexity) {
            this.convexity = convexity;
            return this;
        }

        @Override
        protected Polyhedron create() {
            require(points, "points");
            List<List<Integer>> checked = faces == null ? null : IndexLists.copyChecked("face", faces, points.size());
            return new Polyhedron(this, checked);
        }
    }
}
