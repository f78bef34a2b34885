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
 * {@code polygon()} from a point list and optional paths into it.
 */
public final class Polygon extends PrimitiveSentence {

    private Polygon(Builder b, List<List<Integer>> paths) {
        super("polygon", Dimension.TWO_D, new ScadOptions()
                .add("points", ScadValue.points2(b.points))
                .addIfPresent("paths", paths == null ? null : ScadValue.indexLists(paths))
                .integer("convexity", b.convexity));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Polygon buildWith(Consumer<Builder> config) {
        Builder builder = builder();
        config.accept(builder);
        return builder.build();
    }

    public static final class Builder extends SentenceBuilder<Polygon> {
        private List<Coordinate> points;
        private List<List<Integer>> paths;
        private Long convexity;

        private Builder() {
            super("Polygon");
        }

        public Builder points(List<Coordinate> points) {
            this.points = List.copyOf(points);
            return this;
        }

        /**
         * Points given as {@code {x, y}} pairs.
         */
        public Builder points(double[]... xy) {
            List<Coordinate> list = new ArrayList<>(xy.length);
            for (double[] p : xy) {
                if (p.length != 2) {
                    throw new IllegalArgumentException("Polygon point needs 2 ordinates, got " + p.length);
                }
                list.add(new Coordinate(p[0], p[1]));
            }
            this.points = list;
            return this;
        }

        /**
         * Outlines as lists of indices into the points; the first is the outer shape, the rest are holes.
         */
        public Builder paths(List<List<Integer>> paths) {
            this.paths = paths;
            return this;
        }

        public Builder convexity(long convexity) {
            this.convexity = convexity;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a path refers to a point that does not exist
         */
        @Override
        protected Polygon create() {
            require(points, "points");
            List<List<Integer>> checked = paths == null ? null : IndexLists.copyChecked("path", paths, points.size());
            return new Polygon(this, checked);
        }
    }
}
