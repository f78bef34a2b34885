package nl.bytesoflife.deltascad.value;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.util.AffineTransformation;

import java.util.ArrayList;
import java.util.List;

/**
 * A value that can be written as a SCAD literal.
 * All implementations are immutable; numbers are validated when the value is created,
 * so {@link #repr()} never fails.
 */
public sealed interface ScadValue
        permits ScadValue.Num, ScadValue.Int, ScadValue.Bool, ScadValue.Text, ScadValue.Vector,
                Angle, Color {

    /**
     * @return the canonical SCAD literal of this value
     */
    String repr();

    record Num(double value) implements ScadValue {
        public Num {
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("SCAD numbers must be finite, got " + value);
            }
        }

        @Override
        public String repr() {
            return ScadFormat.number(value);
        }
    }

    record Int(long value) implements ScadValue {
        @Override
        public String repr() {
            return ScadFormat.integer(value);
        }
    }

    record Bool(boolean value) implements ScadValue {
        @Override
        public String repr() {
            return ScadFormat.bool(value);
        }
    }

    record Text(String value) implements ScadValue {
        public Text {
            if (value == null) {
                throw new IllegalArgumentException("Text value must not be null");
            }
        }

        @Override
        public String repr() {
            return ScadFormat.quote(value);
        }
    }

    record Vector(List<ScadValue> elements) implements ScadValue {
        public Vector {
            elements = List.copyOf(elements);
        }

        @Override
        public String repr() {
            StringBuilder sb = new StringBuilder("[");
            for (int i = 0; i < elements.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(elements.get(i).repr());
            }
            sb.append(']');
            return sb.toString();
        }
    }

    static Num of(double value) {
        return new Num(value);
    }

    static Int of(long value) {
        return new Int(value);
    }

    static Bool of(boolean value) {
        return new Bool(value);
    }

    static Text text(String value) {
        return new Text(value);
    }

    static Vector vector(ScadValue... elements) {
        return new Vector(List.of(elements));
    }

    static Vector vector(double... values) {
        List<ScadValue> elements = new ArrayList<>(values.length);
        for (double v : values) {
            elements.add(new Num(v));
        }
        return new Vector(elements);
    }

    static Vector vector(boolean... values) {
        List<ScadValue> elements = new ArrayList<>(values.length);
        for (boolean v : values) {
            elements.add(new Bool(v));
        }
        return new Vector(elements);
    }

    static Vector point2(Coordinate c) {
        return vector(c.getX(), c.getY());
    }

    /**
     * A 3D point. The coordinate's Z ordinate must be set.
     */
    static Vector point3(Coordinate c) {
        if (Double.isNaN(c.getZ())) {
            throw new IllegalArgumentException("Coordinate has no Z ordinate: " + c);
        }
        return vector(c.getX(), c.getY(), c.getZ());
    }

    static Vector points2(List<Coordinate> points) {
        return new Vector(points.stream().map(ScadValue::point2).map(ScadValue.class::cast).toList());
    }

    static Vector points3(List<Coordinate> points) {
        return new Vector(points.stream().map(ScadValue::point3).map(ScadValue.class::cast).toList());
    }

    /**
     * A list of index lists, as used by polygon paths and polyhedron faces.
     */
    static Vector indexLists(List<List<Integer>> lists) {
        List<ScadValue> rows = new ArrayList<>(lists.size());
        for (List<Integer> list : lists) {
            List<ScadValue> row = new ArrayList<>(list.size());
            for (int index : list) {
                row.add(new Int(index));
            }
            rows.add(new Vector(row));
        }
        return new Vector(rows);
    }

    /**
     * A 2D affine transformation, written as the 3x4 matrix SCAD expects for 3D space
     * with Z left untouched.
     */
    static Vector matrix(AffineTransformation t) {
        double[] m = t.getMatrixEntries();
        return matrix(new double[][]{
                {m[0], m[1], 0, m[2]},
                {m[3], m[4], 0, m[5]},
                {0, 0, 1, 0}
        });
    }

    /**
     * A matrix given as rows.
     */
    static Vector matrix(double[][] rows) {
        List<ScadValue> out = new ArrayList<>(rows.length);
        for (double[] row : rows) {
            out.add(vector(row));
        }
        return new Vector(out);
    }
}
