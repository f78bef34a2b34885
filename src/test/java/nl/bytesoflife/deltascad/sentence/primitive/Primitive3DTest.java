package nl.bytesoflife.deltascad.sentence.primitive;

import nl.bytesoflife.deltascad.model.Dimension;
import nl.bytesoflife.deltascad.model.MissingParameterException;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class Primitive3DTest {

    @Test
    void sphere() {
        assertEquals("sphere(r = 3)", Sphere.buildWith(b -> b.r(3)).toString());
        assertEquals("sphere(d = 4)", Sphere.buildWith(b -> b.d(4)).toString());
        assertEquals("sphere(r = 3, $fa = 0.5, $fn = 20)", Sphere.buildWith(b -> b.r(3).fa(0.5).fn(20)).toString());
        assertEquals("sphere(r = 3, $fa = 0.5, $fs = 40)", Sphere.buildWith(b -> b.r(3).fs(40).fa(0.5)).toString());
        assertThrows(MissingParameterException.class, () -> Sphere.builder().fa(0.5).build());
    }

    @Test
    void cube() {
        assertEquals("cube(size = 3)", Cube.buildWith(b -> b.size(3)).toString());
        assertEquals("cube(size = [4, 2, 3])", Cube.buildWith(b -> b.size(4, 2, 3)).toString());
        assertEquals("cube(size = [4, 2, 3])", Cube.buildWith(b -> b.size(new Coordinate(4, 2, 3))).toString());
        assertEquals("cube(size = 3, center = true)", Cube.buildWith(b -> b.size(3).center(true)).toString());
        assertEquals(Dimension.THREE_D, Cube.buildWith(b -> b.size(3)).dimension());
    }

    @Test
    void cylinder() {
        assertEquals("cylinder(h = 5, r = 3)", Cylinder.buildWith(b -> b.h(5).r(3)).toString());
        assertEquals("cylinder(h = 5, d = 3)", Cylinder.buildWith(b -> b.h(5).d(3)).toString());
        assertEquals("cylinder(h = 5, r1 = 1, r2 = 2)", Cylinder.buildWith(b -> b.h(5).r(1, 2)).toString());
        assertEquals("cylinder(h = 5, d1 = 1, d2 = 2)", Cylinder.buildWith(b -> b.h(5).d(1, 2)).toString());
        assertEquals("cylinder(h = 5, r = 3, $fa = 2)", Cylinder.buildWith(b -> b.h(5).r(3).fa(2)).toString());
        assertEquals("cylinder(h = 5, r = 3, center = true, $fn = 64)",
                Cylinder.buildWith(b -> b.fn(64).center(true).r(3).h(5)).toString());
    }

    @Test
    void cylinderRequiresHeightAndSize() {
        MissingParameterException noHeight = assertThrows(MissingParameterException.class,
                () -> Cylinder.builder().r(3).build());
        assertEquals("h", noHeight.getFieldName());

        MissingParameterException noSize = assertThrows(MissingParameterException.class,
                () -> Cylinder.builder().h(3).build());
        assertEquals("size", noSize.getFieldName());
        assertEquals("Required parameter 'size' of Cylinder is not set", noSize.getMessage());
    }

    @Test
    void nonFiniteCylinderValuesFailAtSetter() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> Cylinder.builder().h(Double.NaN));
        assertEquals("Cylinder.h must be finite, got NaN", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> Cylinder.builder().fs(Double.POSITIVE_INFINITY));
    }

    @Test
    void polyhedronFaceWithNullIndex() {
        Polyhedron.Builder builder = Polyhedron.builder()
                .points(new double[]{0, 0, 0}, new double[]{1, 0, 0}, new double[]{0, 1, 0}, new double[]{0, 0, 1})
                .faces(List.of(List.of(0, 1, 2), Arrays.asList(0, 3, null)));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, builder::build);
        assertEquals("face index out of bounds: [1][2]:null", e.getMessage());
    }

    @Test
    void polyhedron() {
        List<Coordinate> points = List.of(
                new Coordinate(1, 1, 1), new Coordinate(-1, 2, -1), new Coordinate(0, 0, 0));
        assertEquals("polyhedron(points = [[1, 1, 1], [-1, 2, -1], [0, 0, 0]])",
                Polyhedron.buildWith(b -> b.points(points)).toString());
        assertEquals("polyhedron(points = [[1, 1, 1], [-1, 2, -1], [0, 0, 0]], faces = [[0, 2, 1]])",
                Polyhedron.buildWith(b -> b.points(points).faces(List.of(List.of(0, 2, 1)))).toString());
        assertEquals("polyhedron(points = [[1, 1, 1], [-1, 2, -1], [0, 0, 0]], convexity = 2)",
                Polyhedron.buildWith(b -> b.points(points).convexity(2)).toString());
    }

    @Test
    void polyhedronFaces() {
        Polyhedron.Builder builder = Polyhedron.builder().points(
                new double[]{2, 0, 2}, new double[]{1, 1, 1}, new double[]{-1, 1, 0},
                new double[]{1, 0, -1}, new double[]{0.5, 0.5, 0.7}, new double[]{-0.5, 0.5, -0.3});

        builder.faces(List.of(List.of(0, 1, 2), List.of(6, 4, 5)));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, builder::build);
        assertEquals("face index out of bounds: [1][0]:6", e.getMessage());

        builder.faces(List.of(List.of(0, 1, 2), List.of(3, 4, 5)));
        assertEquals("polyhedron(points = [[2, 0, 2], [1, 1, 1], [-1, 1, 0], [1, 0, -1], [0.5, 0.5, 0.7], "
                + "[-0.5, 0.5, -0.3]], faces = [[0, 1, 2], [3, 4, 5]])", builder.build().toString());
    }

    @Test
    void polyhedronPointsNeedZ() {
        assertThrows(IllegalArgumentException.class,
                () -> Polyhedron.buildWith(b -> b.points(List.of(new Coordinate(1, 2)))));
    }

    @Test
    void import3d() {
        assertEquals("import(\"shape.stl\")", Import3D.buildWith(b -> b.file("shape.stl")).toString());
        assertEquals("import(\"shape.stl\", convexity = 10)",
                Import3D.buildWith(b -> b.file("shape.stl").convexity(10)).toString());
    }

    @Test
    void surface() {
        assertEquals("surface(file = \"shape.dat\")", Surface.buildWith(b -> b.file("shape.dat")).toString());
        assertEquals("surface(file = \"shape.dat\", center = true, invert = true, convexity = 10)",
                Surface.buildWith(b -> b.file("shape.dat").convexity(10).center(true).invert(true)).toString());
    }
}
