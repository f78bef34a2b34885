package nl.bytesoflife.deltascad;

import nl.bytesoflife.deltascad.model.ScadNode;
import nl.bytesoflife.deltascad.sentence.modifier.Difference;
import nl.bytesoflife.deltascad.sentence.modifier.LinearExtrude;
import nl.bytesoflife.deltascad.sentence.modifier.Rotate3D;
import nl.bytesoflife.deltascad.sentence.modifier.Translate2D;
import nl.bytesoflife.deltascad.sentence.modifier.Translate3D;
import nl.bytesoflife.deltascad.sentence.modifier.Union;
import nl.bytesoflife.deltascad.sentence.primitive.Circle;
import nl.bytesoflife.deltascad.sentence.primitive.Cylinder;
import nl.bytesoflife.deltascad.sentence.primitive.Polygon;
import nl.bytesoflife.deltascad.sentence.primitive.Square;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * A desk clamp with a hook, modelled end to end.
 */
class DeskClampTest {

    private static final double SMALL_OVERLAP = 0.025;

    private static final double CLAMP_Z_SIZE = 45;
    private static final double CLAMP_PLATE_THICKNESS = 5;
    private static final double CLAMP_BACK_PLATE_THICKNESS = 5;
    private static final double CLAMP_UPPER_LENGTH = 30;
    private static final double CLAMP_SPAN = 19;
    private static final double CLAMP_LOWER_LENGTH = 10;
    private static final double CLAMP_CHAMFER_R = 2;

    private static final double CLAMP_NAIL_HEIGHT = 0.4;
    private static final double CLAMP_NAIL_BASE_WIDTH = 3.6;
    private static final double CLAMP_NAIL_TOP_WIDTH = 1.8;
    private static final double[] CLAMP_NAIL_POS = {4.5, 20};

    private static final double HOOK_OUTER_R = 14;
    private static final double HOOK_INNER_R = 12;
    private static final double HOOK_INFILL_HEIGHT = 5;
    private static final double HOOK_LENGTH = 60;
    private static final double HOOK_END_R = 21;
    private static final double HOOK_END_LENGTH = 5;

    /**
     * Square corner minus a quarter circle, used to round off an inside corner.
     */
    private static ScadNode roundedCornerVoid(double x, double y, double r, boolean xOut, boolean yOut, long fn) {
        ScadNode outer = Scad.modifier(
                Translate2D.buildWith(b -> b.v(x - (xOut ? r : 0), y - (yOut ? r : 0))),
                Scad.primitive(Square.buildWith(b -> b.size(r))));
        ScadNode inner = Scad.modifier(
                Translate2D.buildWith(b -> b.v(x + (xOut ? -r : r), y + (yOut ? -r : r))),
                Scad.primitive(Circle.buildWith(b -> b.r(r).fn(fn))));
        return Scad.difference(outer, inner);
    }

    private static ScadNode clamp() {
        double bodyXA0 = -CLAMP_UPPER_LENGTH - CLAMP_BACK_PLATE_THICKNESS;
        double bodyXA1 = -CLAMP_LOWER_LENGTH - CLAMP_BACK_PLATE_THICKNESS;
        double bodyXA2 = -CLAMP_BACK_PLATE_THICKNESS;
        double bodyXA3 = 0;
        double bodyYA0 = 0;
        double bodyYA1 = CLAMP_PLATE_THICKNESS;
        double bodyYA2 = CLAMP_SPAN + CLAMP_PLATE_THICKNESS;
        double bodyYA3 = CLAMP_SPAN + 2 * CLAMP_PLATE_THICKNESS;

        ScadNode body = Scad.primitiveCommented(Polygon.buildWith(b -> b.points(
                new double[]{bodyXA3, bodyYA0},
                new double[]{bodyXA3, bodyYA3},
                new double[]{bodyXA0, bodyYA3},
                new double[]{bodyXA0, bodyYA2},
                new double[]{bodyXA2, bodyYA2},
                new double[]{bodyXA2, bodyYA1},
                new double[]{bodyXA1, bodyYA1},
                new double[]{bodyXA1, bodyYA0})), "body outer shape");

        ScadNode bodyRounded = Scad.modifierCommented(new Difference(), Scad.block(
                body,
                roundedCornerVoid(bodyXA1, bodyYA1, CLAMP_CHAMFER_R, false, true, 64).commented("upper chamfer"),
                roundedCornerVoid(bodyXA0, bodyYA2, CLAMP_CHAMFER_R, false, false, 64).commented("lower chamfer")),
                "body rounded");

        double toothXA0 = -CLAMP_NAIL_BASE_WIDTH;
        double toothXA1 = (-CLAMP_NAIL_TOP_WIDTH - CLAMP_NAIL_BASE_WIDTH) / 2;
        double toothXA2 = (CLAMP_NAIL_TOP_WIDTH - CLAMP_NAIL_BASE_WIDTH) / 2;
        double toothXA3 = 0;
        double toothYA0 = -CLAMP_NAIL_HEIGHT;
        double toothYA1 = 0;
        double toothYA2 = SMALL_OVERLAP;
        ScadNode tooth = Scad.primitive(Polygon.buildWith(b -> b.points(
                new double[]{toothXA0, toothYA1},
                new double[]{toothXA1, toothYA0},
                new double[]{toothXA2, toothYA0},
                new double[]{toothXA3, toothYA1},
                new double[]{toothXA3, toothYA2},
                new double[]{toothXA0, toothYA2})));

        List<ScadNode> parts = new ArrayList<>();
        parts.add(bodyRounded);
        for (double pos : CLAMP_NAIL_POS) {
            parts.add(Scad.modifier(Translate2D.buildWith(b -> b.v(bodyXA2 - pos, bodyYA2)), tooth));
        }
        ScadNode shape = Scad.modifierCommented(new Union(), Scad.block(parts), "body with teeth");

        return Scad.modifier(LinearExtrude.buildWith(b -> b.height(CLAMP_Z_SIZE)), shape);
    }

    private static ScadNode clampWithHook() {
        double hookPosY = CLAMP_SPAN / 2 + CLAMP_PLATE_THICKNESS;

        ScadNode hookOuter = Scad.union(
                Scad.modifier(Translate3D.buildWith(b -> b.v(0, 0, -SMALL_OVERLAP)),
                        Scad.primitive(Cylinder.buildWith(b -> b.h(HOOK_LENGTH + 2 * SMALL_OVERLAP).r(HOOK_OUTER_R).fn(64)))),
                Scad.modifier(Translate3D.buildWith(b -> b.v(0, 0, HOOK_LENGTH)),
                        Scad.primitive(Cylinder.buildWith(b -> b.h(HOOK_END_LENGTH).r(HOOK_END_R).fn(64)))))
                .commented("hook outer");

        ScadNode hookVoid = Scad.modifierCommented(Translate3D.buildWith(b -> b.v(0, 0, HOOK_INFILL_HEIGHT)),
                Scad.primitive(Cylinder.buildWith(b -> b
                        .h(HOOK_LENGTH + HOOK_END_LENGTH - HOOK_INFILL_HEIGHT + SMALL_OVERLAP)
                        .r(HOOK_INNER_R)
                        .fn(6))),
                "hook void");

        ScadNode hook = Scad.difference(hookOuter, hookVoid);

        return Scad.union(clamp(),
                Scad.modifier(Translate3D.buildWith(b -> b.v(-SMALL_OVERLAP, hookPosY, CLAMP_Z_SIZE / 2)),
                        Scad.modifier(Rotate3D.buildWith(b -> b.deg(0, 90, 0)), hook)));
    }

    @Test
    void clampProfileExtruded() {
        assertEquals(CLAMP, clamp().toCode());
    }

    @Test
    void clampWithHookAttached() {
        assertEquals(BODY, clampWithHook().toCode());
    }

    private static final String CLAMP = """
                linear_extrude(height = 45)
                  /* body with teeth */
                  union() {
                    /* body rounded */
                    difference() {
                      /* body outer shape */
                      polygon(points = [[0, 0], [0, 29], [-35, 29], [-35, 24], [-5, 24], [-5, 5], [-15, 5], [-15, 0]]);
                      /* upper chamfer */
                      difference() {
                        translate([-15, 3])
                          square(size = 2);
                        translate([-13, 3])
                          circle(r = 2, $fn = 64);
                      }
                      /* lower chamfer */
                      difference() {
                        translate([-35, 24])
                          square(size = 2);
                        translate([-33, 26])
                          circle(r = 2, $fn = 64);
                      }
                    }
                    translate([-9.5, 24])
                      polygon(points = [[-3.6, 0], [-2.7, -0.4], [-0.9, -0.4], [0, 0], [0, 0.025], [-3.6, 0.025]]);
                    translate([-25, 24])
                      polygon(points = [[-3.6, 0], [-2.7, -0.4], [-0.9, -0.4], [0, 0], [0, 0.025], [-3.6, 0.025]]);
                  }
                """;

    private static final String BODY = """
                union() {
                  linear_extrude(height = 45)
                    /* body with teeth */
                    union() {
                      /* body rounded */
                      difference() {
                        /* body outer shape */
                        polygon(points = [[0, 0], [0, 29], [-35, 29], [-35, 24], [-5, 24], [-5, 5], [-15, 5], [-15, 0]]);
                        /* upper chamfer */
                        difference() {
                          translate([-15, 3])
                            square(size = 2);
                          translate([-13, 3])
                            circle(r = 2, $fn = 64);
                        }
                        /* lower chamfer */
                        difference() {
                          translate([-35, 24])
                            square(size = 2);
                          translate([-33, 26])
                            circle(r = 2, $fn = 64);
                        }
                      }
                      translate([-9.5, 24])
                        polygon(points = [[-3.6, 0], [-2.7, -0.4], [-0.9, -0.4], [0, 0], [0, 0.025], [-3.6, 0.025]]);
                      translate([-25, 24])
                        polygon(points = [[-3.6, 0], [-2.7, -0.4], [-0.9, -0.4], [0, 0], [0, 0.025], [-3.6, 0.025]]);
                    }
                  translate([-0.025, 14.5, 22.5])
                    rotate(a = [0, 90, 0])
                      difference() {
                        /* hook outer */
                        union() {
                          translate([0, 0, -0.025])
                            cylinder(h = 60.05, r = 14, $fn = 64);
                          translate([0, 0, 60])
                            cylinder(h = 5, r = 21, $fn = 64);
                        }
                        /* hook void */
                        translate([0, 0, 5])
                          cylinder(h = 60.025, r = 12, $fn = 6);
                      }
                }
                """;
}
