package nl.bytesoflife.deltascad.model;

import nl.bytesoflife.deltascad.sentence.modifier.Color;
import nl.bytesoflife.deltascad.sentence.modifier.LinearExtrude;
import nl.bytesoflife.deltascad.sentence.modifier.Projection;
import nl.bytesoflife.deltascad.sentence.modifier.Translate2D;
import nl.bytesoflife.deltascad.sentence.modifier.Union;
import nl.bytesoflife.deltascad.sentence.primitive.Circle;
import nl.bytesoflife.deltascad.sentence.primitive.Cube;
import nl.bytesoflife.deltascad.sentence.primitive.Square;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StatementTest {

    private static ScadNode square() {
        return new ScadNode(new Statement.Primitive(Square.buildWith(b -> b.size(10))));
    }

    private static ScadNode circle() {
        return new ScadNode(new Statement.Primitive(Circle.buildWith(b -> b.r(5))));
    }

    private static ScadNode cube() {
        return new ScadNode(new Statement.Primitive(Cube.buildWith(b -> b.size(10))));
    }

    @Test
    void primitiveTakesItsSentenceDimension() {
        assertEquals(Dimension.TWO_D, square().dimension());
        assertEquals(Dimension.THREE_D, cube().dimension());
        assertTrue(square().statement().children().isEmpty());
    }

    @Test
    void modifierRejectsChildOfOtherDimension() {
        DimensionMismatchException e = assertThrows(DimensionMismatchException.class,
                () -> new Statement.Modifier(Translate2D.buildWith(b -> b.v(1, 2)), cube()));
        assertEquals(new DimensionMismatch(Dimension.TWO_D, Dimension.THREE_D, 0), e.getMismatch());
    }

    @Test
    void extrusionTurnsTwoDimensionalChildIntoSolid() {
        Statement.Modifier extrude = new Statement.Modifier(LinearExtrude.buildWith(b -> b.height(5)), square());
        assertEquals(Dimension.THREE_D, extrude.dimension());
        assertThrows(DimensionMismatchException.class,
                () -> new Statement.Modifier(LinearExtrude.buildWith(b -> b.height(5)), cube()));
    }

    @Test
    void projectionTurnsSolidIntoOutline() {
        Statement.Modifier projection = new Statement.Modifier(Projection.buildWith(b -> b.cut(true)), cube());
        assertEquals(Dimension.TWO_D, projection.dimension());
    }

    @Test
    void mixedModifierAdoptsChildDimension() {
        Color red = Color.buildWith(b -> b.named("red"));
        assertEquals(Dimension.TWO_D, new Statement.Modifier(red, square()).dimension());
        assertEquals(Dimension.THREE_D, new Statement.Modifier(red, cube()).dimension());

        ScadNode empty = new ScadNode(new Statement.Block(List.of()));
        assertEquals(Dimension.MIXED, new Statement.Modifier(new Union(), empty).dimension());
    }

    @Test
    void blockJoinsChildren() {
        assertEquals(Dimension.MIXED, new Statement.Block(List.of()).dimension());
        assertEquals(Dimension.TWO_D, new Statement.Block(List.of(square(), circle())).dimension());

        ScadNode emptyUnion = new ScadNode(new Statement.Modifier(new Union(),
                new ScadNode(new Statement.Block(List.of()))));
        assertEquals(Dimension.THREE_D, new Statement.Block(List.of(emptyUnion, cube())).dimension());
    }

    @Test
    void blockRejectsMixedDimensions() {
        DimensionMismatchException e = assertThrows(DimensionMismatchException.class,
                () -> new Statement.Block(List.of(square(), circle(), cube())));
        assertEquals(new DimensionMismatch(Dimension.TWO_D, Dimension.THREE_D, 2), e.getMismatch());
    }

    @Test
    void blockCopiesItsChildren() {
        List<ScadNode> children = new ArrayList<>(List.of(square()));
        Statement.Block block = new Statement.Block(children);
        children.add(cube());
        assertEquals(1, block.children().size());
        assertThrows(UnsupportedOperationException.class, () -> block.children().add(circle()));
    }

    @Test
    void commentedCopiesLeaveOriginalUntouched() {
        ScadNode plain = square();
        ScadNode commented = plain.commented("a square");

        assertFalse(plain.hasComment());
        assertEquals("a square", commented.getComment().orElseThrow());
        assertEquals(plain.statement(), commented.statement());
        assertEquals(plain, commented.uncommented());
    }

    @Test
    void compositionResult() {
        CompositionResult ok = new CompositionResult.Success(square());
        assertTrue(ok.isSuccess());
        assertEquals(square(), ok.orElseThrow());

        DimensionMismatch mismatch = new DimensionMismatch(Dimension.TWO_D, Dimension.THREE_D, 0);
        CompositionResult failed = new CompositionResult.Failure(mismatch);
        assertFalse(failed.isSuccess());
        assertTrue(failed.toOptional().isEmpty());
        DimensionMismatchException e = assertThrows(DimensionMismatchException.class, failed::orElseThrow);
        assertSame(mismatch, e.getMismatch());
        assertEquals("Dimension mismatch at child 0: expected TWO_D, got THREE_D", e.getMessage());
    }
}
