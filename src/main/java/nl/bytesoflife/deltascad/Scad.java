package nl.bytesoflife.deltascad;

import nl.bytesoflife.deltascad.model.CompositionResult;
import nl.bytesoflife.deltascad.model.Dimension;
import nl.bytesoflife.deltascad.model.DimensionMismatch;
import nl.bytesoflife.deltascad.model.DimensionMismatchException;
import nl.bytesoflife.deltascad.model.ModifierBody;
import nl.bytesoflife.deltascad.model.PrimitiveBody;
import nl.bytesoflife.deltascad.model.ScadNode;
import nl.bytesoflife.deltascad.model.Statement;
import nl.bytesoflife.deltascad.sentence.modifier.Difference;
import nl.bytesoflife.deltascad.sentence.modifier.Intersection;
import nl.bytesoflife.deltascad.sentence.modifier.OperatorSentence;
import nl.bytesoflife.deltascad.sentence.modifier.Union;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Entry point for building node trees.
 *
 * <p>Every composition comes in two forms. The eager form ({@link #modifier}, {@link #block})
 * throws {@link DimensionMismatchException} when a child does not fit. The recoverable form
 * ({@link #tryModifier}, {@link #tryBlock}) returns the mismatch as a {@link CompositionResult}.</p>
 *
 * <pre>
 * ScadNode node = Scad.modifier(
 *         Translate3D.buildWith(b -&gt; b.v(5, 0, 0)),
 *         Scad.primitive(Cube.buildWith(b -&gt; b.size(10))));
 * </pre>
 */
public final class Scad {

    private static final Logger log = LoggerFactory.getLogger(Scad.class);

    private Scad() {
    }

    public static ScadNode primitive(PrimitiveBody body) {
        return new ScadNode(new Statement.Primitive(body));
    }

    public static ScadNode primitiveCommented(PrimitiveBody body, String comment) {
        return new ScadNode(new Statement.Primitive(body), comment);
    }

    /**
     * Apply a modifier to a single child.
     *
     * @throws DimensionMismatchException if the child's dimension is not the one the modifier requires
     */
    public static ScadNode modifier(ModifierBody body, ScadNode child) {
        return tryModifier(body, child).orElseThrow();
    }

    /**
     * Apply a modifier to several children, which are wrapped in a block.
     * A single child is applied directly, as with {@link #modifier(ModifierBody, ScadNode)}.
     *
     * @throws DimensionMismatchException if a child does not fit the modifier or its siblings
     */
    public static ScadNode modifier(ModifierBody body, List<ScadNode> children) {
        return tryModifier(body, children).orElseThrow();
    }

    public static ScadNode modifierCommented(ModifierBody body, ScadNode child, String comment) {
        return modifier(body, child).commented(comment);
    }

    public static ScadNode modifierCommented(ModifierBody body, List<ScadNode> children, String comment) {
        return modifier(body, children).commented(comment);
    }

    public static CompositionResult tryModifier(ModifierBody body, ScadNode child) {
        Optional<DimensionMismatch> mismatch = DimensionMismatch.check(body.childDimension(), child, 0);
        if (mismatch.isPresent()) {
            return reject(body.name(), mismatch.get());
        }
        return new CompositionResult.Success(new ScadNode(new Statement.Modifier(body, child)));
    }

    public static CompositionResult tryModifier(ModifierBody body, List<ScadNode> children) {
        for (int i = 0; i < children.size(); i++) {
            Optional<DimensionMismatch> mismatch = DimensionMismatch.check(body.childDimension(), children.get(i), i);
            if (mismatch.isPresent()) {
                return reject(body.name(), mismatch.get());
            }
        }
        if (children.size() == 1) {
            return tryModifier(body, children.get(0));
        }
        CompositionResult block = tryBlock(children);
        if (!block.isSuccess()) {
            return block;
        }
        return tryModifier(body, block.orElseThrow());
    }

    /**
     * @throws DimensionMismatchException if the children do not share one dimension
     */
    public static ScadNode block(ScadNode... children) {
        return block(List.of(children));
    }

    public static ScadNode block(List<ScadNode> children) {
        return tryBlock(children).orElseThrow();
    }

    public static ScadNode blockCommented(String comment, ScadNode... children) {
        return block(children).commented(comment);
    }

    public static ScadNode blockCommented(String comment, List<ScadNode> children) {
        return block(children).commented(comment);
    }

    public static CompositionResult tryBlock(List<ScadNode> children) {
        Optional<DimensionMismatch> mismatch = DimensionMismatch.checkSiblings(children);
        if (mismatch.isPresent()) {
            return reject("block", mismatch.get());
        }
        return new CompositionResult.Success(new ScadNode(new Statement.Block(children)));
    }

    /**
     * {@code union() { lhs; rhs; }}. An uncommented union on either side is merged
     * into the result instead of being nested.
     *
     * @throws DimensionMismatchException if one operand is 2D and the other 3D
     */
    public static ScadNode union(ScadNode lhs, ScadNode rhs) {
        return combine(BooleanOperator.UNION, lhs, rhs);
    }

    /**
     * {@code difference() { lhs; rhs; }}. Only an uncommented difference on the left is merged;
     * the right operand is always nested since it is subtracted as a whole.
     *
     * @throws DimensionMismatchException if one operand is 2D and the other 3D
     */
    public static ScadNode difference(ScadNode lhs, ScadNode rhs) {
        return combine(BooleanOperator.DIFFERENCE, lhs, rhs);
    }

    /**
     * {@code intersection() { lhs; rhs; }}, merging an uncommented intersection on either side.
     *
     * @throws DimensionMismatchException if one operand is 2D and the other 3D
     */
    public static ScadNode intersection(ScadNode lhs, ScadNode rhs) {
        return combine(BooleanOperator.INTERSECTION, lhs, rhs);
    }

    private static ScadNode combine(BooleanOperator operator, ScadNode lhs, ScadNode rhs) {
        Dimension left = lhs.dimension();
        Dimension right = rhs.dimension();
        if (!right.isCompatibleWith(left)) {
            String message = "`" + left.getLabel() + " " + operator.symbol + " " + right.getLabel() + "` is not allowed";
            log.debug("Rejected {}: {}", operator, message);
            throw new DimensionMismatchException(message, new DimensionMismatch(left, right, 1));
        }

        OperatorSentence body = operator.factory.get();
        List<ScadNode> children = new ArrayList<>();
        addOperand(children, lhs, body);
        if (operator.mergeRight) {
            addOperand(children, rhs, body);
        } else {
            children.add(rhs);
        }
        return new ScadNode(new Statement.Modifier(body, new ScadNode(new Statement.Block(children))));
    }

    private static void addOperand(List<ScadNode> children, ScadNode operand, OperatorSentence body) {
        if (!operand.hasComment()
                && operand.statement() instanceof Statement.Modifier modifier
                && modifier.body().equals(body)) {
            ScadNode inner = modifier.child();
            if (inner.statement() instanceof Statement.Block block) {
                if (!inner.hasComment()) {
                    children.addAll(block.children());
                    return;
                }
            } else {
                children.add(inner);
                return;
            }
        }
        children.add(operand);
    }

    private static CompositionResult reject(String statement, DimensionMismatch mismatch) {
        log.debug("Rejected composition of {}: {}", statement, mismatch.describe());
        return new CompositionResult.Failure(mismatch);
    }

    private enum BooleanOperator {
        UNION("+", Union::new, true),
        DIFFERENCE("-", Difference::new, false),
        INTERSECTION("*", Intersection::new, true);

        private final String symbol;
        private final Supplier<OperatorSentence> factory;
        private final boolean mergeRight;

        BooleanOperator(String symbol, Supplier<OperatorSentence> factory, boolean mergeRight) {
            this.symbol = symbol;
            this.factory = factory;
            this.mergeRight = mergeRight;
        }
    }
}
