package nl.bytesoflife.deltascad.render;

import nl.bytesoflife.deltascad.model.ScadNode;
import nl.bytesoflife.deltascad.model.ScadOption;
import nl.bytesoflife.deltascad.model.ScadSentence;
import nl.bytesoflife.deltascad.model.Statement;

import java.util.List;

/**
 * Renders a node tree to SCAD code.
 *
 * Layout rules:
 * <ul>
 *   <li>a primitive is written as {@code name(options);}</li>
 *   <li>a modifier with a non-block child is written as {@code name(options)} followed by the child
 *       on the next line, one level deeper, without braces</li>
 *   <li>a modifier whose child is a block puts the opening brace on the header line, after a space</li>
 *   <li>a block writes each child one level deeper between braces; an empty block is {@code {\n}}</li>
 *   <li>comments are written on their own line above the statement, at the statement's indent</li>
 * </ul>
 * Rendering is pure: the same tree always gives the same text and the tree is not modified.
 */
public final class ScadRenderer {

    /** Spaces per indent level. */
    public static final int INDENT = 2;

    private ScadRenderer() {
    }

    public static String render(ScadNode node) {
        return render(node, 0);
    }

    /**
     * Render a node, without a trailing line break.
     *
     * @param node        the node to render
     * @param indentLevel indent level of the node's first line
     * @return the SCAD code
     */
    public static String render(ScadNode node, int indentLevel) {
        if (indentLevel < 0) {
            throw new IllegalArgumentException("Indent level must be >= 0");
        }
        StringBuilder sb = new StringBuilder();
        appendNode(sb, node, indentLevel);
        return sb.toString();
    }

    /**
     * Render the call part of a sentence, e.g. {@code cube(size = 15, center = true)}.
     */
    public static String header(ScadSentence sentence) {
        StringBuilder sb = new StringBuilder();
        appendHeader(sb, sentence);
        return sb.toString();
    }

    private static void appendNode(StringBuilder sb, ScadNode node, int level) {
        if (node.hasComment()) {
            appendComment(sb, node.comment(), level);
        }
        indent(sb, level);

        Statement statement = node.statement();
        if (statement instanceof Statement.Primitive primitive) {
            appendHeader(sb, primitive.body());
            sb.append(';');
        } else if (statement instanceof Statement.Modifier modifier) {
            appendHeader(sb, modifier.body());
            ScadNode child = modifier.child();
            if (child.statement() instanceof Statement.Block block) {
                sb.append(' ');
                appendBraces(sb, block.children(), child.comment(), level);
            } else {
                sb.append('\n');
                appendNode(sb, child, level + 1);
            }
        } else {
            Statement.Block block = (Statement.Block) statement;
            appendBraces(sb, block.children(), null, level);
        }
    }

    private static void appendBraces(StringBuilder sb, List<ScadNode> children, String innerComment, int level) {
        sb.append("{\n");
        if (innerComment != null) {
            appendComment(sb, innerComment, level + 1);
        }
        for (ScadNode child : children) {
            appendNode(sb, child, level + 1);
            sb.append('\n');
        }
        indent(sb, level);
        sb.append('}');
    }

    private static void appendHeader(StringBuilder sb, ScadSentence sentence) {
        sb.append(sentence.name()).append('(');
        List<ScadOption> options = sentence.options();
        for (int i = 0; i < options.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(options.get(i));
        }
        sb.append(')');
    }

    private static void appendComment(StringBuilder sb, String comment, int level) {
        indent(sb, level);
        sb.append("/* ").append(comment).append(" */\n");
    }

    private static void indent(StringBuilder sb, int level) {
        sb.append(" ".repeat(level * INDENT));
    }
}
