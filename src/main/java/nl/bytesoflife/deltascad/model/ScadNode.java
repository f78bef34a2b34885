package nl.bytesoflife.deltascad.model;

import nl.bytesoflife.deltascad.render.ScadRenderer;

import java.util.Objects;
import java.util.Optional;

/**
 * A statement with an optional comment. Nodes are immutable; a tree of nodes renders
 * the same text every time.
 *
 * @param statement the payload
 * @param comment   text written as a block comment on the line above the statement, or null.
 *                  It is written verbatim, so text containing the comment terminator breaks the output.
 */
public record ScadNode(Statement statement, String comment) {

    public ScadNode {
        Objects.requireNonNull(statement, "statement");
    }

    public ScadNode(Statement statement) {
        this(statement, null);
    }

    public Dimension dimension() {
        return statement.dimension();
    }

    public Optional<String> getComment() {
        return Optional.ofNullable(comment);
    }

    public boolean hasComment() {
        return comment != null;
    }

    /**
     * @return a copy of this node carrying {@code text} as its comment
     */
    public ScadNode commented(String text) {
        return new ScadNode(statement, text);
    }

    public ScadNode uncommented() {
        return comment == null ? this : new ScadNode(statement, null);
    }

    /**
     * Render this node at the top level, terminated by a line break.
     */
    public String toCode() {
        return ScadRenderer.render(this) + "\n";
    }

    @Override
    public String toString() {
        return ScadRenderer.render(this);
    }
}
