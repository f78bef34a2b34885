package nl.bytesoflife.deltascad;

import nl.bytesoflife.deltascad.model.ScadNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered list of top-level nodes making up one {@code .scad} file.
 * Nodes are separated by a blank line.
 */
public class ScadDocument {

    private static final Logger log = LoggerFactory.getLogger(ScadDocument.class);

    private final List<ScadNode> nodes = new ArrayList<>();

    public ScadDocument add(ScadNode node) {
        nodes.add(node);
        return this;
    }

    public ScadDocument add(TypedObject<?> object) {
        return add(object.node());
    }

    public List<ScadNode> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * @return the code of all nodes, each terminated by a line break, with a blank line between nodes.
     *         An empty document gives an empty string.
     */
    public String toCode() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0) sb.append('\n');
            sb.append(nodes.get(i).toCode());
        }
        return sb.toString();
    }

    /**
     * Write the document as UTF-8, replacing the file if it exists.
     */
    public void writeTo(Path file) throws IOException {
        String code = toCode();
        Files.writeString(file, code, StandardCharsets.UTF_8);
        log.info("Wrote {} statements ({} chars) to {}", nodes.size(), code.length(), file);
    }
}
