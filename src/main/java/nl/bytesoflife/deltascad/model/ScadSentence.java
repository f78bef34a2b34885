package nl.bytesoflife.deltascad.model;

import java.util.List;

/**
 * The name and arguments of a SCAD call such as {@code cube(size = 10)}.
 */
public interface ScadSentence {

    String name();

    /**
     * @return the dimension this sentence produces
     */
    Dimension dimension();

    /**
     * @return the present arguments in output order
     */
    List<ScadOption> options();
}
