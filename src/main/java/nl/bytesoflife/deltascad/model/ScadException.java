package nl.bytesoflife.deltascad.model;

/**
 * Base class for errors raised while building a statement tree.
 * Rendering a built tree never throws.
 */
public abstract class ScadException extends RuntimeException {

    protected ScadException(String message) {
        super(message);
    }
}
