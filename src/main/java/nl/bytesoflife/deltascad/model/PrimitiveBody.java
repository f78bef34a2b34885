package nl.bytesoflife.deltascad.model;

/**
 * A leaf sentence, e.g. {@code circle()} or {@code cube()}.
 */
public interface PrimitiveBody extends ScadSentence {
}
