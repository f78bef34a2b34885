package nl.bytesoflife.deltascad.model;

/**
 * Dimension tag of a statement.
 * MIXED statements are compatible with both 2D and 3D ones.
 */
public enum Dimension {
    TWO_D("Object2D"),
    THREE_D("Object3D"),
    MIXED("ObjectMixed");

    private final String label;

    Dimension(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * @param required the dimension a parent asks for
     * @return true if a statement of this dimension may be placed where {@code required} is expected
     */
    public boolean isCompatibleWith(Dimension required) {
        return this == required || required == MIXED || this == MIXED;
    }

    /**
     * Join of two compatible tags: the concrete one wins over MIXED.
     */
    public Dimension join(Dimension other) {
        if (!isCompatibleWith(other)) {
            throw new IllegalArgumentException("Cannot join " + this + " with " + other);
        }
        return this == MIXED ? other : this;
    }

    public boolean isConcrete() {
        return this != MIXED;
    }
}
