package co.fanki.codeintel.graph.domain;

/**
 * Kind of a node in the project call graph.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum NodeKind {

    /** A method, function or constructor. */
    METHOD("method"),

    /** A source file containing methods. */
    FILE("file");

    private final String storageValue;

    NodeKind(final String theStorageValue) {
        this.storageValue = theStorageValue;
    }

    /**
     * Returns the value persisted in the {@code nodes.kind} column.
     *
     * @return the lowercase kind name
     */
    public String storageValue() {
        return storageValue;
    }

    /**
     * Resolves a kind from its persisted value.
     *
     * @param value the column value
     * @return the matching kind
     * @throws IllegalArgumentException if the value is unknown
     */
    public static NodeKind fromStorageValue(final String value) {
        for (final NodeKind kind : values()) {
            if (kind.storageValue.equals(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown node kind: " + value);
    }

}
