package co.fanki.codeintel.graph.domain;

/**
 * Type of a directed edge in the project call graph.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum EdgeType {

    /** File to method containment. Always points file to method. */
    CONTAINS("contains"),

    /** Best-effort, name-matched method to method call. */
    CALLS("calls");

    private final String storageValue;

    EdgeType(final String theStorageValue) {
        this.storageValue = theStorageValue;
    }

    /**
     * Returns the value persisted in the {@code edges.type} column.
     *
     * @return the lowercase type name
     */
    public String storageValue() {
        return storageValue;
    }

}
