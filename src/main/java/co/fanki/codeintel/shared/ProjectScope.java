package co.fanki.codeintel.shared;

import java.io.Serializable;
import java.util.Optional;

/**
 * Value object identifying the tenant partition of the stores.
 *
 * <p>A scope is either a named project or the single unscoped partition.
 * The unscoped partition is persisted with the empty string as key so
 * that composite primary keys stay unique (SQLite treats NULL key
 * columns as distinct).</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ProjectScope implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final String UNSCOPED_KEY = "";

    private static final ProjectScope UNSCOPED = new ProjectScope(null);

    private final String name;

    private ProjectScope(final String theName) {
        this.name = theName;
    }

    /**
     * Creates a scope for a named project.
     *
     * @param name the project name, never blank
     * @return the project scope
     * @throws IllegalArgumentException if name is blank
     */
    public static ProjectScope of(final String name) {
        return new ProjectScope(Preconditions.requireNonBlank(name,
                "Project name is required"));
    }

    /**
     * Returns the unscoped (default) partition.
     *
     * @return the unscoped partition
     */
    public static ProjectScope unscoped() {
        return UNSCOPED;
    }

    /**
     * Creates a scope from a nullable project name.
     *
     * <p>A null or blank name maps to the unscoped partition.</p>
     *
     * @param name the project name, may be null
     * @return the matching scope
     */
    public static ProjectScope ofNullable(final String name) {
        if (name == null || name.isBlank()) {
            return UNSCOPED;
        }
        return new ProjectScope(name.trim());
    }

    /**
     * Rebuilds a scope from its storage key.
     *
     * @param key the persisted key
     * @return the matching scope
     */
    public static ProjectScope fromStorageKey(final String key) {
        return ofNullable(key);
    }

    /** Returns the project name, empty for the unscoped partition. */
    public Optional<String> name() {
        return Optional.ofNullable(name);
    }

    /** Checks whether this is the unscoped partition. */
    public boolean isUnscoped() {
        return name == null;
    }

    /**
     * Returns the value stored in the {@code project} key columns.
     *
     * @return the project name or the empty sentinel
     */
    public String storageKey() {
        return name != null ? name : UNSCOPED_KEY;
    }

    /**
     * Returns the name shown in human-readable reports.
     *
     * @return the project name or {@code (default)}
     */
    public String displayName() {
        return name != null ? name : "(default)";
    }

    /**
     * Qualifies a raw identifier with this scope.
     *
     * @param rawId the identifier local to the project
     * @return {@code <project>::<rawId>}, or rawId when unscoped
     */
    public String qualify(final String rawId) {
        return name != null ? name + "::" + rawId : rawId;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final ProjectScope that = (ProjectScope) obj;
        return storageKey().equals(that.storageKey());
    }

    @Override
    public int hashCode() {
        return storageKey().hashCode();
    }

    @Override
    public String toString() {
        return displayName();
    }

}
