package co.fanki.codeintel.shared;

/**
 * Argument validation helpers.
 *
 * <p>Structurally invalid calls (missing ids, null collaborators) are
 * programmer errors and surface as {@link IllegalArgumentException}.
 * Business-rule violations use {@link DomainException} instead.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Preconditions {

    private Preconditions() {
    }

    /**
     * Ensures that an object reference is not null.
     *
     * @param reference the object reference to check
     * @param message the exception message if null
     * @param <T> the type of the reference
     * @return the non-null reference
     * @throws IllegalArgumentException if reference is null
     */
    public static <T> T requireNonNull(final T reference, final String message) {
        if (reference == null) {
            throw new IllegalArgumentException(message);
        }
        return reference;
    }

    /**
     * Ensures that a string is not null or blank.
     *
     * @param value the string to check
     * @param message the exception message if null or blank
     * @return the non-blank string
     * @throws IllegalArgumentException if value is null or blank
     */
    public static String requireNonBlank(final String value,
            final String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    /**
     * Ensures that a condition is true.
     *
     * @param condition the condition to check
     * @param message the exception message if false
     * @throws IllegalArgumentException if condition is false
     */
    public static void require(final boolean condition, final String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Ensures that a number is non-negative.
     *
     * @param value the number to check
     * @param message the exception message if negative
     * @return the non-negative number
     * @throws IllegalArgumentException if value is negative
     */
    public static int requireNonNegative(final int value, final String message) {
        if (value < 0) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    /**
     * Clamps a value into the inclusive range {@code [min, max]}.
     *
     * <p>Used for user-supplied query bounds (traversal depth, fan-out
     * limits) where out-of-range input is corrected rather than
     * rejected.</p>
     *
     * @param value the requested value
     * @param min the lower bound
     * @param max the upper bound
     * @return the clamped value
     */
    public static int clamp(final int value, final int min, final int max) {
        return Math.max(min, Math.min(value, max));
    }

}
