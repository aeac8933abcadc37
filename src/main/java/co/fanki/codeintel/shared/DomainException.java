package co.fanki.codeintel.shared;

/**
 * Base exception for domain-level errors.
 *
 * <p>Every domain exception carries an error code so callers at the edge
 * (HTTP layer, MCP tools) can map it without parsing messages. The codes
 * used in this project are declared as constants here.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DomainException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Generic code used when no specific one applies. */
    public static final String DOMAIN_ERROR = "DOMAIN_ERROR";

    /** A job already runs on an overlapping directory. */
    public static final String JOB_ROOT_OVERLAP = "JOB_ROOT_OVERLAP";

    /** The requested job root is not an existing directory. */
    public static final String JOB_INVALID_ROOT = "JOB_INVALID_ROOT";

    /** No job or job log is known for the given id. */
    public static final String JOB_NOT_FOUND = "JOB_NOT_FOUND";

    /** The audit log of a new job cannot be created. */
    public static final String JOB_LOG_UNAVAILABLE = "JOB_LOG_UNAVAILABLE";

    /** A job status change is not allowed by the state machine. */
    public static final String JOB_INVALID_TRANSITION = "JOB_INVALID_TRANSITION";

    /** A checkpoint value could not be written or read. */
    public static final String CHECKPOINT_SERIALIZATION =
            "CHECKPOINT_SERIALIZATION";

    private final String errorCode;

    /**
     * Creates a new domain exception with the generic error code.
     *
     * @param message the error message
     */
    public DomainException(final String message) {
        this(message, DOMAIN_ERROR);
    }

    /**
     * Creates a new domain exception with a message and error code.
     *
     * @param message the error message
     * @param theErrorCode the specific error code
     */
    public DomainException(final String message, final String theErrorCode) {
        super(message);
        this.errorCode = theErrorCode;
    }

    /**
     * Creates a new domain exception with message, error code, and cause.
     *
     * @param message the error message
     * @param theErrorCode the specific error code
     * @param cause the underlying cause
     */
    public DomainException(final String message, final String theErrorCode,
            final Throwable cause) {
        super(message, cause);
        this.errorCode = theErrorCode;
    }

    /**
     * Returns the error code for this exception.
     *
     * @return the error code, never null
     */
    public String getErrorCode() {
        return errorCode;
    }

}
