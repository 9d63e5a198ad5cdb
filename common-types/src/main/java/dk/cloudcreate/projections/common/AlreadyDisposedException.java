package dk.cloudcreate.projections.common;

/**
 * Thrown when a component is used after it has been closed/disposed
 */
public class AlreadyDisposedException extends IllegalStateException {
    public AlreadyDisposedException(String message) {
        super(message);
    }

    public AlreadyDisposedException(String message, Throwable cause) {
        super(message, cause);
    }

    public AlreadyDisposedException(Throwable cause) {
        super(cause);
    }
}
