package au.org.ala.pixels;

/**
 * Base class for edit failures that are reported back to the user. Every failure leaves the
 * previously committed editor state untouched.
 */
public class EditorException extends RuntimeException {

    public enum Reason {
        NO_IMAGE_LOADED,
        INVALID_DIMENSIONS,
        INVALID_RECT
    }

    private final Reason reason;

    public EditorException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
