package gov.nih.ncats.objdetect.cascade;

/**
 * Thrown when a cascade description is malformed: missing window
 * dimensions, empty stages, or trees without 1 to 3 features.
 */
public class InvalidClassifierException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidClassifierException(String message) {
        super(message);
    }

    public InvalidClassifierException(String message, Throwable cause) {
        super(message, cause);
    }
}
