package gov.nih.ncats.objdetect;

/**
 * Thrown when image or table dimensions do not agree with the buffer
 * that was supplied, or with the window size of the classifier.
 * Detection never starts when this is thrown.
 */
public class DimensionMismatchException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public DimensionMismatchException(String message) {
        super(message);
    }

    /**
     * Check that a buffer holds at least {@code width*height} samples.
     * @param what name of the buffer, used in the message.
     * @param length the actual buffer length.
     * @param width the width in samples; must be positive.
     * @param height the height in samples; must be positive.
     * @throws DimensionMismatchException if the dimensions are not positive
     * or the buffer is too short.
     */
    public static void checkBuffer(String what, int length, int width, int height){
        if(width <= 0 || height <= 0){
            throw new DimensionMismatchException(what + " dimensions must be positive but were " + width + "x" + height);
        }
        long needed = (long) width * height;
        if(length < needed){
            throw new DimensionMismatchException(what + " has " + length + " samples but " + width + "x" + height + " needs " + needed);
        }
    }
}
