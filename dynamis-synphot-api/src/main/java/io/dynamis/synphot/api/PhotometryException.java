package io.dynamis.synphot.api;

/**
 * Base class for failures raised by the photometry stack.
 *
 * Unchecked: every subclass signals a caller-side configuration problem that
 * no retry can fix. File-system failures are reported as IOException instead.
 */
public class PhotometryException extends RuntimeException {

    public PhotometryException(String message) {
        super(message);
    }

    public PhotometryException(String message, Throwable cause) {
        super(message, cause);
    }
}
