package io.dynamis.synphot.api;

/**
 * Thrown when array shapes cannot be reconciled: a magnitude matrix whose row
 * count differs from the band count, parallel inputs of different lengths, or
 * a spectrum whose wavelength grid does not overlap the bandpass grid.
 */
public final class ShapeMismatchException extends PhotometryException {

    public ShapeMismatchException(String message) {
        super(message);
    }

    /** Convenience for the common expected-versus-actual length check. */
    public static void requireLength(String what, int expected, int actual) {
        if (expected != actual) {
            throw new ShapeMismatchException(
                what + " has length " + actual + "; expected " + expected);
        }
    }
}
