package io.dynamis.synphot.api;

/**
 * Physical and numerical constants shared by the synthetic photometry stack.
 *
 * Units: wavelength in nanometres, flambda in erg/cm^2/s/nm, fnu in Jansky.
 * Changing any grid constant changes every cached phi array and dust
 * coefficient set downstream.
 */
public final class PhotometryConstants {

    private PhotometryConstants() {}

    // -- Default wavelength grid -----------------------------------------------

    /** Lower edge of the default throughput grid, in nm. */
    public static final double MIN_WAVELENGTH_NM = 300.0;

    /** Upper edge of the default throughput grid, in nm. */
    public static final double MAX_WAVELENGTH_NM = 1150.0;

    /** Spacing of the default throughput grid, in nm. */
    public static final double WAVELENGTH_STEP_NM = 0.1;

    // -- Normalization -----------------------------------------------------------

    /**
     * Wavelength of the delta-function reference bandpass used to apply magNorm.
     * A magNorm is the AB magnitude of the flux density at this wavelength.
     */
    public static final double REFERENCE_WAVELENGTH_NM = 500.0;

    /**
     * AB zero point in Jansky units.
     * mag = -2.5 * log10(flux) - AB_ZEROPOINT, so 3631 Jy maps to mag 0.
     */
    public static final double AB_ZEROPOINT = -8.9;

    /** Flux density of a zero-magnitude AB source, in Jansky. */
    public static final double AB_FLAT_FNU_JANSKY = 3631.0;

    // -- Physical constants ------------------------------------------------------

    /** Speed of light in nm/s. */
    public static final double LIGHT_SPEED_NM_PER_S = 2.99792458e17;

    /** erg/cm^2/s/Hz per Jansky is 1e-23; this is the inverse factor. */
    public static final double JANSKY_PER_CGS = 1.0e23;

    /** Planck constant in erg*s. */
    public static final double PLANCK_ERG_S = 6.626068e-27;

    // -- Dust --------------------------------------------------------------------

    /** Default ratio of total to selective extinction, Rv = Av / E(B-V). */
    public static final double DEFAULT_RV = 3.1;

    // -- Photometric error model -------------------------------------------------

    /**
     * Noise-to-signal squared of a source detected exactly at m5 (SNR = 5).
     * Upper bound of the gamma coefficient.
     */
    public static final double NSR_SQUARED_AT_M5 = 0.04;

    /** Label used by catalogs for objects that carry no SED. */
    public static final String NO_SED = "None";

    /**
     * Verifies internal consistency of the constants.
     * Throws IllegalStateException if any invariant is violated.
     */
    public static void validate() {
        if (!(MIN_WAVELENGTH_NM < MAX_WAVELENGTH_NM)) {
            throw new IllegalStateException("MIN_WAVELENGTH_NM must be < MAX_WAVELENGTH_NM");
        }
        if (WAVELENGTH_STEP_NM <= 0.0) {
            throw new IllegalStateException("WAVELENGTH_STEP_NM must be positive");
        }
        if (REFERENCE_WAVELENGTH_NM < MIN_WAVELENGTH_NM
            || REFERENCE_WAVELENGTH_NM > MAX_WAVELENGTH_NM) {
            throw new IllegalStateException(
                "REFERENCE_WAVELENGTH_NM " + REFERENCE_WAVELENGTH_NM
                    + " lies outside the default grid");
        }
        if (Math.abs(NSR_SQUARED_AT_M5 - 0.2 * 0.2) > 1e-12) {
            throw new IllegalStateException("NSR_SQUARED_AT_M5 must equal (1/5)^2");
        }
    }

    static {
        validate();
    }
}
