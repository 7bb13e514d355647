package io.dynamis.synphot.physics;

import io.dynamis.synphot.api.Bandpass;
import io.dynamis.synphot.api.PhotometricParameters;
import io.dynamis.synphot.api.PhotometryConstants;
import io.dynamis.synphot.api.Sed;

/**
 * Closed-form photometric error model of Ivezic et al. (2008, arXiv:0805.2366, eq. 5).
 *
 *   x     = 10^(0.4 * (mag - m5))
 *   NSR^2 = (0.04 - gamma) * x + gamma * x^2
 *   SNR   = 1 / sqrt(NSR^2)
 *   sigma = 2.5 * log10(1 + 1 / SNR), combined in quadrature with sigmaSys
 *
 * gamma captures how far the noise at m5 is from the pure sky-limited case.
 * It is derived from the bandpass, m5 and the instrument: a flat spectrum is
 * normalized to m5, its ADU count S5 is computed, and gamma = 0.04 - 1/(S5 * gain).
 * gamma is clamped to [0, 0.04]; within that range the error grows
 * monotonically with mag - m5.
 */
public final class SignalToNoise {

    private SignalToNoise() {}

    /**
     * ADU recorded from sed through bandpass in one visit:
     * sum(fnu / lambda * throughput) * dlambda * t * area / gain / (1e23 * h).
     */
    public static double adu(Sed sed, Bandpass bandpass, PhotometricParameters params) {
        if (sed == null) {
            throw new NullPointerException("sed");
        }
        if (bandpass == null) {
            throw new NullPointerException("bandpass");
        }
        if (params == null) {
            throw new NullPointerException("params");
        }
        if (sed.isEmpty()) {
            return Double.NaN;
        }
        Sed onGrid = sed;
        if (!sed.grid().matches(bandpass.grid())) {
            onGrid = sed.copy();
            onGrid.resample(bandpass.grid());
        }
        double[] fnu = onGrid.fnu();
        double photons = 0.0;
        for (int i = 0; i < fnu.length; i++) {
            photons += fnu[i] / bandpass.grid().at(i) * bandpass.throughputAt(i);
        }
        return photons
            * (params.totalExposureSeconds() * params.effectiveAreaCm2() / params.gain())
            / PhotometryConstants.JANSKY_PER_CGS
            / PhotometryConstants.PLANCK_ERG_S
            * bandpass.grid().step();
    }

    /** gamma for a band with limiting magnitude m5. */
    public static double gamma(Bandpass bandpass, double m5, PhotometricParameters params) {
        Sed flat = Sed.flat(bandpass.grid());
        flat.multiplyFluxNorm(flat.fluxNormFor(m5, bandpass));
        double counts = adu(flat, bandpass, params);
        double gamma = PhotometryConstants.NSR_SQUARED_AT_M5 - 1.0 / (counts * params.gain());
        return Math.max(0.0, Math.min(PhotometryConstants.NSR_SQUARED_AT_M5, gamma));
    }

    /** SNR of a source of magnitude mag given m5 and gamma. */
    public static double snrFromM5(double mag, double m5, double gamma) {
        double x = Math.pow(10.0, 0.4 * (mag - m5));
        double nsrSquared = (PhotometryConstants.NSR_SQUARED_AT_M5 - gamma) * x + gamma * x * x;
        if (!(nsrSquared > 0.0)) {
            return Double.POSITIVE_INFINITY;
        }
        return 1.0 / Math.sqrt(nsrSquared);
    }

    /** sigma = 2.5 * log10(1 + 1/SNR). */
    public static double magErrorFromSnr(double snr) {
        return 2.5 * Math.log10(1.0 + 1.0 / snr);
    }

    /**
     * Magnitude uncertainty including the systematic floor.
     * NaN magnitudes propagate as NaN.
     */
    public static double magError(double mag, double m5, double gamma, double sigmaSys) {
        if (Double.isNaN(mag)) {
            return Double.NaN;
        }
        double random = magErrorFromSnr(snrFromM5(mag, m5, gamma));
        return Math.sqrt(random * random + sigmaSys * sigmaSys);
    }
}
