package io.dynamis.synphot.physics;

import io.dynamis.synphot.api.PhotometryConstants;
import io.dynamis.synphot.api.Sed;
import io.dynamis.synphot.api.ShapeMismatchException;
import java.util.List;

/**
 * Applies per-object interstellar dust extinction to a batch of SEDs in place.
 *
 * flambda *= 10^(-0.4 * Av * (a(lambda) + b(lambda) / Rv))
 *
 * The (a, b) coefficients depend only on the wavelength grid. They come from
 * the injected DustCoefficientCache, so a batch whose SEDs share one grid pays
 * for the coefficient synthesis once.
 */
public final class ExtinctionEngine {

    private final DustCoefficientCache cache;

    public ExtinctionEngine() {
        this(new DustCoefficientCache());
    }

    public ExtinctionEngine(DustCoefficientCache cache) {
        if (cache == null) {
            throw new NullPointerException("cache");
        }
        this.cache = cache;
    }

    public DustCoefficientCache cache() {
        return cache;
    }

    /** applyInPlace with Rv = 3.1. */
    public void applyInPlace(List<Sed> seds, double[] avValues) {
        applyInPlace(seds, avValues, PhotometryConstants.DEFAULT_RV);
    }

    /**
     * @param seds     SEDs to redden; empty sentinels are skipped
     * @param avValues per-object Av in magnitudes, or null for no-op
     * @param rv       ratio of total to selective extinction
     * @throws ShapeMismatchException if avValues and seds differ in length
     */
    public void applyInPlace(List<Sed> seds, double[] avValues, double rv) {
        if (avValues == null) {
            return;
        }
        if (seds == null) {
            throw new NullPointerException("seds");
        }
        ShapeMismatchException.requireLength("avValues", seds.size(), avValues.length);

        DustCoefficients current = null;
        double[] a = null;
        double[] b = null;
        for (int i = 0; i < seds.size(); i++) {
            Sed sed = seds.get(i);
            if (sed == null || sed.isEmpty()) {
                continue;
            }
            DustCoefficients coefficients = cache.coefficientsFor(sed.grid());
            if (coefficients != current) {
                current = coefficients;
                a = coefficients.a();
                b = coefficients.b();
            }
            sed.applyExtinction(a, b, avValues[i], rv);
        }
    }
}
