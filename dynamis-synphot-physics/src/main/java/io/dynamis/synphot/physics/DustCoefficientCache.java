package io.dynamis.synphot.physics;

import io.dynamis.synphot.api.WavelengthGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-entry cache of dust-law coefficients, keyed on the wavelength grid.
 *
 * A lookup hits when the requested grid matches the cached one by identity
 * token or by content (WavelengthGrid.matches). A grid of the same length but
 * different values always misses.
 *
 * Not thread safe. Owned by one ExtinctionEngine; give each worker its own.
 */
public final class DustCoefficientCache {

    private static final Logger LOG = LoggerFactory.getLogger(DustCoefficientCache.class);

    private DustCoefficients cached;
    private int computeCount = 0;

    /** Returns coefficients for grid, recomputing only if the cached grid differs. */
    public DustCoefficients coefficientsFor(WavelengthGrid grid) {
        if (grid == null) {
            throw new NullPointerException("grid");
        }
        if (cached == null || !cached.grid().matches(grid)) {
            cached = DustLaw.ccmCoefficients(grid);
            computeCount++;
            LOG.debug("Computed dust coefficients for {} (recompute #{})", grid, computeCount);
        }
        return cached;
    }

    /** Cached coefficients, or null if nothing has been computed yet. */
    public DustCoefficients current() {
        return cached;
    }

    /** Number of coefficient computations performed since construction. */
    public int computeCount() {
        return computeCount;
    }

    public void invalidate() {
        cached = null;
    }
}
