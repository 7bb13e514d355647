package io.dynamis.synphot.physics;

import io.dynamis.synphot.api.PhotometricParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-band m5 and gamma arrays for the most recently used
 * (catalog, depth table, instrument parameters) combination.
 *
 * The key is the catalog identity token plus the identity of the depth table
 * and parameter objects. Any change in one of the three refreshes the arrays.
 *
 * Not thread safe. Owned by one UncertaintyModel.
 */
public final class UncertaintyCache {

    private static final Logger LOG = LoggerFactory.getLogger(UncertaintyCache.class);

    private long catalogId = -1L;
    private DepthTable depthTable;
    private PhotometricParameters params;
    private double[] m5;
    private double[] gamma;
    private int refreshCount = 0;

    boolean isValidFor(long catalogId, DepthTable depthTable, PhotometricParameters params) {
        return m5 != null
            && this.catalogId == catalogId
            && this.depthTable == depthTable
            && this.params == params;
    }

    void store(long catalogId, DepthTable depthTable, PhotometricParameters params,
               double[] m5, double[] gamma) {
        this.catalogId = catalogId;
        this.depthTable = depthTable;
        this.params = params;
        this.m5 = m5;
        this.gamma = gamma;
        refreshCount++;
        LOG.debug("Refreshed m5/gamma for catalog {} (refresh #{})", catalogId, refreshCount);
    }

    double[] m5() {
        return m5;
    }

    double[] gamma() {
        return gamma;
    }

    /** Number of times the per-band arrays have been recomputed. */
    public int refreshCount() {
        return refreshCount;
    }

    public void invalidate() {
        m5 = null;
        gamma = null;
        depthTable = null;
        params = null;
        catalogId = -1L;
    }
}
