package io.dynamis.synphot.physics;

import io.dynamis.synphot.api.ConfigurationException;
import io.dynamis.synphot.api.PhotometricParameters;
import io.dynamis.synphot.api.ShapeMismatchException;
import io.dynamis.synphot.core.BandpassCatalog;
import java.util.List;

/**
 * Photometric uncertainties for a magnitude matrix.
 *
 * BAND RESOLUTION (per catalog label):
 *   1. Caller's depth table has the band: m5 from the table, gamma derived
 *      from the bandpass and instrument parameters (SignalToNoise.gamma).
 *   2. Otherwise the LSST defaults, if they have the band: m5 and gamma both
 *      taken from the defaults.
 *   3. Otherwise ConfigurationException naming the band.
 *
 * The resolved m5/gamma arrays are held in an UncertaintyCache and reused
 * until the catalog, depth table or parameter object changes.
 */
public final class UncertaintyModel {

    private final UncertaintyCache cache;
    private final DepthTable defaults;

    public UncertaintyModel() {
        this(new UncertaintyCache());
    }

    public UncertaintyModel(UncertaintyCache cache) {
        this(cache, DepthTable.lsstDefaults());
    }

    /**
     * @param defaults fallback table; every band it carries must also carry gamma
     */
    public UncertaintyModel(UncertaintyCache cache, DepthTable defaults) {
        if (cache == null) {
            throw new NullPointerException("cache");
        }
        if (defaults == null) {
            throw new NullPointerException("defaults");
        }
        this.cache = cache;
        this.defaults = defaults;
    }

    public UncertaintyCache cache() {
        return cache;
    }

    /** estimate() against the defaults only, with default instrument parameters. */
    public double[][] estimate(double[][] magnitudes, BandpassCatalog catalog) {
        return estimate(magnitudes, catalog, null, PhotometricParameters.defaults());
    }

    /**
     * @param magnitudes matrix[band][object] in catalog band order
     * @param depthTable per-observation m5 values, or null
     * @param params     instrument parameters used to derive gamma and sigmaSys
     * @return uncertainties with the same shape; NaN where the magnitude is NaN
     * @throws ShapeMismatchException if the row count differs from the band count
     * @throws ConfigurationException if a band has neither a caller m5 nor a default
     */
    public double[][] estimate(double[][] magnitudes,
                               BandpassCatalog catalog,
                               DepthTable depthTable,
                               PhotometricParameters params) {
        if (magnitudes == null) {
            throw new NullPointerException("magnitudes");
        }
        if (catalog == null) {
            throw new NullPointerException("catalog");
        }
        if (params == null) {
            throw new NullPointerException("params");
        }
        ShapeMismatchException.requireLength("magnitude rows", catalog.size(), magnitudes.length);

        if (!cache.isValidFor(catalog.id(), depthTable, params)) {
            resolve(catalog, depthTable, params);
        }
        double[] m5 = cache.m5();
        double[] gamma = cache.gamma();
        double sigmaSys = params.sigmaSys();

        double[][] out = new double[magnitudes.length][];
        for (int band = 0; band < magnitudes.length; band++) {
            double[] row = magnitudes[band];
            if (row == null) {
                throw new NullPointerException("magnitudes[" + band + "]");
            }
            double[] err = new double[row.length];
            for (int obj = 0; obj < row.length; obj++) {
                err[obj] = SignalToNoise.magError(row[obj], m5[band], gamma[band], sigmaSys);
            }
            out[band] = err;
        }
        return out;
    }

    private void resolve(BandpassCatalog catalog, DepthTable depthTable, PhotometricParameters params) {
        List<String> labels = catalog.labels();
        double[] m5 = new double[labels.size()];
        double[] gamma = new double[labels.size()];
        for (int i = 0; i < labels.size(); i++) {
            String band = labels.get(i);
            if (depthTable != null && depthTable.contains(band)) {
                m5[i] = depthTable.m5(band);
                gamma[i] = SignalToNoise.gamma(catalog.bandpass(i), m5[i], params);
            } else if (defaults.contains(band) && defaults.hasGamma(band)) {
                m5[i] = defaults.m5(band);
                gamma[i] = defaults.gamma(band);
            } else {
                throw new ConfigurationException(band,
                    "no way to determine m5 and gamma for band '" + band + "'");
            }
        }
        cache.store(catalog.id(), depthTable, params, m5, gamma);
    }
}
