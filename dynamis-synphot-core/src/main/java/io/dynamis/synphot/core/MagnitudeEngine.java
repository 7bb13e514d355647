package io.dynamis.synphot.core;

import io.dynamis.synphot.api.Sed;
import java.util.Arrays;
import java.util.List;

/**
 * Integrates SEDs against a BandpassCatalog.
 *
 * For band k:  mag_k = -2.5 * log10( sum(phi_k * fnu) * dlambda ) - zp
 *
 * where phi_k comes from the catalog's cached phi matrix, dlambda is the step
 * of the catalog grid and zp is the AB zero point in Jansky units.
 *
 * An SED on a different grid is resampled onto the catalog grid through a
 * private copy; the caller's instance is never modified. The empty sentinel
 * produces NaN in every band, as does a band with no positive flux.
 *
 * Stateless apart from the catalog's own phi cache.
 */
public final class MagnitudeEngine {

    /**
     * Magnitude matrix for a batch of SEDs.
     *
     * @return matrix[band][object]; band order is catalog.labels(), object
     *         order is the input order
     * @throws io.dynamis.synphot.api.ShapeMismatchException if an SED grid does
     *         not overlap the catalog grid
     */
    public double[][] computeMany(List<Sed> seds, BandpassCatalog catalog) {
        if (seds == null) {
            throw new NullPointerException("seds");
        }
        if (catalog == null) {
            throw new NullPointerException("catalog");
        }
        double[][] out = new double[catalog.size()][seds.size()];
        for (int obj = 0; obj < seds.size(); obj++) {
            double[] mags = magnitudes(seds.get(obj), catalog);
            for (int band = 0; band < mags.length; band++) {
                out[band][obj] = mags[band];
            }
        }
        return out;
    }

    /** Per-band magnitudes of one SED, in catalog band order. */
    public double[] magnitudes(Sed sed, BandpassCatalog catalog) {
        double[] flux = fluxes(sed, catalog);
        for (int band = 0; band < flux.length; band++) {
            flux[band] = Sed.magnitudeFromFlux(flux[band]);
        }
        return flux;
    }

    /**
     * Per-band phi-weighted flux densities in Jansky, in catalog band order.
     * NaN in every band for the empty sentinel.
     */
    public double[] fluxes(Sed sed, BandpassCatalog catalog) {
        if (sed == null) {
            throw new NullPointerException("sed");
        }
        if (catalog == null) {
            throw new NullPointerException("catalog");
        }
        double[] out = new double[catalog.size()];
        if (sed.isEmpty()) {
            Arrays.fill(out, Double.NaN);
            return out;
        }

        double[] fnu = alignedFnu(sed, catalog);
        double[][] phi = catalog.phiMatrix();
        double step = catalog.wavelengthStep();
        for (int band = 0; band < phi.length; band++) {
            double[] row = phi[band];
            double sum = 0.0;
            for (int i = 0; i < row.length; i++) {
                sum += row[i] * fnu[i];
            }
            out[band] = sum * step;
        }
        return out;
    }

    private static double[] alignedFnu(Sed sed, BandpassCatalog catalog) {
        if (sed.grid().matches(catalog.grid())) {
            return sed.fnu();
        }
        Sed aligned = sed.copy();
        aligned.resample(catalog.grid());
        return aligned.fnu();
    }
}
