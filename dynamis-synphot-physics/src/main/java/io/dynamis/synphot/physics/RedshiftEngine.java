package io.dynamis.synphot.physics;

import io.dynamis.synphot.api.Sed;
import io.dynamis.synphot.api.ShapeMismatchException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Redshifts a batch of SEDs in place.
 *
 * Wavelengths stretch by (1 + z). With cosmological dimming enabled, flambda is
 * further divided by (1 + z). Each shifted SED is renamed "{name}_Z{z:.2f}" so a
 * transformed spectrum can be traced back to its template.
 */
public final class RedshiftEngine {

    /** applyInPlace with dimming enabled. */
    public void applyInPlace(List<Sed> seds, double[] redshifts) {
        applyInPlace(seds, redshifts, true);
    }

    /**
     * @param seds      SEDs to shift; empty sentinels are skipped
     * @param redshifts per-object redshift, or null for no-op
     * @param dimming   apply the extra 1/(1+z) flux dimming
     * @throws ShapeMismatchException if redshifts and seds differ in length
     */
    public void applyInPlace(List<Sed> seds, double[] redshifts, boolean dimming) {
        if (redshifts == null) {
            return;
        }
        if (seds == null) {
            throw new NullPointerException("seds");
        }
        ShapeMismatchException.requireLength("redshifts", seds.size(), redshifts.length);
        for (int i = 0; i < seds.size(); i++) {
            Sed sed = seds.get(i);
            if (sed == null || sed.isEmpty()) {
                continue;
            }
            sed.redshift(redshifts[i], dimming);
            sed.rename(sed.name() + "_Z" + redshiftTag(redshifts[i]));
        }
    }

    /** z to two decimals, rounding the exact binary value half-even. */
    private static String redshiftTag(double z) {
        return new BigDecimal(z).setScale(2, RoundingMode.HALF_EVEN).toPlainString();
    }
}
