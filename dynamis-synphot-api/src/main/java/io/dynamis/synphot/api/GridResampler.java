package io.dynamis.synphot.api;

/**
 * Stateless linear interpolation of tabulated values onto a wavelength grid.
 *
 * Points of the target grid that fall outside the source range are set to
 * zero: a spectrum or throughput carries no signal where it was not measured.
 */
public final class GridResampler {

    private GridResampler() {}

    /**
     * Interpolates values tabulated on source onto target.
     *
     * @param source grid the values are tabulated on
     * @param values values on source; length must equal source.size()
     * @param target grid to interpolate onto
     * @return new array of target.size() values
     * @throws ShapeMismatchException if the grids do not overlap
     */
    public static double[] resample(WavelengthGrid source, double[] values, WavelengthGrid target) {
        if (source == null) {
            throw new NullPointerException("source");
        }
        if (values == null) {
            throw new NullPointerException("values");
        }
        if (target == null) {
            throw new NullPointerException("target");
        }
        if (values.length != source.size()) {
            throw new ShapeMismatchException(
                "values length " + values.length + " does not match grid size " + source.size());
        }
        if (source.disjointFrom(target)) {
            throw new ShapeMismatchException(
                "no overlap between " + source + " and " + target);
        }
        if (source.matches(target)) {
            return values.clone();
        }

        double[] out = new double[target.size()];
        int last = source.size() - 1;
        int j = 0;
        for (int i = 0; i < out.length; i++) {
            double lambda = target.at(i);
            if (lambda < source.min() || lambda > source.max()) {
                out[i] = 0.0;
                continue;
            }
            while (j < last - 1 && source.at(j + 1) < lambda) {
                j++;
            }
            double x0 = source.at(j);
            double x1 = source.at(j + 1);
            double frac = (lambda - x0) / (x1 - x0);
            frac = Math.max(0.0, Math.min(1.0, frac));
            out[i] = values[j] + frac * (values[j + 1] - values[j]);
        }
        return out;
    }

    /** True if target extends beyond source on either side. */
    public static boolean partiallyCovers(WavelengthGrid source, WavelengthGrid target) {
        return target.min() < source.min() || target.max() > source.max();
    }
}
