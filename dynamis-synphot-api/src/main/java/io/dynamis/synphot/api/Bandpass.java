package io.dynamis.synphot.api;

/**
 * Immutable throughput curve of an instrument (and optionally the atmosphere)
 * tabulated on a wavelength grid.
 *
 * Throughput values are fractional and clamped to [0, 1] on construction.
 * All transforming operations return new instances.
 */
public final class Bandpass {

    private final WavelengthGrid grid;
    private final double[] throughput;

    /**
     * @param grid       wavelength grid; must not be null
     * @param throughput fractional throughput per grid point; defensively copied
     */
    public Bandpass(WavelengthGrid grid, double[] throughput) {
        if (grid == null) {
            throw new NullPointerException("grid");
        }
        if (throughput == null) {
            throw new NullPointerException("throughput");
        }
        ShapeMismatchException.requireLength("throughput", grid.size(), throughput.length);
        double[] copy = new double[throughput.length];
        for (int i = 0; i < copy.length; i++) {
            double value = throughput[i];
            if (Double.isNaN(value)) {
                throw new IllegalArgumentException("throughput is NaN at index " + i);
            }
            copy[i] = Math.max(0.0, Math.min(1.0, value));
        }
        this.grid = grid;
        this.throughput = copy;
    }

    /** Unit throughput everywhere on the grid; the identity for composition. */
    public static Bandpass unity(WavelengthGrid grid) {
        double[] ones = new double[grid.size()];
        java.util.Arrays.fill(ones, 1.0);
        return new Bandpass(grid, ones);
    }

    /** Unit throughput between lo and hi inclusive, zero elsewhere. */
    public static Bandpass topHat(WavelengthGrid grid, double lo, double hi) {
        if (!(hi > lo)) {
            throw new IllegalArgumentException("hi must be greater than lo");
        }
        double[] sb = new double[grid.size()];
        for (int i = 0; i < sb.length; i++) {
            double lambda = grid.at(i);
            sb[i] = (lambda >= lo && lambda <= hi) ? 1.0 : 0.0;
        }
        return new Bandpass(grid, sb);
    }

    /**
     * Delta-function bandpass at REFERENCE_WAVELENGTH_NM on the default grid.
     *
     * The magnitude of any spectrum through this bandpass is the AB magnitude
     * of its flux density at the reference wavelength. magNorm values are
     * defined against it; for a spectrum flat in fnu it equals the magnitude
     * in every band.
     */
    public static Bandpass referenceBandpass() {
        return ReferenceHolder.REFERENCE;
    }

    public WavelengthGrid grid() {
        return grid;
    }

    public int size() {
        return throughput.length;
    }

    public double throughputAt(int index) {
        return throughput[index];
    }

    /** Defensive copy of the throughput values. */
    public double[] throughput() {
        return throughput.clone();
    }

    /**
     * Interpolates this curve onto another grid. Zero outside the tabulated range.
     *
     * @throws ShapeMismatchException if the grids do not overlap
     */
    public Bandpass resample(WavelengthGrid target) {
        if (grid.matches(target)) {
            return grid == target ? this : new Bandpass(target, throughput);
        }
        return new Bandpass(target, GridResampler.resample(grid, throughput, target));
    }

    /**
     * Pointwise product with another curve on the same grid.
     *
     * @throws ShapeMismatchException if the grids differ; resample first
     */
    public Bandpass multiply(Bandpass other) {
        if (other == null) {
            throw new NullPointerException("other");
        }
        if (!grid.matches(other.grid)) {
            throw new ShapeMismatchException(
                "cannot multiply bandpasses on different grids: " + grid + " vs " + other.grid);
        }
        double[] product = new double[throughput.length];
        for (int i = 0; i < product.length; i++) {
            product[i] = throughput[i] * other.throughput[i];
        }
        return new Bandpass(grid, product);
    }

    /**
     * Normalized response function used for magnitude integration:
     * phi = throughput / lambda, scaled so that sum(phi) * step == 1.
     *
     * A flat fnu spectrum integrated against phi returns its own flux density,
     * which is what anchors the AB zero point. A curve with zero total
     * throughput yields an all-zero phi.
     *
     * @return new array of grid.size() values
     */
    public double[] phi() {
        double[] phi = new double[throughput.length];
        double sum = 0.0;
        for (int i = 0; i < phi.length; i++) {
            phi[i] = throughput[i] / grid.at(i);
            sum += phi[i];
        }
        double norm = sum * grid.step();
        if (norm <= 0.0) {
            return phi;
        }
        for (int i = 0; i < phi.length; i++) {
            phi[i] /= norm;
        }
        return phi;
    }

    /** phi-weighted mean wavelength in nm; NaN for a zero-throughput curve. */
    public double effectiveWavelength() {
        double[] phi = phi();
        double weighted = 0.0;
        double total = 0.0;
        for (int i = 0; i < phi.length; i++) {
            weighted += phi[i] * grid.at(i);
            total += phi[i];
        }
        return total > 0.0 ? weighted / total : Double.NaN;
    }

    @Override
    public String toString() {
        return "Bandpass{grid=" + grid + ", lambdaEff=" + effectiveWavelength() + "}";
    }

    private static final class ReferenceHolder {
        static final Bandpass REFERENCE = buildReference();

        private static Bandpass buildReference() {
            WavelengthGrid grid = WavelengthGrid.defaultGrid();
            double[] sb = new double[grid.size()];
            sb[grid.nearestIndex(PhotometryConstants.REFERENCE_WAVELENGTH_NM)] = 1.0;
            return new Bandpass(grid, sb);
        }
    }
}
