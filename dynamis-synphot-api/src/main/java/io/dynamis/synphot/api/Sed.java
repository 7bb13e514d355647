package io.dynamis.synphot.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Spectral energy distribution: flux density per unit wavelength (flambda,
 * erg/cm^2/s/nm) tabulated on a wavelength grid.
 *
 * MUTABILITY:
 *   Normalization, extinction, redshift and resampling mutate the instance in
 *   place. Every mutation drops the cached fnu array. Mutations that move the
 *   wavelengths install a new WavelengthGrid, i.e. a new identity token, so
 *   grid-keyed caches downstream see the change.
 *
 * OWNERSHIP:
 *   One instance belongs to exactly one logical object. Use copy() to derive
 *   an independent instance; nothing in this stack aliases SED state.
 *
 * EMPTY SENTINEL:
 *   Sed.empty() stands for "no SED". It has no grid, and every operation on it
 *   is a no-op that leaves it empty.
 */
public final class Sed {

    private static final Logger LOG = LoggerFactory.getLogger(Sed.class);

    private String name;
    private WavelengthGrid grid;
    private double[] flambda;
    private double[] fnu;

    /**
     * @param name    display name, usually the source file name
     * @param grid    wavelength grid; must not be null
     * @param flambda flux density per grid point; defensively copied
     */
    public Sed(String name, WavelengthGrid grid, double[] flambda) {
        if (grid == null) {
            throw new NullPointerException("grid");
        }
        if (flambda == null) {
            throw new NullPointerException("flambda");
        }
        ShapeMismatchException.requireLength("flambda", grid.size(), flambda.length);
        this.name = name == null ? "" : name;
        this.grid = grid;
        this.flambda = flambda.clone();
    }

    private Sed() {
        this.name = PhotometryConstants.NO_SED;
    }

    /** The "no SED" sentinel. Each call returns a fresh instance. */
    public static Sed empty() {
        return new Sed();
    }

    /** Flat-in-frequency spectrum at AB magnitude zero (3631 Jy) on the given grid. */
    public static Sed flat(WavelengthGrid grid) {
        double[] fl = new double[grid.size()];
        for (int i = 0; i < fl.length; i++) {
            fl[i] = fnuToFlambda(PhotometryConstants.AB_FLAT_FNU_JANSKY, grid.at(i));
        }
        return new Sed("flat", grid, fl);
    }

    /** Flat-in-frequency spectrum on the default grid. */
    public static Sed flat() {
        return flat(WavelengthGrid.defaultGrid());
    }

    // -- Accessors -----------------------------------------------------------------

    public boolean isEmpty() {
        return grid == null;
    }

    public String name() {
        return name;
    }

    public void rename(String newName) {
        this.name = newName == null ? "" : newName;
    }

    /** Current grid; null for the empty sentinel. */
    public WavelengthGrid grid() {
        return grid;
    }

    /** Defensive copy of flambda; empty array for the sentinel. */
    public double[] flambda() {
        return isEmpty() ? new double[0] : flambda.clone();
    }

    /**
     * Flux density per unit frequency in Jansky, computed on first call after
     * each mutation and cached until the next one.
     *
     * @return defensive copy; empty array for the sentinel
     */
    public double[] fnu() {
        if (isEmpty()) {
            return new double[0];
        }
        return fnuCache().clone();
    }

    /** True while a computed fnu array is held. Exposed for cache tests. */
    public boolean hasCachedFnu() {
        return fnu != null;
    }

    // -- Copying -------------------------------------------------------------------

    /**
     * Independent deep copy. The grid is immutable and is shared; the flux
     * arrays are not.
     */
    public Sed copy() {
        if (isEmpty()) {
            Sed sentinel = new Sed();
            sentinel.name = name;
            return sentinel;
        }
        Sed sed = new Sed(name, grid, flambda);
        if (fnu != null) {
            sed.fnu = fnu.clone();
        }
        return sed;
    }

    // -- Mutations -----------------------------------------------------------------

    /** Scales flambda by factor. Invalidates fnu. */
    public void multiplyFluxNorm(double factor) {
        if (isEmpty()) {
            return;
        }
        if (!Double.isFinite(factor)) {
            throw new IllegalArgumentException("flux normalization must be finite; got " + factor);
        }
        for (int i = 0; i < flambda.length; i++) {
            flambda[i] *= factor;
        }
        fnu = null;
    }

    /**
     * Applies dust extinction from precomputed dust-law coefficients:
     * flambda *= 10^(-0.4 * av * (a + b / rv)). Invalidates fnu.
     *
     * @param a  per-grid-point a(lambda); length must equal the grid size
     * @param b  per-grid-point b(lambda); length must equal the grid size
     * @param av V-band extinction in magnitudes
     * @param rv ratio of total to selective extinction
     */
    public void applyExtinction(double[] a, double[] b, double av, double rv) {
        if (isEmpty()) {
            return;
        }
        if (a == null) {
            throw new NullPointerException("a");
        }
        if (b == null) {
            throw new NullPointerException("b");
        }
        ShapeMismatchException.requireLength("dust coefficient a", grid.size(), a.length);
        ShapeMismatchException.requireLength("dust coefficient b", grid.size(), b.length);
        if (rv <= 0.0) {
            throw new IllegalArgumentException("rv must be positive; got " + rv);
        }
        if (av == 0.0) {
            return;
        }
        for (int i = 0; i < flambda.length; i++) {
            double aLambda = av * (a[i] + b[i] / rv);
            flambda[i] *= Math.pow(10.0, -0.4 * aLambda);
        }
        fnu = null;
    }

    /** Extinction specified as colour excess: Av = rv * ebv. */
    public void applyExtinctionFromEbv(double[] a, double[] b, double ebv, double rv) {
        applyExtinction(a, b, rv * ebv, rv);
    }

    /**
     * Shifts the spectrum to redshift z: wavelengths stretch by (1 + z) and,
     * with dimming, flambda drops by the extra 1/(1 + z). Installs a new grid
     * and invalidates fnu.
     */
    public void redshift(double z, boolean dimming) {
        if (isEmpty()) {
            return;
        }
        if (!(z > -1.0)) {
            throw new IllegalArgumentException("redshift must be > -1; got " + z);
        }
        if (z == 0.0) {
            return;
        }
        double stretch = 1.0 + z;
        grid = grid.scaled(stretch);
        if (dimming) {
            for (int i = 0; i < flambda.length; i++) {
                flambda[i] /= stretch;
            }
        }
        fnu = null;
    }

    /**
     * Interpolates flambda onto target and installs it as the grid. Points
     * outside the current range are zero; a partial overlap is logged.
     *
     * @throws ShapeMismatchException if the grids do not overlap at all
     */
    public void resample(WavelengthGrid target) {
        if (isEmpty()) {
            return;
        }
        if (target == null) {
            throw new NullPointerException("target");
        }
        if (grid.matches(target)) {
            grid = target;
            return;
        }
        if (GridResampler.partiallyCovers(grid, target)) {
            LOG.warn("SED '{}' covers [{}, {}] nm but is resampled onto [{}, {}] nm; "
                    + "uncovered points are set to zero",
                name, grid.min(), grid.max(), target.min(), target.max());
        }
        flambda = GridResampler.resample(grid, flambda, target);
        grid = target;
        fnu = null;
    }

    // -- Magnitudes ----------------------------------------------------------------

    /**
     * AB magnitude through a single bandpass. The SED itself is not modified;
     * if its grid differs from the bandpass grid, a resampled copy is used.
     *
     * @return magnitude, or NaN for the sentinel or a non-positive integrated flux
     */
    public double magnitude(Bandpass bandpass) {
        if (bandpass == null) {
            throw new NullPointerException("bandpass");
        }
        if (isEmpty()) {
            return Double.NaN;
        }
        double[] fnuOnGrid;
        if (grid.matches(bandpass.grid())) {
            fnuOnGrid = fnuCache();
        } else {
            Sed onGrid = copy();
            onGrid.resample(bandpass.grid());
            fnuOnGrid = onGrid.fnuCache();
        }
        double[] phi = bandpass.phi();
        double flux = 0.0;
        for (int i = 0; i < phi.length; i++) {
            flux += phi[i] * fnuOnGrid[i];
        }
        return magnitudeFromFlux(flux * bandpass.grid().step());
    }

    /**
     * Factor that brings this SED to the given magnitude through bandpass:
     * 10^(-0.4 * (magMatch - currentMag)).
     *
     * @throws ShapeMismatchException if no flux reaches the bandpass
     */
    public double fluxNormFor(double magMatch, Bandpass bandpass) {
        double current = magnitude(bandpass);
        if (Double.isNaN(current)) {
            throw new ShapeMismatchException(
                "cannot normalize SED '" + name + "': no flux through the normalization bandpass");
        }
        return Math.pow(10.0, -0.4 * (magMatch - current));
    }

    /** -2.5 log10(flux) - zp, or NaN if flux is not positive. */
    public static double magnitudeFromFlux(double fluxJansky) {
        if (!(fluxJansky > 0.0)) {
            return Double.NaN;
        }
        return -2.5 * Math.log10(fluxJansky) - PhotometryConstants.AB_ZEROPOINT;
    }

    // -- Unit conversion -----------------------------------------------------------

    /** fnu [Jy] = flambda * lambda^2 / c * 1e23. */
    public static double flambdaToFnu(double flambda, double lambdaNm) {
        return flambda * lambdaNm * lambdaNm / PhotometryConstants.LIGHT_SPEED_NM_PER_S
            * PhotometryConstants.JANSKY_PER_CGS;
    }

    /** Inverse of flambdaToFnu. */
    public static double fnuToFlambda(double fnuJansky, double lambdaNm) {
        return fnuJansky / PhotometryConstants.JANSKY_PER_CGS
            * PhotometryConstants.LIGHT_SPEED_NM_PER_S / (lambdaNm * lambdaNm);
    }

    private double[] fnuCache() {
        if (fnu == null) {
            double[] values = new double[flambda.length];
            for (int i = 0; i < values.length; i++) {
                values[i] = flambdaToFnu(flambda[i], grid.at(i));
            }
            fnu = values;
        }
        return fnu;
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "Sed{" + name + ", empty}";
        }
        return "Sed{" + name + ", grid=" + grid + ", fnuCached=" + (fnu != null) + "}";
    }
}
