package io.dynamis.synphot.api;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Immutable, strictly increasing wavelength grid in nanometres.
 *
 * Every constructed grid receives a unique identity token from a global
 * generation counter. Wavelength-dependent caches (phi arrays, dust
 * coefficients) key on the token first and fall back to a content comparison,
 * so two grids loaded separately from identical files still share cached work
 * while a same-length grid with different values never does.
 */
public final class WavelengthGrid {

    private static final AtomicLong NEXT_ID = new AtomicLong(1L);

    private static final WavelengthGrid DEFAULT = uniform(
        PhotometryConstants.MIN_WAVELENGTH_NM,
        PhotometryConstants.MAX_WAVELENGTH_NM,
        PhotometryConstants.WAVELENGTH_STEP_NM);

    private final long id;
    private final double[] wavelength;
    private final int contentHash;

    /**
     * @param wavelength strictly increasing values, at least two; defensively copied
     */
    public WavelengthGrid(double[] wavelength) {
        if (wavelength == null) {
            throw new NullPointerException("wavelength");
        }
        if (wavelength.length < 2) {
            throw new IllegalArgumentException(
                "wavelength grid needs at least 2 points; got " + wavelength.length);
        }
        for (int i = 1; i < wavelength.length; i++) {
            if (!(wavelength[i] > wavelength[i - 1])) {
                throw new IllegalArgumentException(
                    "wavelength grid must be strictly increasing; index " + i
                        + " has " + wavelength[i] + " after " + wavelength[i - 1]);
            }
        }
        this.wavelength = wavelength.clone();
        this.contentHash = Arrays.hashCode(this.wavelength);
        this.id = NEXT_ID.getAndIncrement();
    }

    /**
     * Evenly spaced grid from min to max inclusive.
     * The point count is rounded so that max is hit to within half a step.
     */
    public static WavelengthGrid uniform(double min, double max, double step) {
        if (step <= 0.0) {
            throw new IllegalArgumentException("step must be positive");
        }
        if (!(max > min)) {
            throw new IllegalArgumentException("max must be greater than min");
        }
        int intervals = (int) Math.round((max - min) / step);
        double[] values = new double[intervals + 1];
        for (int i = 0; i <= intervals; i++) {
            values[i] = min + i * step;
        }
        return new WavelengthGrid(values);
    }

    /** The 300-1150 nm, 0.1 nm grid every throughput curve is read onto by default. */
    public static WavelengthGrid defaultGrid() {
        return DEFAULT;
    }

    /** Opaque identity token, unique per constructed instance. */
    public long id() {
        return id;
    }

    public int size() {
        return wavelength.length;
    }

    public double at(int index) {
        return wavelength[index];
    }

    public double min() {
        return wavelength[0];
    }

    public double max() {
        return wavelength[wavelength.length - 1];
    }

    /**
     * Spacing between the first two points.
     * Integration assumes the grid is uniform; this is the step it uses.
     */
    public double step() {
        return wavelength[1] - wavelength[0];
    }

    /** Defensive copy of the wavelength values. */
    public double[] values() {
        return wavelength.clone();
    }

    /** Index of the point closest to the given wavelength. */
    public int nearestIndex(double lambda) {
        int idx = Arrays.binarySearch(wavelength, lambda);
        if (idx >= 0) {
            return idx;
        }
        int insertion = -idx - 1;
        if (insertion == 0) {
            return 0;
        }
        if (insertion >= wavelength.length) {
            return wavelength.length - 1;
        }
        double below = lambda - wavelength[insertion - 1];
        double above = wavelength[insertion] - lambda;
        return below <= above ? insertion - 1 : insertion;
    }

    /** True if the two grids share no wavelength range at all. */
    public boolean disjointFrom(WavelengthGrid other) {
        return other.min() > max() || other.max() < min();
    }

    /**
     * Returns a new grid with every wavelength multiplied by factor.
     * The result has a new identity token.
     */
    public WavelengthGrid scaled(double factor) {
        if (!(factor > 0.0)) {
            throw new IllegalArgumentException("scale factor must be positive; got " + factor);
        }
        double[] values = new double[wavelength.length];
        for (int i = 0; i < values.length; i++) {
            values[i] = wavelength[i] * factor;
        }
        return new WavelengthGrid(values);
    }

    /**
     * Identity token match, or identical content.
     * This is the reuse test for every wavelength-keyed cache.
     */
    public boolean matches(WavelengthGrid other) {
        if (other == null) {
            return false;
        }
        if (other == this || other.id == id) {
            return true;
        }
        return other.contentHash == contentHash
            && Arrays.equals(other.wavelength, wavelength);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof WavelengthGrid && matches((WavelengthGrid) obj);
    }

    @Override
    public int hashCode() {
        return contentHash;
    }

    @Override
    public String toString() {
        return "WavelengthGrid{id=" + id
            + ", points=" + wavelength.length
            + ", range=[" + min() + ", " + max() + "] nm}";
    }
}
