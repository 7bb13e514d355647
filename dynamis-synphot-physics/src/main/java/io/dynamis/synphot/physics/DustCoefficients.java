package io.dynamis.synphot.physics;

import io.dynamis.synphot.api.ShapeMismatchException;
import io.dynamis.synphot.api.WavelengthGrid;

/**
 * Immutable dust-law coefficient pair (a, b) tabulated on one wavelength grid.
 */
public final class DustCoefficients {

    private final WavelengthGrid grid;
    private final double[] a;
    private final double[] b;

    public DustCoefficients(WavelengthGrid grid, double[] a, double[] b) {
        if (grid == null) {
            throw new NullPointerException("grid");
        }
        if (a == null) {
            throw new NullPointerException("a");
        }
        if (b == null) {
            throw new NullPointerException("b");
        }
        ShapeMismatchException.requireLength("a", grid.size(), a.length);
        ShapeMismatchException.requireLength("b", grid.size(), b.length);
        this.grid = grid;
        this.a = a.clone();
        this.b = b.clone();
    }

    /** Grid the coefficients were computed for. Doubles as the cache key. */
    public WavelengthGrid grid() {
        return grid;
    }

    public double[] a() {
        return a.clone();
    }

    public double[] b() {
        return b.clone();
    }

    /** A(lambda)/Av at one grid point for the given Rv. */
    public double extinctionRatio(int index, double rv) {
        return a[index] + b[index] / rv;
    }
}
