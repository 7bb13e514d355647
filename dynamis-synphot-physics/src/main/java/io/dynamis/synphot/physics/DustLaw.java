package io.dynamis.synphot.physics;

import io.dynamis.synphot.api.WavelengthGrid;

/**
 * Wavelength-dependent coefficients of the Cardelli, Clayton &amp; Mathis (1989)
 * extinction law with the O'Donnell (1994) optical/NIR polynomial.
 *
 * A(lambda) / Av = a(x) + b(x) / Rv,  x = 1 / lambda in inverse microns.
 *
 * Regimes (x in um^-1):
 *   infrared   0.3 &lt;= x &lt; 1.1
 *   optical    1.1 &lt;= x &lt; 3.3   (O'Donnell polynomial in y = x - 1.82)
 *   UV         3.3 &lt;= x &lt; 8.0   (with far-UV curvature terms above x = 5.9)
 *   far UV     8.0 &lt;= x &lt;= 11.0
 * Outside 0.3 &lt;= x &lt;= 11 both coefficients are zero: no extinction is applied.
 *
 * Coefficients depend only on the wavelength grid, never on Av, which is why
 * ExtinctionEngine caches them per grid.
 */
public final class DustLaw {

    private static final double[] OPTICAL_A = {
        1.0, 0.104, -0.609, 0.701, 1.137, -1.718, -0.827, 1.647, -0.505
    };
    private static final double[] OPTICAL_B = {
        0.0, 1.952, 2.908, -3.989, -7.985, 11.102, 5.491, -10.805, 3.347
    };

    private DustLaw() {}

    /** Computes a(lambda) and b(lambda) for every point of grid. */
    public static DustCoefficients ccmCoefficients(WavelengthGrid grid) {
        if (grid == null) {
            throw new NullPointerException("grid");
        }
        double[] a = new double[grid.size()];
        double[] b = new double[grid.size()];
        for (int i = 0; i < a.length; i++) {
            // nm -> inverse microns
            double x = 1000.0 / grid.at(i);
            a[i] = a(x);
            b[i] = b(x);
        }
        return new DustCoefficients(grid, a, b);
    }

    static double a(double x) {
        if (x < 0.3 || x > 11.0) {
            return 0.0;
        }
        if (x < 1.1) {
            return 0.574 * Math.pow(x, 1.61);
        }
        if (x < 3.3) {
            return polynomial(OPTICAL_A, x - 1.82);
        }
        if (x < 8.0) {
            double fa = 0.0;
            if (x >= 5.9) {
                double d = x - 5.9;
                fa = -0.04473 * d * d - 0.009779 * d * d * d;
            }
            return 1.752 - 0.316 * x - 0.104 / ((x - 4.67) * (x - 4.67) + 0.341) + fa;
        }
        double y = x - 8.0;
        return -1.073 - 0.628 * y + 0.137 * y * y - 0.070 * y * y * y;
    }

    static double b(double x) {
        if (x < 0.3 || x > 11.0) {
            return 0.0;
        }
        if (x < 1.1) {
            return -0.527 * Math.pow(x, 1.61);
        }
        if (x < 3.3) {
            return polynomial(OPTICAL_B, x - 1.82);
        }
        if (x < 8.0) {
            double fb = 0.0;
            if (x >= 5.9) {
                double d = x - 5.9;
                fb = 0.2130 * d * d + 0.1207 * d * d * d;
            }
            return -3.090 + 1.825 * x + 1.206 / ((x - 4.62) * (x - 4.62) + 0.263) + fb;
        }
        double y = x - 8.0;
        return 13.670 + 4.257 * y - 0.420 * y * y + 0.374 * y * y * y;
    }

    /** Horner evaluation of sum(c[k] * y^k). */
    private static double polynomial(double[] c, double y) {
        double acc = 0.0;
        for (int k = c.length - 1; k >= 0; k--) {
            acc = acc * y + c[k];
        }
        return acc;
    }
}
