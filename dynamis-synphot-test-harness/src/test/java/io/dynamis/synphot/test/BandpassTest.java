package io.dynamis.synphot.test;

import io.dynamis.synphot.api.Bandpass;
import io.dynamis.synphot.api.PhotometryConstants;
import io.dynamis.synphot.api.ShapeMismatchException;
import io.dynamis.synphot.api.WavelengthGrid;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class BandpassTest {

    private static final WavelengthGrid GRID = WavelengthGrid.uniform(300.0, 1100.0, 1.0);

    @Test
    void throughputIsClampedToUnitInterval() {
        WavelengthGrid grid = new WavelengthGrid(new double[] {400.0, 500.0, 600.0});
        Bandpass bp = new Bandpass(grid, new double[] {-0.2, 0.5, 1.7});
        assertThat(bp.throughput()).containsExactly(0.0, 0.5, 1.0);
    }

    @Test
    void nanThroughputIsRejected() {
        WavelengthGrid grid = new WavelengthGrid(new double[] {400.0, 500.0});
        assertThatThrownBy(() -> new Bandpass(grid, new double[] {0.5, Double.NaN}))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void phiIntegratesToOne() {
        Bandpass bp = Bandpass.topHat(GRID, 500.0, 700.0);
        double sum = 0.0;
        for (double p : bp.phi()) {
            sum += p;
        }
        assertThat(sum * GRID.step()).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void phiOfZeroThroughputIsAllZero() {
        Bandpass bp = new Bandpass(GRID, new double[GRID.size()]);
        assertThat(bp.phi()).containsOnly(0.0);
        assertThat(bp.effectiveWavelength()).isNaN();
    }

    @Test
    void multiplyRequiresMatchingGrids() {
        Bandpass a = Bandpass.unity(GRID);
        Bandpass b = Bandpass.unity(WavelengthGrid.uniform(300.0, 1100.0, 2.0));
        assertThatThrownBy(() -> a.multiply(b)).isInstanceOf(ShapeMismatchException.class);
    }

    @Test
    void multiplyIsPointwise() {
        WavelengthGrid grid = new WavelengthGrid(new double[] {400.0, 500.0, 600.0});
        Bandpass a = new Bandpass(grid, new double[] {0.5, 1.0, 0.2});
        Bandpass b = new Bandpass(grid, new double[] {0.5, 0.3, 1.0});
        assertThat(a.multiply(b).throughput())
            .containsExactly(new double[] {0.25, 0.3, 0.2}, within(1e-12));
    }

    @Test
    void referenceBandpassIsDeltaAtReferenceWavelength() {
        Bandpass ref = Bandpass.referenceBandpass();
        WavelengthGrid grid = ref.grid();
        int peak = grid.nearestIndex(PhotometryConstants.REFERENCE_WAVELENGTH_NM);
        double total = 0.0;
        for (double t : ref.throughput()) {
            total += t;
        }
        assertThat(ref.throughputAt(peak)).isEqualTo(1.0);
        assertThat(total).isEqualTo(1.0);
        assertThat(ref.effectiveWavelength()).isCloseTo(500.0, within(1e-6));
    }

    @Test
    void effectiveWavelengthLiesInsideTopHat() {
        Bandpass bp = Bandpass.topHat(GRID, 600.0, 700.0);
        assertThat(bp.effectiveWavelength()).isBetween(600.0, 650.0);
    }
}
