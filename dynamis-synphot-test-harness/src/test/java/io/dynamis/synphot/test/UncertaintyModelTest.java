package io.dynamis.synphot.test;

import io.dynamis.synphot.api.ConfigurationException;
import io.dynamis.synphot.api.PhotometricParameters;
import io.dynamis.synphot.api.ShapeMismatchException;
import io.dynamis.synphot.core.BandpassCatalog;
import io.dynamis.synphot.physics.DepthTable;
import io.dynamis.synphot.physics.UncertaintyModel;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class UncertaintyModelTest {

    private static final double ERROR_AT_M5 =
        Math.sqrt(Math.pow(2.5 * Math.log10(1.2), 2) + 0.005 * 0.005);

    private final UncertaintyModel model = new UncertaintyModel();

    @Test
    void rowCountMustMatchBandCount() {
        BandpassCatalog catalog = SynphotFixtures.topHatCatalog("u", "g", "r", "i", "z");
        double[][] mags = new double[4][3];
        assertThatThrownBy(() -> model.estimate(mags, catalog))
            .isInstanceOf(ShapeMismatchException.class);
    }

    @Test
    void bandWithoutAnyDepthIsConfigurationError() {
        BandpassCatalog catalog = SynphotFixtures.topHatCatalog("g", "w");
        double[][] mags = {{20.0}, {20.0}};
        assertThatThrownBy(() -> model.estimate(mags, catalog))
            .isInstanceOfSatisfying(ConfigurationException.class,
                e -> assertThat(e.band()).isEqualTo("w"));
    }

    @Test
    void defaultsSupplyM5AndGamma() {
        BandpassCatalog catalog = SynphotFixtures.lsstTopHats();
        double[][] mags = {{23.68}, {24.89}, {24.43}, {24.00}, {24.45}, {22.60}};
        double[][] err = model.estimate(mags, catalog);
        for (double[] row : err) {
            assertThat(row[0]).isCloseTo(ERROR_AT_M5, within(1e-12));
        }
    }

    @Test
    void callerDepthOverridesDefaults() {
        BandpassCatalog catalog = SynphotFixtures.topHatCatalog("r");
        DepthTable observed = DepthTable.of(Map.of("r", 23.0));
        double[][] err = model.estimate(new double[][] {{23.0, 24.43}}, catalog, observed,
            PhotometricParameters.defaults());
        assertThat(err[0][0]).isCloseTo(ERROR_AT_M5, within(1e-12));
        assertThat(err[0][1]).isGreaterThan(err[0][0]);
    }

    @Test
    void callerDepthCoversBandsMissingFromDefaults() {
        BandpassCatalog catalog = SynphotFixtures.topHatCatalog("w");
        DepthTable observed = DepthTable.of(Map.of("w", 24.0));
        double[][] err = model.estimate(new double[][] {{24.0}}, catalog, observed,
            PhotometricParameters.defaults());
        assertThat(err[0][0]).isCloseTo(ERROR_AT_M5, within(1e-12));
    }

    @Test
    void nanMagnitudesGiveNaNErrors() {
        BandpassCatalog catalog = SynphotFixtures.topHatCatalog("g");
        double[][] err = model.estimate(new double[][] {{Double.NaN, 21.0}}, catalog);
        assertThat(err[0][0]).isNaN();
        assertThat(err[0][1]).isFinite();
    }

    @Test
    void errorsGrowWithMagnitude() {
        BandpassCatalog catalog = SynphotFixtures.topHatCatalog("i");
        double[][] err = model.estimate(new double[][] {{18.0, 22.0, 24.0, 26.0}}, catalog);
        for (int obj = 1; obj < 4; obj++) {
            assertThat(err[0][obj]).isGreaterThanOrEqualTo(err[0][obj - 1]);
        }
    }

    // -- Cache ---------------------------------------------------------------

    @Test
    void cacheRefreshesOnlyWhenKeyChanges() {
        BandpassCatalog catalog = SynphotFixtures.topHatCatalog("g", "r");
        PhotometricParameters params = PhotometricParameters.defaults();
        DepthTable table = DepthTable.of(Map.of("g", 24.5, "r", 24.1));
        double[][] mags = {{20.0}, {20.0}};

        model.estimate(mags, catalog, table, params);
        model.estimate(mags, catalog, table, params);
        assertThat(model.cache().refreshCount()).isEqualTo(1);

        model.estimate(mags, catalog, DepthTable.of(Map.of("g", 24.5, "r", 24.1)), params);
        assertThat(model.cache().refreshCount()).isEqualTo(2);

        BandpassCatalog sameShapeOtherCatalog = SynphotFixtures.topHatCatalog("g", "r");
        model.estimate(mags, sameShapeOtherCatalog, null, params);
        assertThat(model.cache().refreshCount()).isEqualTo(3);

        model.estimate(mags, sameShapeOtherCatalog, null, params.toBuilder().gain(1.0).build());
        assertThat(model.cache().refreshCount()).isEqualTo(4);
    }
}
