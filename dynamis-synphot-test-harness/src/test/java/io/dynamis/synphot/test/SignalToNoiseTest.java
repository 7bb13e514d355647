package io.dynamis.synphot.test;

import io.dynamis.synphot.api.Bandpass;
import io.dynamis.synphot.api.PhotometricParameters;
import io.dynamis.synphot.api.Sed;
import io.dynamis.synphot.api.WavelengthGrid;
import io.dynamis.synphot.physics.SignalToNoise;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SignalToNoiseTest {

    private static final Bandpass R = Bandpass.topHat(WavelengthGrid.defaultGrid(), 550.0, 690.0);

    // -- SNR / error formula -------------------------------------------------

    @Test
    void snrAtM5IsFiveForAnyGamma() {
        assertThat(SignalToNoise.snrFromM5(24.0, 24.0, 0.039)).isCloseTo(5.0, within(1e-9));
        assertThat(SignalToNoise.snrFromM5(24.0, 24.0, 0.0)).isCloseTo(5.0, within(1e-9));
    }

    @Test
    void errorAtM5MatchesClosedForm() {
        double expected = Math.sqrt(Math.pow(2.5 * Math.log10(1.2), 2) + 0.005 * 0.005);
        assertThat(SignalToNoise.magError(24.0, 24.0, 0.039, 0.005)).isCloseTo(expected, within(1e-12));
    }

    @Test
    void errorIsNonDecreasingInMagMinusM5() {
        double previous = 0.0;
        for (double mag = 14.0; mag <= 30.0; mag += 0.25) {
            double err = SignalToNoise.magError(mag, 24.43, 0.039, 0.005);
            assertThat(err).isGreaterThanOrEqualTo(previous);
            previous = err;
        }
    }

    @Test
    void brightSourcesApproachSystematicFloor() {
        assertThat(SignalToNoise.magError(10.0, 24.0, 0.039, 0.005)).isCloseTo(0.005, within(1e-4));
    }

    @Test
    void nanMagnitudeGivesNaNError() {
        assertThat(SignalToNoise.magError(Double.NaN, 24.0, 0.039, 0.005)).isNaN();
    }

    // -- gamma ---------------------------------------------------------------

    @Test
    void gammaForLsstLikeBandIsJustBelowSkyLimit() {
        double gamma = SignalToNoise.gamma(R, 24.43, PhotometricParameters.defaults());
        assertThat(gamma).isBetween(0.035, 0.04);
    }

    @Test
    void longerExposurePushesGammaTowardsSkyLimit() {
        PhotometricParameters base = PhotometricParameters.defaults();
        PhotometricParameters deep = base.toBuilder().exposureCount(20).build();
        assertThat(SignalToNoise.gamma(R, 24.43, deep))
            .isGreaterThan(SignalToNoise.gamma(R, 24.43, base));
    }

    @Test
    void gammaIsClampedAtZeroForFaintShortExposures() {
        PhotometricParameters tiny = PhotometricParameters.builder()
            .exposureTimeSeconds(1.0e-6)
            .exposureCount(1)
            .build();
        assertThat(SignalToNoise.gamma(R, 24.43, tiny)).isZero();
    }

    @Test
    void aduScalesWithFlux() {
        PhotometricParameters params = PhotometricParameters.defaults();
        Sed faint = SynphotFixtures.flatAt(22.0, R.grid());
        Sed bright = SynphotFixtures.flatAt(19.5, R.grid());
        double ratio = SignalToNoise.adu(bright, R, params) / SignalToNoise.adu(faint, R, params);
        assertThat(ratio).isCloseTo(10.0, within(1e-9));
    }

    @Test
    void aduOfEmptySedIsNaN() {
        assertThat(SignalToNoise.adu(Sed.empty(), R, PhotometricParameters.defaults())).isNaN();
    }
}
