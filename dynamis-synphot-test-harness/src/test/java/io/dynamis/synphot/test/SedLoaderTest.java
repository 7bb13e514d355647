package io.dynamis.synphot.test;

import io.dynamis.synphot.api.Bandpass;
import io.dynamis.synphot.api.Sed;
import io.dynamis.synphot.api.ShapeMismatchException;
import io.dynamis.synphot.core.SedLoader;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SedLoaderTest {

    @TempDir
    Path dir;

    private SedLoader loader;

    @BeforeEach
    void setUp() throws IOException {
        SynphotFixtures.writeFlatSed(dir, "flat.dat");
        SynphotFixtures.writePowerLawSed(dir, "red.dat", -1.0);
        SynphotFixtures.writeTable(dir, "coarse.dat", 260.0, 1190.0, 2.0, lambda -> 1.0e-8);
        loader = SedLoader.fromDirectory(dir);
    }

    // -- Normalization -------------------------------------------------------

    @Test
    void eachObjectIsNormalizedToItsMagNorm() throws IOException {
        List<Sed> seds = loader.load(List.of("flat.dat", "red.dat"), new double[] {18.0, 21.5}, false);
        assertThat(seds.get(0).magnitude(Bandpass.referenceBandpass())).isCloseTo(18.0, within(1e-9));
        assertThat(seds.get(1).magnitude(Bandpass.referenceBandpass())).isCloseTo(21.5, within(1e-9));
    }

    @Test
    void nanMagNormLeavesFileScale() throws IOException {
        List<Sed> seds = loader.load(List.of("red.dat"), new double[] {Double.NaN}, false);
        Sed raw = SedLoader.readSed(dir.resolve("red.dat"));
        assertThat(seds.get(0).flambda()).containsExactly(raw.flambda());
    }

    // -- Deduplication -------------------------------------------------------

    @Test
    void repeatedNamesYieldIndependentInstancesScaledByMagnitudeDifference() throws IOException {
        List<Sed> seds = loader.load(
            List.of("flat.dat", "flat.dat", "flat.dat"), new double[] {20.0, 21.0, 20.0}, false);
        assertThat(loader.lastUniqueLoadCount()).isEqualTo(1);
        assertThat(seds.get(0)).isNotSameAs(seds.get(2));

        double ratio = seds.get(1).flambda()[300] / seds.get(0).flambda()[300];
        assertThat(ratio).isCloseTo(Math.pow(10.0, -0.4), within(1e-12));

        seds.get(0).multiplyFluxNorm(5.0);
        assertThat(seds.get(2).flambda()[300] * 5.0)
            .isCloseTo(seds.get(0).flambda()[300], within(1e-20));
    }

    @Test
    void noneYieldsEmptySentinel() throws IOException {
        List<Sed> seds = loader.load(Arrays.asList("None", null, "flat.dat"),
            new double[] {20.0, 20.0, 20.0}, false);
        assertThat(seds.get(0).isEmpty()).isTrue();
        assertThat(seds.get(1).isEmpty()).isTrue();
        assertThat(seds.get(2).isEmpty()).isFalse();
        assertThat(loader.lastUniqueLoadCount()).isEqualTo(1);
    }

    @Test
    void loadedTemplatesCarryTheirCatalogName() throws IOException {
        List<Sed> seds = loader.load(List.of("red.dat"), new double[] {20.0}, false);
        assertThat(seds.get(0).name()).isEqualTo("red.dat");
    }

    // -- Shared grid ---------------------------------------------------------

    @Test
    void templatesKeepOwnGridsUnlessSharedGridRequested() throws IOException {
        List<Sed> separate = loader.load(List.of("flat.dat", "coarse.dat"), new double[] {20.0, 20.0}, false);
        assertThat(separate.get(0).grid().matches(separate.get(1).grid())).isFalse();

        List<Sed> shared = loader.load(List.of("flat.dat", "coarse.dat"), new double[] {20.0, 20.0}, true);
        assertThat(shared.get(0).grid().matches(shared.get(1).grid())).isTrue();
        assertThat(shared.get(1).grid().size()).isEqualTo(951);
    }

    // -- Errors --------------------------------------------------------------

    @Test
    void lengthMismatchIsShapeMismatch() {
        assertThatThrownBy(() -> loader.load(List.of("flat.dat", "red.dat"), new double[] {20.0}, false))
            .isInstanceOf(ShapeMismatchException.class);
    }

    @Test
    void missingTemplateIsFileNotFound() {
        assertThatThrownBy(() -> loader.load(List.of("absent.dat"), new double[] {20.0}, false))
            .isInstanceOf(FileNotFoundException.class);
    }

    @Test
    void templateWithoutReferenceFluxIsShapeMismatch() throws IOException {
        SynphotFixtures.writeTable(dir, "ir.dat", 600.0, 1200.0, 1.0, lambda -> 1.0e-8);
        assertThatThrownBy(() -> loader.load(List.of("ir.dat"), new double[] {20.0}, false))
            .isInstanceOf(ShapeMismatchException.class)
            .hasMessageContaining("ir.dat")
            .hasMessageContaining("reference wavelength");
    }

    @Test
    void templateWithoutReferenceFluxLoadsWhenUnnormalized() throws IOException {
        SynphotFixtures.writeTable(dir, "ir.dat", 600.0, 1200.0, 1.0, lambda -> 1.0e-8);
        List<Sed> seds = loader.load(List.of("ir.dat"), new double[] {Double.NaN}, false);
        assertThat(seds.get(0).grid().min()).isEqualTo(600.0);
    }

    @Test
    void customResolverMapsNamesToFiles() throws IOException {
        SedLoader mapped = new SedLoader(name -> dir.resolve(name + ".dat"));
        List<Sed> seds = mapped.load(List.of("flat"), new double[] {19.0}, false);
        assertThat(seds.get(0).name()).isEqualTo("flat");
    }
}
