package io.dynamis.synphot.test;

import io.dynamis.synphot.api.Bandpass;
import io.dynamis.synphot.api.PhotometryConstants;
import io.dynamis.synphot.api.Sed;
import io.dynamis.synphot.api.WavelengthGrid;
import io.dynamis.synphot.core.BandpassCatalog;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.DoubleUnaryOperator;

/** Shared builders for catalogs, spectra and on-disk fixture files. */
final class SynphotFixtures {

    private SynphotFixtures() {}

    /** Top-hat edges roughly following the LSST filter set, in nm. */
    static double[] edges(String band) {
        return switch (band) {
            case "u" -> new double[] {320.0, 400.0};
            case "g" -> new double[] {400.0, 550.0};
            case "r" -> new double[] {550.0, 690.0};
            case "i" -> new double[] {690.0, 820.0};
            case "z" -> new double[] {820.0, 920.0};
            case "y" -> new double[] {920.0, 1050.0};
            default -> new double[] {500.0, 600.0};
        };
    }

    static BandpassCatalog topHatCatalog(String... labels) {
        WavelengthGrid grid = WavelengthGrid.defaultGrid();
        List<Bandpass> curves = new ArrayList<>();
        for (String label : labels) {
            double[] e = edges(label);
            curves.add(Bandpass.topHat(grid, e[0], e[1]));
        }
        return new BandpassCatalog(List.of(labels), curves);
    }

    static BandpassCatalog lsstTopHats() {
        return topHatCatalog("u", "g", "r", "i", "z", "y");
    }

    /** Spectrum flat in fnu at the given AB magnitude. */
    static Sed flatAt(double mag, WavelengthGrid grid) {
        Sed sed = Sed.flat(grid);
        sed.multiplyFluxNorm(Math.pow(10.0, -0.4 * mag));
        return sed;
    }

    /** Power-law spectrum flambda = lambda^slope on 1 nm steps. */
    static Sed powerLaw(double slope, double min, double max) {
        WavelengthGrid grid = WavelengthGrid.uniform(min, max, 1.0);
        double[] fl = new double[grid.size()];
        for (int i = 0; i < fl.length; i++) {
            fl[i] = Math.pow(grid.at(i), slope);
        }
        return new Sed("powerlaw", grid, fl);
    }

    /** Writes a two-column table sampled on [min, max] with the given step. */
    static Path writeTable(Path dir, String name, double min, double max, double step,
                           DoubleUnaryOperator column) throws IOException {
        StringBuilder sb = new StringBuilder("# lambda(nm) value\n");
        int n = (int) Math.round((max - min) / step);
        for (int i = 0; i <= n; i++) {
            double lambda = min + i * step;
            sb.append(String.format(Locale.ROOT, "%.4f %.10e%n", lambda, column.applyAsDouble(lambda)));
        }
        Path file = dir.resolve(name);
        Files.writeString(file, sb.toString(), StandardCharsets.UTF_8);
        return file;
    }

    /** Writes an SED flat in fnu at magnitude 0, sampled every 1 nm over 250-1200 nm. */
    static Path writeFlatSed(Path dir, String name) throws IOException {
        return writeTable(dir, name, 250.0, 1200.0, 1.0,
            lambda -> Sed.fnuToFlambda(PhotometryConstants.AB_FLAT_FNU_JANSKY, lambda));
    }

    /** Writes an SED with flambda proportional to lambda^slope over 250-1200 nm. */
    static Path writePowerLawSed(Path dir, String name, double slope) throws IOException {
        return writeTable(dir, name, 250.0, 1200.0, 1.0, lambda -> Math.pow(lambda, slope));
    }

    /** Writes a throughput file that is constant between lo and hi, zero elsewhere. */
    static Path writeTopHat(Path dir, String name, double lo, double hi, double level)
            throws IOException {
        return writeTable(dir, name, 300.0, 1150.0, 1.0,
            lambda -> (lambda >= lo && lambda <= hi) ? level : 0.0);
    }

    static Path writeConstant(Path dir, String name, double level) throws IOException {
        return writeTable(dir, name, 300.0, 1150.0, 5.0, lambda -> level);
    }

    static double integratedFlambda(Sed sed) {
        double sum = 0.0;
        for (double v : sed.flambda()) {
            sum += v;
        }
        return sum;
    }
}
