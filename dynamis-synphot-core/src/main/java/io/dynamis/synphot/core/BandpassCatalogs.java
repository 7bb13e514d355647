package io.dynamis.synphot.core;

import io.dynamis.synphot.api.Bandpass;
import io.dynamis.synphot.api.WavelengthGrid;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds bandpasses and catalogs from throughput files on disk.
 *
 * DIRECTORY CONVENTION:
 *   Hardware components shared by all filters are named literally
 *   (detector.dat, m1.dat, ..., lens3.dat); per-band filter curves are
 *   {root}{label}.dat (filter_u.dat); the atmosphere is atmos.dat.
 *   Pre-combined curves use the same pattern under a different root
 *   (total_u.dat).
 *
 * Every curve is resampled onto the reference grid before it is multiplied in,
 * so all results share that grid. The default reference grid is
 * WavelengthGrid.defaultGrid().
 */
public final class BandpassCatalogs {

    private static final Logger LOG = LoggerFactory.getLogger(BandpassCatalogs.class);

    /** LSST filter labels in canonical order. */
    public static final List<String> LSST_BANDS = List.of("u", "g", "r", "i", "z", "y");

    /** Hardware components shared by every LSST filter. */
    public static final List<String> LSST_COMPONENTS = List.of(
        "detector.dat", "m1.dat", "m2.dat", "m3.dat", "lens1.dat", "lens2.dat", "lens3.dat");

    public static final String FILTER_ROOT = "filter_";
    public static final String TOTAL_ROOT = "total_";
    public static final String ATMOSPHERE_FILE = "atmos.dat";

    private BandpassCatalogs() {}

    /** Total (hardware x atmosphere) and hardware-only catalogs with identical band order. */
    public record CatalogPair(BandpassCatalog total, BandpassCatalog hardware) {
        public CatalogPair {
            if (total == null) {
                throw new NullPointerException("total");
            }
            if (hardware == null) {
                throw new NullPointerException("hardware");
            }
        }
    }

    /** Reads one throughput file onto the given grid. */
    public static Bandpass readThroughput(Path file, WavelengthGrid grid) throws IOException {
        TwoColumnFileReader.Table table = TwoColumnFileReader.read(file);
        return new Bandpass(table.grid(), table.values()).resample(grid);
    }

    /** Reads one throughput file onto the default grid. */
    public static Bandpass readThroughput(Path file) throws IOException {
        return readThroughput(file, WavelengthGrid.defaultGrid());
    }

    /**
     * Product of several throughput curves, on the default grid.
     *
     * @param componentFiles  hardware curves; at least one
     * @param atmosphereFile  atmosphere curve, or null for a hardware-only result
     * @throws java.io.FileNotFoundException if any file is missing
     */
    public static Bandpass loadComposite(List<Path> componentFiles, Path atmosphereFile)
            throws IOException {
        return loadComposite(componentFiles, atmosphereFile, WavelengthGrid.defaultGrid());
    }

    /**
     * Product of several throughput curves, each resampled onto grid first.
     */
    public static Bandpass loadComposite(List<Path> componentFiles,
                                         Path atmosphereFile,
                                         WavelengthGrid grid) throws IOException {
        if (componentFiles == null) {
            throw new NullPointerException("componentFiles");
        }
        if (grid == null) {
            throw new NullPointerException("grid");
        }
        if (componentFiles.isEmpty()) {
            throw new IllegalArgumentException("componentFiles must not be empty");
        }
        Bandpass product = Bandpass.unity(grid);
        for (Path file : componentFiles) {
            product = product.multiply(readThroughput(file, grid));
        }
        if (atmosphereFile != null) {
            product = product.multiply(readThroughput(atmosphereFile, grid));
        }
        return product;
    }

    /**
     * Builds the total and hardware-only catalogs for an instrument.
     *
     * For each label, the hardware curve is the product of the shared
     * components and {root}{label}.dat; the total curve additionally folds in
     * the atmosphere. Without an atmosphere file both catalogs hold the
     * hardware curves.
     *
     * @param bandLabels     labels in the order the catalogs must use
     * @param directory      directory holding every file
     * @param root           filter file prefix, e.g. "filter_"
     * @param componentList  shared hardware component file names
     * @param atmosphereFile atmosphere file name, or null
     * @throws java.io.FileNotFoundException if any file is missing
     */
    public static CatalogPair buildCatalog(List<String> bandLabels,
                                           Path directory,
                                           String root,
                                           List<String> componentList,
                                           String atmosphereFile) throws IOException {
        requireArgs(bandLabels, directory, root);
        if (componentList == null) {
            throw new NullPointerException("componentList");
        }
        WavelengthGrid grid = WavelengthGrid.defaultGrid();

        // Shared components and the atmosphere are read once, not once per band.
        Bandpass hardwareCommon = Bandpass.unity(grid);
        for (String component : componentList) {
            hardwareCommon = hardwareCommon.multiply(
                readThroughput(directory.resolve(component), grid));
        }
        Bandpass atmosphere = atmosphereFile == null
            ? null
            : readThroughput(directory.resolve(atmosphereFile), grid);

        List<Bandpass> hardware = new ArrayList<>(bandLabels.size());
        List<Bandpass> total = new ArrayList<>(bandLabels.size());
        for (String label : bandLabels) {
            Bandpass filter = readThroughput(directory.resolve(bandFileName(root, label)), grid);
            Bandpass hw = hardwareCommon.multiply(filter);
            hardware.add(hw);
            total.add(atmosphere == null ? hw : hw.multiply(atmosphere));
        }

        CatalogPair pair = new CatalogPair(
            new BandpassCatalog(bandLabels, total),
            new BandpassCatalog(bandLabels, hardware));
        LOG.info("Built bandpass catalogs {} from {} ({} components, atmosphere={})",
            bandLabels, directory, componentList.size(), atmosphereFile);
        return pair;
    }

    /** buildCatalog with the LSST component list, filter root and atmosphere. */
    public static CatalogPair buildLsstCatalog(Path directory) throws IOException {
        return buildCatalog(LSST_BANDS, directory, FILTER_ROOT, LSST_COMPONENTS, ATMOSPHERE_FILE);
    }

    /**
     * Loads pre-combined throughputs, one file {root}{label}.dat per band.
     *
     * @throws java.io.FileNotFoundException if any file is missing
     */
    public static BandpassCatalog loadPrebuilt(List<String> bandLabels,
                                               Path directory,
                                               String root) throws IOException {
        requireArgs(bandLabels, directory, root);
        List<Bandpass> curves = new ArrayList<>(bandLabels.size());
        for (String label : bandLabels) {
            curves.add(readThroughput(directory.resolve(bandFileName(root, label))));
        }
        BandpassCatalog catalog = new BandpassCatalog(bandLabels, curves);
        LOG.info("Loaded pre-combined bandpass catalog {} from {}", bandLabels, directory);
        return catalog;
    }

    /** File name convention: root + label + ".dat". */
    public static String bandFileName(String root, String label) {
        return root + label + ".dat";
    }

    private static void requireArgs(List<String> bandLabels, Path directory, String root) {
        if (bandLabels == null) {
            throw new NullPointerException("bandLabels");
        }
        if (directory == null) {
            throw new NullPointerException("directory");
        }
        if (root == null) {
            throw new NullPointerException("root");
        }
    }
}
