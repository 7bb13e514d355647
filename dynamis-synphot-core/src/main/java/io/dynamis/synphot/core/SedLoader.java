package io.dynamis.synphot.core;

import io.dynamis.synphot.api.Bandpass;
import io.dynamis.synphot.api.PhotometryConstants;
import io.dynamis.synphot.api.Sed;
import io.dynamis.synphot.api.ShapeMismatchException;
import io.dynamis.synphot.api.WavelengthGrid;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads one magnitude-normalized SED per catalog object.
 *
 * DEDUPLICATION:
 *   Many objects share a spectral template. The first occurrence of a name reads
 *   the file; later occurrences start from the in-memory arrays. Every object
 *   still receives its own copy, because extinction and redshift are applied
 *   per object and in place.
 *
 * NORMALIZATION:
 *   Each copy is scaled so that its magnitude through
 *   Bandpass.referenceBandpass() equals the object's magNorm. A NaN magNorm
 *   leaves the copy at file scale.
 *
 * SHARED GRID:
 *   With sharedGrid, every template after the first is resampled onto the grid
 *   of the first-loaded template before any copies are made.
 *
 * Not thread safe; use one loader per worker.
 */
public final class SedLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SedLoader.class);

    private final SedFileResolver resolver;
    private int lastUniqueLoadCount = 0;

    public SedLoader(SedFileResolver resolver) {
        if (resolver == null) {
            throw new NullPointerException("resolver");
        }
        this.resolver = resolver;
    }

    /** Loader for a flat library directory. */
    public static SedLoader fromDirectory(Path directory) {
        return new SedLoader(SedFileResolver.inDirectory(directory));
    }

    /** Reads a single SED file (wavelength in nm, flambda). Named after the file. */
    public static Sed readSed(Path file) throws IOException {
        TwoColumnFileReader.Table table = TwoColumnFileReader.read(file);
        Path fileName = file.getFileName();
        return new Sed(fileName == null ? file.toString() : fileName.toString(),
            table.grid(), table.values());
    }

    /** True for names that stand for "no SED". */
    public static boolean isNoSed(String sedName) {
        return sedName == null || PhotometryConstants.NO_SED.equals(sedName);
    }

    /**
     * @param sedNames   per-object SED names; null or "None" yields Sed.empty()
     * @param magNorm    per-object normalization magnitudes; same length
     * @param sharedGrid resample every template onto the first template's grid
     * @return one independent SED per object, in input order
     * @throws ShapeMismatchException if the two inputs differ in length
     * @throws java.io.FileNotFoundException if a template file is missing
     * @throws ShapeMismatchException if a template has no flux at the
     *         reference wavelength and its object carries a magNorm
     */
    public List<Sed> load(List<String> sedNames, double[] magNorm, boolean sharedGrid)
            throws IOException {
        if (sedNames == null) {
            throw new NullPointerException("sedNames");
        }
        if (magNorm == null) {
            throw new NullPointerException("magNorm");
        }
        ShapeMismatchException.requireLength("magNorm", sedNames.size(), magNorm.length);

        Map<String, Template> templates = new HashMap<>();
        WavelengthGrid firstGrid = null;
        for (String name : sedNames) {
            if (isNoSed(name) || templates.containsKey(name)) {
                continue;
            }
            Sed sed = readSed(resolver.resolve(name));
            sed.rename(name);
            if (sharedGrid) {
                if (firstGrid == null) {
                    firstGrid = sed.grid();
                } else {
                    sed.resample(firstGrid);
                }
            }
            templates.put(name, new Template(sed));
            LOG.debug("Loaded SED template '{}' ({} points)", name, sed.grid().size());
        }
        lastUniqueLoadCount = templates.size();

        List<Sed> out = new ArrayList<>(sedNames.size());
        for (int i = 0; i < sedNames.size(); i++) {
            String name = sedNames.get(i);
            if (isNoSed(name)) {
                out.add(Sed.empty());
                continue;
            }
            Template template = templates.get(name);
            Sed copy = template.sed.copy();
            if (Double.isNaN(magNorm[i])) {
                LOG.debug("Object {} ('{}') has no magNorm; left unnormalized", i, name);
            } else {
                copy.multiplyFluxNorm(template.fluxNormFor(magNorm[i]));
            }
            out.add(copy);
        }
        return out;
    }

    /** Number of distinct files read by the most recent load() call. */
    public int lastUniqueLoadCount() {
        return lastUniqueLoadCount;
    }

    private static final class Template {
        final Sed sed;
        private double referenceMag = Double.NaN;

        Template(Sed sed) {
            this.sed = sed;
        }

        /** Same factor as Sed.fluxNormFor, with the template magnitude computed once. */
        double fluxNormFor(double magNorm) {
            if (Double.isNaN(referenceMag)) {
                referenceMag = sed.magnitude(Bandpass.referenceBandpass());
                if (Double.isNaN(referenceMag)) {
                    throw new ShapeMismatchException("SED '" + sed.name() + "' covers ["
                        + sed.grid().min() + ", " + sed.grid().max()
                        + "] nm and has no flux at the reference wavelength; cannot apply magNorm");
                }
            }
            return Math.pow(10.0, -0.4 * (magNorm - referenceMag));
        }
    }
}
