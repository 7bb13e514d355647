package io.dynamis.synphot.pipeline;

import io.dynamis.synphot.api.PhotometricParameters;
import io.dynamis.synphot.api.Sed;
import io.dynamis.synphot.api.ShapeMismatchException;
import io.dynamis.synphot.core.BandpassCatalog;
import io.dynamis.synphot.core.MagnitudeEngine;
import io.dynamis.synphot.core.SedLoader;
import io.dynamis.synphot.physics.DepthTable;
import io.dynamis.synphot.physics.ExtinctionEngine;
import io.dynamis.synphot.physics.RedshiftEngine;
import io.dynamis.synphot.physics.UncertaintyModel;
import java.io.IOException;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * End-to-end synthetic photometry for a batch of catalog objects.
 *
 * PER COMPONENT:
 *   load + normalize SEDs -> internal extinction (rest frame) -> redshift ->
 *   integrate against the catalog.
 *
 * TOTAL:
 *   Component fluxes are summed per band and object, skipping NaN components:
 *   m_total = -2.5 log10( sum 10^(-0.4 m_c) ). All components NaN gives NaN.
 *
 * The engines and their caches are owned by this instance, so one pipeline
 * per worker thread. Consecutive runs over the same grids and catalog reuse
 * the dust and uncertainty caches.
 */
public final class PhotometryPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(PhotometryPipeline.class);

    private final PipelineConfig config;
    private final SedLoader loader;
    private final MagnitudeEngine magnitudeEngine;
    private final ExtinctionEngine extinctionEngine;
    private final RedshiftEngine redshiftEngine;
    private final UncertaintyModel uncertaintyModel;

    public PhotometryPipeline(PipelineConfig config, SedLoader loader) {
        this(config, loader, new MagnitudeEngine(), new ExtinctionEngine(),
            new RedshiftEngine(), new UncertaintyModel());
    }

    public PhotometryPipeline(PipelineConfig config,
                              SedLoader loader,
                              MagnitudeEngine magnitudeEngine,
                              ExtinctionEngine extinctionEngine,
                              RedshiftEngine redshiftEngine,
                              UncertaintyModel uncertaintyModel) {
        if (config == null) {
            throw new NullPointerException("config");
        }
        if (loader == null) {
            throw new NullPointerException("loader");
        }
        if (magnitudeEngine == null) {
            throw new NullPointerException("magnitudeEngine");
        }
        if (extinctionEngine == null) {
            throw new NullPointerException("extinctionEngine");
        }
        if (redshiftEngine == null) {
            throw new NullPointerException("redshiftEngine");
        }
        if (uncertaintyModel == null) {
            throw new NullPointerException("uncertaintyModel");
        }
        this.config = config;
        this.loader = loader;
        this.magnitudeEngine = magnitudeEngine;
        this.extinctionEngine = extinctionEngine;
        this.redshiftEngine = redshiftEngine;
        this.uncertaintyModel = uncertaintyModel;
    }

    public PipelineConfig config() {
        return config;
    }

    public ExtinctionEngine extinctionEngine() {
        return extinctionEngine;
    }

    public UncertaintyModel uncertaintyModel() {
        return uncertaintyModel;
    }

    /** Magnitudes only. */
    public PhotometryResult run(Map<String, ComponentBatch> batches, BandpassCatalog catalog)
            throws IOException {
        return execute(batches, catalog, false, null, null);
    }

    /**
     * Magnitudes and uncertainties.
     *
     * @param depthTable per-observation m5, or null for the LSST defaults
     * @param params     instrument parameters for gamma and the systematic floor
     * @throws io.dynamis.synphot.api.ConfigurationException if a band has no m5 source
     */
    public PhotometryResult run(Map<String, ComponentBatch> batches,
                                BandpassCatalog catalog,
                                DepthTable depthTable,
                                PhotometricParameters params) throws IOException {
        if (params == null) {
            throw new NullPointerException("params");
        }
        return execute(batches, catalog, true, depthTable, params);
    }

    private PhotometryResult execute(Map<String, ComponentBatch> batches,
                                     BandpassCatalog catalog,
                                     boolean withUncertainty,
                                     DepthTable depthTable,
                                     PhotometricParameters params) throws IOException {
        if (batches == null) {
            throw new NullPointerException("batches");
        }
        if (catalog == null) {
            throw new NullPointerException("catalog");
        }
        int objectCount = validate(batches);

        Map<String, double[][]> magnitudes = new LinkedHashMap<>();
        for (SourceComponent component : config.components()) {
            magnitudes.put(component.name(),
                computeComponent(component, batches.get(component.name()), catalog));
        }
        double[][] total = combine(magnitudes, catalog.size(), objectCount);

        Map<String, double[][]> errors = null;
        double[][] totalErrors = null;
        if (withUncertainty) {
            errors = new LinkedHashMap<>();
            for (Map.Entry<String, double[][]> e : magnitudes.entrySet()) {
                errors.put(e.getKey(),
                    uncertaintyModel.estimate(e.getValue(), catalog, depthTable, params));
            }
            totalErrors = uncertaintyModel.estimate(total, catalog, depthTable, params);
        }

        LOG.info("Computed photometry for {} objects, components {}, bands {}",
            objectCount, magnitudes.keySet(), catalog.labels());
        return new PhotometryResult(catalog.labels(), objectCount, magnitudes, total,
            errors, totalErrors);
    }

    private double[][] computeComponent(SourceComponent component,
                                        ComponentBatch batch,
                                        BandpassCatalog catalog) throws IOException {
        List<Sed> seds = loader.load(batch.sedNames(), batch.magNorm(), config.sharedGrid());
        if (component.applyExtinction()) {
            extinctionEngine.applyInPlace(seds, batch.av(), config.rv());
        } else if (batch.av() != null) {
            LOG.debug("Component '{}' does not take extinction; Av values ignored", component.name());
        }
        if (component.applyRedshift()) {
            redshiftEngine.applyInPlace(seds, batch.redshift(), config.dimming());
        } else if (batch.redshift() != null) {
            LOG.debug("Component '{}' does not take redshift; values ignored", component.name());
        }
        return magnitudeEngine.computeMany(seds, catalog);
    }

    private int validate(Map<String, ComponentBatch> batches) {
        Set<String> expected = new HashSet<>();
        int objectCount = -1;
        for (SourceComponent component : config.components()) {
            expected.add(component.name());
            ComponentBatch batch = batches.get(component.name());
            if (batch == null) {
                throw new IllegalArgumentException("no batch for component '" + component.name() + "'");
            }
            if (objectCount < 0) {
                objectCount = batch.objectCount();
            } else {
                ShapeMismatchException.requireLength(
                    component.name() + " objects", objectCount, batch.objectCount());
            }
        }
        for (String key : batches.keySet()) {
            if (!expected.contains(key)) {
                throw new IllegalArgumentException("unknown component '" + key + "'");
            }
        }
        return objectCount;
    }

    static double[][] combine(Map<String, double[][]> components, int bands, int objects) {
        double[][] total = new double[bands][objects];
        for (int band = 0; band < bands; band++) {
            for (int obj = 0; obj < objects; obj++) {
                double flux = 0.0;
                boolean any = false;
                for (double[][] m : components.values()) {
                    double mag = m[band][obj];
                    if (!Double.isNaN(mag)) {
                        flux += Math.pow(10.0, -0.4 * mag);
                        any = true;
                    }
                }
                total[band][obj] = any ? -2.5 * Math.log10(flux) : Double.NaN;
            }
        }
        return total;
    }
}
