package io.dynamis.synphot.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of one PhotometryPipeline run. Every matrix is [band][object] with
 * rows in bandLabels() order.
 *
 * Uncertainty matrices are present only when the run requested them.
 */
public final class PhotometryResult {

    private final List<String> bandLabels;
    private final int objectCount;
    private final Map<String, double[][]> componentMagnitudes;
    private final double[][] totalMagnitudes;
    private final Map<String, double[][]> componentUncertainties;
    private final double[][] totalUncertainties;

    PhotometryResult(List<String> bandLabels,
                     int objectCount,
                     Map<String, double[][]> componentMagnitudes,
                     double[][] totalMagnitudes,
                     Map<String, double[][]> componentUncertainties,
                     double[][] totalUncertainties) {
        this.bandLabels = List.copyOf(bandLabels);
        this.objectCount = objectCount;
        this.componentMagnitudes = Collections.unmodifiableMap(new LinkedHashMap<>(componentMagnitudes));
        this.totalMagnitudes = totalMagnitudes;
        this.componentUncertainties = componentUncertainties == null
            ? null
            : Collections.unmodifiableMap(new LinkedHashMap<>(componentUncertainties));
        this.totalUncertainties = totalUncertainties;
    }

    public List<String> bandLabels() {
        return bandLabels;
    }

    public int objectCount() {
        return objectCount;
    }

    /** Component names in configuration order. */
    public List<String> componentNames() {
        return List.copyOf(componentMagnitudes.keySet());
    }

    /** @throws IllegalArgumentException for an unknown component */
    public double[][] magnitudes(String component) {
        return copy(require(componentMagnitudes, component));
    }

    /** -2.5 log10 of the summed component fluxes; NaN where every component is NaN. */
    public double[][] totalMagnitudes() {
        return copy(totalMagnitudes);
    }

    public boolean hasUncertainties() {
        return componentUncertainties != null;
    }

    /** @throws IllegalStateException if the run did not compute uncertainties */
    public double[][] uncertainties(String component) {
        requireUncertainties();
        return copy(require(componentUncertainties, component));
    }

    /** @throws IllegalStateException if the run did not compute uncertainties */
    public double[][] totalUncertainties() {
        requireUncertainties();
        return copy(totalUncertainties);
    }

    private void requireUncertainties() {
        if (componentUncertainties == null) {
            throw new IllegalStateException("uncertainties were not requested for this run");
        }
    }

    private static double[][] require(Map<String, double[][]> map, String component) {
        double[][] m = map.get(component);
        if (m == null) {
            throw new IllegalArgumentException("unknown component: " + component);
        }
        return m;
    }

    private static double[][] copy(double[][] m) {
        double[][] out = new double[m.length][];
        for (int i = 0; i < m.length; i++) {
            out[i] = m[i].clone();
        }
        return out;
    }
}
