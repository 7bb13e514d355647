package io.dynamis.synphot.pipeline;

import io.dynamis.synphot.api.PhotometryConstants;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Which components make up a source and how each is transformed.
 *
 * Built in code; the two presets cover the catalog types the pipeline was
 * written for. Immutable.
 */
public final class PipelineConfig {

    private final List<SourceComponent> components;
    private final boolean dimming;
    private final boolean sharedGrid;
    private final double rv;

    private PipelineConfig(Builder b) {
        this.components = Collections.unmodifiableList(new ArrayList<>(b.components));
        this.dimming = b.dimming;
        this.sharedGrid = b.sharedGrid;
        this.rv = b.rv;
    }

    /**
     * Single "star" component. Stars are reddened by Galactic dust outside this
     * pipeline, so neither extinction nor redshift is applied.
     */
    public static PipelineConfig stars() {
        return builder()
            .component(new SourceComponent("star", false, false))
            .build();
    }

    /** Bulge and disk with internal extinction and redshift; agn with redshift only. */
    public static PipelineConfig galaxies() {
        return builder()
            .component(new SourceComponent("bulge", true, true))
            .component(new SourceComponent("disk", true, true))
            .component(new SourceComponent("agn", false, true))
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<SourceComponent> components() { return components; }

    /** Cosmological flux dimming by 1/(1+z) when redshifting. */
    public boolean dimming() { return dimming; }

    /** Resample every template of a component onto the first template's grid. */
    public boolean sharedGrid() { return sharedGrid; }

    /** Ratio of total to selective extinction used for every component. */
    public double rv() { return rv; }

    @Override
    public String toString() {
        return "PipelineConfig{components=" + components + ", dimming=" + dimming
            + ", sharedGrid=" + sharedGrid + ", rv=" + rv + "}";
    }

    public static final class Builder {

        private final List<SourceComponent> components = new ArrayList<>();
        private boolean dimming = true;
        private boolean sharedGrid = false;
        private double rv = PhotometryConstants.DEFAULT_RV;

        private Builder() {}

        public Builder component(SourceComponent component) {
            if (component == null) {
                throw new NullPointerException("component");
            }
            components.add(component);
            return this;
        }

        public Builder dimming(boolean v) { this.dimming = v; return this; }
        public Builder sharedGrid(boolean v) { this.sharedGrid = v; return this; }
        public Builder rv(double v) { this.rv = v; return this; }

        public PipelineConfig build() {
            if (components.isEmpty()) {
                throw new IllegalArgumentException("at least one component is required");
            }
            Set<String> names = new HashSet<>();
            for (SourceComponent c : components) {
                if (!names.add(c.name())) {
                    throw new IllegalArgumentException("duplicate component: " + c.name());
                }
            }
            if (!(rv > 0.0) || !Double.isFinite(rv)) {
                throw new IllegalArgumentException("rv must be finite and > 0, got " + rv);
            }
            return new PipelineConfig(this);
        }
    }
}
