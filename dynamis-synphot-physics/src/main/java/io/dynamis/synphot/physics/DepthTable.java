package io.dynamis.synphot.physics;

import io.dynamis.synphot.api.ConfigurationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable per-band 5-sigma limiting magnitudes (m5), optionally paired with
 * precomputed gamma coefficients of the photometric error model.
 *
 * Observation metadata supplies m5 only; the built-in LSST table also carries
 * gamma. Instances are compared by identity when used as a cache key, so build
 * one table per observation and reuse it.
 */
public final class DepthTable {

    private static final DepthTable LSST_DEFAULTS = builder()
        .band("u", 23.68, 0.037)
        .band("g", 24.89, 0.038)
        .band("r", 24.43, 0.039)
        .band("i", 24.00, 0.039)
        .band("z", 24.45, 0.040)
        .band("y", 22.60, 0.040)
        .build();

    private final Map<String, Double> m5;
    private final Map<String, Double> gamma;

    private DepthTable(Map<String, Double> m5, Map<String, Double> gamma) {
        this.m5 = Collections.unmodifiableMap(new LinkedHashMap<>(m5));
        this.gamma = Collections.unmodifiableMap(new LinkedHashMap<>(gamma));
    }

    /** m5-only table, e.g. from observation metadata. */
    public static DepthTable of(Map<String, Double> m5ByBand) {
        if (m5ByBand == null) {
            throw new NullPointerException("m5ByBand");
        }
        Builder builder = builder();
        for (Map.Entry<String, Double> e : m5ByBand.entrySet()) {
            if (e.getValue() == null) {
                throw new NullPointerException("m5 for band " + e.getKey());
            }
            builder.band(e.getKey(), e.getValue());
        }
        return builder.build();
    }

    /** Baseline LSST single-visit depths and gamma values for u, g, r, i, z, y. */
    public static DepthTable lsstDefaults() {
        return LSST_DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean contains(String band) {
        return m5.containsKey(band);
    }

    public boolean hasGamma(String band) {
        return gamma.containsKey(band);
    }

    /** @throws ConfigurationException if the band is absent */
    public double m5(String band) {
        Double value = m5.get(band);
        if (value == null) {
            throw new ConfigurationException(band, "no m5 for band '" + band + "'");
        }
        return value;
    }

    /** @throws ConfigurationException if no gamma is stored for the band */
    public double gamma(String band) {
        Double value = gamma.get(band);
        if (value == null) {
            throw new ConfigurationException(band, "no gamma for band '" + band + "'");
        }
        return value;
    }

    public Set<String> bands() {
        return m5.keySet();
    }

    @Override
    public String toString() {
        return "DepthTable{m5=" + m5 + ", gamma=" + gamma + "}";
    }

    public static final class Builder {

        private final Map<String, Double> m5 = new LinkedHashMap<>();
        private final Map<String, Double> gamma = new LinkedHashMap<>();

        private Builder() {}

        public Builder band(String band, double m5Value) {
            if (band == null) {
                throw new NullPointerException("band");
            }
            if (!Double.isFinite(m5Value)) {
                throw new IllegalArgumentException("m5 for band '" + band + "' must be finite");
            }
            m5.put(band, m5Value);
            gamma.remove(band);
            return this;
        }

        public Builder band(String band, double m5Value, double gammaValue) {
            band(band, m5Value);
            if (gammaValue < 0.0 || !Double.isFinite(gammaValue)) {
                throw new IllegalArgumentException(
                    "gamma for band '" + band + "' must be finite and >= 0");
            }
            gamma.put(band, gammaValue);
            return this;
        }

        public DepthTable build() {
            return new DepthTable(m5, gamma);
        }
    }
}
