package io.dynamis.synphot.api;

/**
 * Thrown when required observation metadata is missing, e.g. no 5-sigma depth
 * is known for a band either from the caller or from the built-in defaults.
 */
public final class ConfigurationException extends PhotometryException {

    private final String band;

    public ConfigurationException(String band, String message) {
        super(message);
        this.band = band;
    }

    /** Band label the failure refers to; null if not band specific. */
    public String band() {
        return band;
    }
}
