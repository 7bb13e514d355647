package io.dynamis.synphot.api;

/**
 * Immutable instrument constants consumed by the photometric error model.
 *
 * Defaults describe an LSST-like camera: two 15 s exposures through a
 * 6.423 m effective aperture. Build variants with {@link #builder()}.
 */
public final class PhotometricParameters {

    /** Effective collecting area of a 6.423 m diameter aperture, in cm^2. */
    public static final double DEFAULT_EFFECTIVE_AREA_CM2 = Math.PI * Math.pow(642.3 / 2.0, 2);

    private static final PhotometricParameters DEFAULTS = builder().build();

    private final double exposureTimeSeconds;
    private final int exposureCount;
    private final double effectiveAreaCm2;
    private final double gain;
    private final double readNoise;
    private final double otherNoise;
    private final double darkCurrent;
    private final double plateScale;
    private final double sigmaSys;

    private PhotometricParameters(Builder b) {
        if (!(b.exposureTimeSeconds > 0.0)) {
            throw new IllegalArgumentException("exposureTimeSeconds must be > 0");
        }
        if (b.exposureCount < 1) {
            throw new IllegalArgumentException("exposureCount must be >= 1");
        }
        if (!(b.effectiveAreaCm2 > 0.0)) {
            throw new IllegalArgumentException("effectiveAreaCm2 must be > 0");
        }
        if (!(b.gain > 0.0)) {
            throw new IllegalArgumentException("gain must be > 0");
        }
        if (b.readNoise < 0.0 || b.otherNoise < 0.0 || b.darkCurrent < 0.0) {
            throw new IllegalArgumentException("noise terms must be >= 0");
        }
        if (!(b.plateScale > 0.0)) {
            throw new IllegalArgumentException("plateScale must be > 0");
        }
        if (b.sigmaSys < 0.0) {
            throw new IllegalArgumentException("sigmaSys must be >= 0");
        }
        this.exposureTimeSeconds = b.exposureTimeSeconds;
        this.exposureCount = b.exposureCount;
        this.effectiveAreaCm2 = b.effectiveAreaCm2;
        this.gain = b.gain;
        this.readNoise = b.readNoise;
        this.otherNoise = b.otherNoise;
        this.darkCurrent = b.darkCurrent;
        this.plateScale = b.plateScale;
        this.sigmaSys = b.sigmaSys;
    }

    public static PhotometricParameters defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Duration of a single exposure in seconds. */
    public double exposureTimeSeconds() { return exposureTimeSeconds; }

    /** Number of exposures co-added into one visit. */
    public int exposureCount() { return exposureCount; }

    /** Total open-shutter time of a visit: exposureTime * exposureCount. */
    public double totalExposureSeconds() { return exposureTimeSeconds * exposureCount; }

    /** Effective collecting area in cm^2. */
    public double effectiveAreaCm2() { return effectiveAreaCm2; }

    /** Electrons per ADU. */
    public double gain() { return gain; }

    /** Read noise in electrons per pixel per exposure. */
    public double readNoise() { return readNoise; }

    /** Additional instrumental noise in electrons per pixel per exposure. */
    public double otherNoise() { return otherNoise; }

    /** Dark current in electrons per pixel per second. */
    public double darkCurrent() { return darkCurrent; }

    /** Arcseconds per pixel. */
    public double plateScale() { return plateScale; }

    /** Systematic magnitude error floor, added in quadrature. */
    public double sigmaSys() { return sigmaSys; }

    public Builder toBuilder() {
        return new Builder()
            .exposureTimeSeconds(exposureTimeSeconds)
            .exposureCount(exposureCount)
            .effectiveAreaCm2(effectiveAreaCm2)
            .gain(gain)
            .readNoise(readNoise)
            .otherNoise(otherNoise)
            .darkCurrent(darkCurrent)
            .plateScale(plateScale)
            .sigmaSys(sigmaSys);
    }

    @Override
    public String toString() {
        return "PhotometricParameters{exptime=" + exposureTimeSeconds
            + "s x" + exposureCount
            + ", area=" + effectiveAreaCm2 + "cm2"
            + ", gain=" + gain
            + ", readNoise=" + readNoise
            + ", sigmaSys=" + sigmaSys + "}";
    }

    public static final class Builder {

        private double exposureTimeSeconds = 15.0;
        private int exposureCount = 2;
        private double effectiveAreaCm2 = DEFAULT_EFFECTIVE_AREA_CM2;
        private double gain = 2.3;
        private double readNoise = 8.8;
        private double otherNoise = 0.0;
        private double darkCurrent = 0.2;
        private double plateScale = 0.2;
        private double sigmaSys = 0.005;

        private Builder() {}

        public Builder exposureTimeSeconds(double v) { this.exposureTimeSeconds = v; return this; }
        public Builder exposureCount(int v) { this.exposureCount = v; return this; }
        public Builder effectiveAreaCm2(double v) { this.effectiveAreaCm2 = v; return this; }
        public Builder gain(double v) { this.gain = v; return this; }
        public Builder readNoise(double v) { this.readNoise = v; return this; }
        public Builder otherNoise(double v) { this.otherNoise = v; return this; }
        public Builder darkCurrent(double v) { this.darkCurrent = v; return this; }
        public Builder plateScale(double v) { this.plateScale = v; return this; }
        public Builder sigmaSys(double v) { this.sigmaSys = v; return this; }

        public PhotometricParameters build() {
            return new PhotometricParameters(this);
        }
    }
}
