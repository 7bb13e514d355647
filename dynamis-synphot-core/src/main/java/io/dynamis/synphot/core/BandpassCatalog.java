package io.dynamis.synphot.core;

import io.dynamis.synphot.api.Bandpass;
import io.dynamis.synphot.api.WavelengthGrid;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Ordered mapping of band label to Bandpass, all on one shared wavelength grid.
 *
 * Insertion order defines the canonical band order: row i of every magnitude
 * matrix computed against this catalog belongs to labels().get(i).
 *
 * PHI CACHE:
 *   The phi matrix (one normalized response row per band) is computed lazily on
 *   the first magnitude request and kept for the lifetime of the instance.
 *   phiComputationCount() exposes how often that happened; it never exceeds 1.
 *
 * THREAD SAFETY:
 *   Read-only after construction. Lazy phi initialisation is synchronized, so an
 *   instance may be shared by concurrent readers.
 */
public final class BandpassCatalog {

    private static final AtomicLong NEXT_ID = new AtomicLong(1L);

    private final long id;
    private final LinkedHashMap<String, Bandpass> bands;
    private final List<String> labels;
    private final WavelengthGrid grid;

    private volatile double[][] phi;
    private int phiComputations = 0;

    /**
     * @param labels     band labels in canonical order; unique, non-null
     * @param bandpasses one bandpass per label; later bands are resampled onto
     *                   the grid of the first
     */
    public BandpassCatalog(List<String> labels, List<Bandpass> bandpasses) {
        if (labels == null) {
            throw new NullPointerException("labels");
        }
        if (bandpasses == null) {
            throw new NullPointerException("bandpasses");
        }
        if (labels.size() != bandpasses.size()) {
            throw new IllegalArgumentException(
                labels.size() + " labels for " + bandpasses.size() + " bandpasses");
        }
        if (labels.isEmpty()) {
            throw new IllegalArgumentException("a catalog needs at least one band");
        }

        WavelengthGrid shared = bandpasses.get(0).grid();
        LinkedHashMap<String, Bandpass> map = new LinkedHashMap<>();
        for (int i = 0; i < labels.size(); i++) {
            String label = labels.get(i);
            Bandpass bp = bandpasses.get(i);
            if (label == null) {
                throw new NullPointerException("labels[" + i + "]");
            }
            if (bp == null) {
                throw new NullPointerException("bandpasses[" + i + "]");
            }
            if (map.containsKey(label)) {
                throw new IllegalArgumentException("duplicate band label: " + label);
            }
            map.put(label, bp.resample(shared));
        }

        this.id = NEXT_ID.getAndIncrement();
        this.bands = map;
        this.labels = Collections.unmodifiableList(new ArrayList<>(map.keySet()));
        this.grid = shared;
    }

    /** Identity token, unique per catalog instance. Keys per-catalog caches. */
    public long id() {
        return id;
    }

    public int size() {
        return bands.size();
    }

    /** Band labels in canonical order. Unmodifiable. */
    public List<String> labels() {
        return labels;
    }

    public boolean contains(String label) {
        return bands.containsKey(label);
    }

    /** @return the bandpass, or null if the label is unknown */
    public Bandpass get(String label) {
        return bands.get(label);
    }

    public Bandpass bandpass(int index) {
        return bands.get(labels.get(index));
    }

    /** Unmodifiable ordered view of the catalog. */
    public Map<String, Bandpass> asMap() {
        return Collections.unmodifiableMap(bands);
    }

    /** The grid every bandpass in this catalog is tabulated on. */
    public WavelengthGrid grid() {
        return grid;
    }

    /** Integration step of the shared grid in nm. */
    public double wavelengthStep() {
        return grid.step();
    }

    /** Copy of the phi row for one band. */
    public double[] phi(int index) {
        return phiMatrix()[index].clone();
    }

    /** Number of times the phi matrix has been built. 0 before first use, 1 after. */
    public synchronized int phiComputationCount() {
        return phiComputations;
    }

    /**
     * Cached phi matrix [band][wavelength]. Callers in this package must not
     * modify the returned rows.
     */
    double[][] phiMatrix() {
        double[][] local = phi;
        if (local == null) {
            synchronized (this) {
                local = phi;
                if (local == null) {
                    local = new double[labels.size()][];
                    for (int i = 0; i < local.length; i++) {
                        local[i] = bandpass(i).phi();
                    }
                    phiComputations++;
                    phi = local;
                }
            }
        }
        return local;
    }

    @Override
    public String toString() {
        return "BandpassCatalog{id=" + id + ", bands=" + labels + ", grid=" + grid + "}";
    }
}
