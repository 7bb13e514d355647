package io.dynamis.synphot.core;

import io.dynamis.synphot.api.WavelengthGrid;
import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.StringTokenizer;

/**
 * Reader for whitespace-delimited (wavelength, value) text tables.
 *
 * Throughput curves and SED files share this layout. Lines starting with '#'
 * and blank lines are skipped; columns after the second are ignored. Rows are
 * sorted by wavelength after reading, and duplicate wavelengths keep the first
 * row seen.
 */
public final class TwoColumnFileReader {

    private TwoColumnFileReader() {}

    /** Parsed table: a grid plus one value per grid point. */
    public static final class Table {
        private final WavelengthGrid grid;
        private final double[] values;

        Table(WavelengthGrid grid, double[] values) {
            this.grid = grid;
            this.values = values;
        }

        public WavelengthGrid grid() {
            return grid;
        }

        /** Second column, copied. */
        public double[] values() {
            return values.clone();
        }
    }

    /**
     * Reads a two-column table.
     *
     * @throws FileNotFoundException if the file does not exist
     * @throws IOException if the file is unreadable, a row is malformed or
     *                     holds NaN/Infinity, or
     *                     fewer than two distinct wavelengths are present
     */
    public static Table read(Path file) throws IOException {
        if (file == null) {
            throw new NullPointerException("file");
        }
        if (!Files.isRegularFile(file)) {
            throw new FileNotFoundException(file.toString());
        }

        double[] lambda = new double[256];
        double[] value = new double[256];
        int count = 0;

        try (BufferedReader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = in.readLine()) != null) {
                lineNumber++;
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                StringTokenizer st = new StringTokenizer(trimmed);
                if (st.countTokens() < 2) {
                    throw new IOException(file + ":" + lineNumber
                        + ": expected two columns, got '" + trimmed + "'");
                }
                double x;
                double y;
                try {
                    x = Double.parseDouble(st.nextToken());
                    y = Double.parseDouble(st.nextToken());
                } catch (NumberFormatException e) {
                    throw new IOException(file + ":" + lineNumber
                        + ": not a number in '" + trimmed + "'", e);
                }
                if (!Double.isFinite(x) || !Double.isFinite(y)) {
                    throw new IOException(file + ":" + lineNumber
                        + ": non-finite value in '" + trimmed + "'");
                }
                if (count == lambda.length) {
                    lambda = Arrays.copyOf(lambda, count * 2);
                    value = Arrays.copyOf(value, count * 2);
                }
                lambda[count] = x;
                value[count] = y;
                count++;
            }
        }

        return sortAndBuild(file, lambda, value, count);
    }

    private static Table sortAndBuild(Path file, double[] lambda, double[] value, int count)
            throws IOException {
        Integer[] order = new Integer[count];
        for (int i = 0; i < count; i++) {
            order[i] = i;
        }
        final double[] keys = lambda;
        Arrays.sort(order, (p, q) -> Double.compare(keys[p], keys[q]));

        double[] sortedLambda = new double[count];
        double[] sortedValue = new double[count];
        int unique = 0;
        for (int i = 0; i < count; i++) {
            int src = order[i];
            if (unique > 0 && lambda[src] == sortedLambda[unique - 1]) {
                continue;
            }
            sortedLambda[unique] = lambda[src];
            sortedValue[unique] = value[src];
            unique++;
        }
        if (unique < 2) {
            throw new IOException(file + ": need at least two distinct wavelengths; found " + unique);
        }
        return new Table(
            new WavelengthGrid(Arrays.copyOf(sortedLambda, unique)),
            Arrays.copyOf(sortedValue, unique));
    }
}
