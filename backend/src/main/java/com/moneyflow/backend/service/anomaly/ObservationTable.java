package com.moneyflow.backend.service.anomaly;

import com.moneyflow.backend.model.Observation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Column-oriented batch of observations. Missing cells are {@code NaN}.
 */
public final class ObservationTable {

    public static final String TIMESTAMP_COLUMN = "timestamp";
    public static final String VOLUME_COLUMN = "volume";

    private final List<String> timestamps;
    private final Map<String, double[]> columns;
    private final int rowCount;

    /**
     * @param timestamps row labels, or {@code null} when rows carry no timestamp
     * @param columns    named columns, all of equal length
     */
    public ObservationTable(List<String> timestamps, Map<String, double[]> columns) {
        Map<String, double[]> copy = new LinkedHashMap<>();
        int rows = -1;
        for (Map.Entry<String, double[]> entry : columns.entrySet()) {
            double[] values = entry.getValue();
            if (rows >= 0 && values.length != rows) {
                throw new IllegalArgumentException("Column " + entry.getKey() + " has " + values.length
                        + " rows, expected " + rows);
            }
            rows = values.length;
            copy.put(entry.getKey(), Arrays.copyOf(values, values.length));
        }
        if (rows < 0) {
            rows = timestamps == null ? 0 : timestamps.size();
        }
        if (timestamps != null && timestamps.size() != rows) {
            throw new IllegalArgumentException("Expected " + rows + " timestamps, got " + timestamps.size());
        }
        this.timestamps = timestamps == null ? null : Collections.unmodifiableList(new ArrayList<>(timestamps));
        this.columns = Collections.unmodifiableMap(copy);
        this.rowCount = rows;
    }

    public static ObservationTable empty() {
        return new ObservationTable(null, Map.of());
    }

    /**
     * Pivots observations into one column per symbol, one row per distinct timestamp.
     * A {@code volume} column sums the volume reported at each timestamp when any observation has one.
     */
    public static ObservationTable fromObservations(List<Observation> observations) {
        if (observations == null || observations.isEmpty()) {
            return empty();
        }
        TreeMap<Instant, Map<String, Double>> byTime = new TreeMap<>();
        TreeMap<Instant, Double> volumeByTime = new TreeMap<>();
        TreeSet<String> symbols = new TreeSet<>();
        boolean anyVolume = false;
        for (Observation observation : observations) {
            if (observation == null || !observation.isValid() || observation.getTimestamp() == null) {
                continue;
            }
            String symbol = Observation.normalizeSymbol(observation.getSymbol());
            symbols.add(symbol);
            byTime.computeIfAbsent(observation.getTimestamp(), t -> new LinkedHashMap<>())
                    .put(symbol, observation.getValue());
            if (observation.getVolume() != null) {
                anyVolume = true;
                volumeByTime.merge(observation.getTimestamp(), observation.getVolume().doubleValue(), Double::sum);
            }
        }
        List<String> labels = new ArrayList<>(byTime.size());
        Map<String, double[]> columns = new LinkedHashMap<>();
        for (String symbol : symbols) {
            columns.put(symbol, new double[byTime.size()]);
        }
        double[] volume = anyVolume ? new double[byTime.size()] : null;
        int row = 0;
        for (Map.Entry<Instant, Map<String, Double>> entry : byTime.entrySet()) {
            labels.add(entry.getKey().toString());
            for (String symbol : symbols) {
                Double value = entry.getValue().get(symbol);
                columns.get(symbol)[row] = value == null ? Double.NaN : value;
            }
            if (volume != null) {
                Double total = volumeByTime.get(entry.getKey());
                volume[row] = total == null ? Double.NaN : total;
            }
            row++;
        }
        if (volume != null) {
            columns.put(VOLUME_COLUMN, volume);
        }
        return new ObservationTable(labels, columns);
    }

    public int rowCount() {
        return rowCount;
    }

    public boolean isEmpty() {
        return rowCount == 0 || columns.isEmpty();
    }

    public boolean hasTimestamps() {
        return timestamps != null;
    }

    /** Timestamp label of a row, or the row index when the table has no timestamps. */
    public String rowLabel(int row) {
        if (timestamps != null && timestamps.get(row) != null) {
            return timestamps.get(row);
        }
        return String.valueOf(row);
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public double[] column(String name) {
        double[] values = columns.get(name);
        if (values == null) {
            throw new IllegalArgumentException("Unknown column " + name);
        }
        return Arrays.copyOf(values, values.length);
    }

    /** Column names usable as features, in insertion order. */
    public List<String> numericColumns() {
        List<String> names = new ArrayList<>();
        for (String name : columns.keySet()) {
            if (!TIMESTAMP_COLUMN.equals(name)) {
                names.add(name);
            }
        }
        return names;
    }

    /**
     * Row-major feature matrix with missing values replaced by the column mean,
     * or 0 for a column with no values at all.
     */
    public double[][] meanFilledMatrix(List<String> featureColumns) {
        double[][] matrix = new double[rowCount][featureColumns.size()];
        for (int c = 0; c < featureColumns.size(); c++) {
            double[] values = columns.get(featureColumns.get(c));
            double sum = 0.0;
            int count = 0;
            for (double v : values) {
                if (!Double.isNaN(v)) {
                    sum += v;
                    count++;
                }
            }
            double fill = count == 0 ? 0.0 : sum / count;
            for (int r = 0; r < rowCount; r++) {
                matrix[r][c] = Double.isNaN(values[r]) ? fill : values[r];
            }
        }
        return matrix;
    }
}
