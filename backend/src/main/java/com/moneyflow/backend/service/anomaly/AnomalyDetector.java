package com.moneyflow.backend.service.anomaly;

import com.moneyflow.backend.config.AnomalyProperties;
import com.moneyflow.backend.model.Anomaly;
import com.moneyflow.backend.model.AnomalyMethod;
import com.moneyflow.backend.model.AnomalySeverity;
import com.moneyflow.backend.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Batch detector combining per-column z-scores, a multivariate outlier model and volume spikes.
 */
@Service
@Slf4j
public class AnomalyDetector {

    public static final String ML_SYMBOL = "multi_feature";

    private final AnomalyProperties properties;
    private final MetricsService metricsService;
    private final OutlierModel outlierModel;

    public AnomalyDetector(AnomalyProperties properties, MetricsService metricsService) {
        this.properties = properties;
        this.metricsService = metricsService;
        AnomalyProperties.Ml ml = properties.getMl();
        this.outlierModel = new OutlierModel(ml.getContamination(), ml.getRandomSeed(),
                ml.getNumberOfTrees(), ml.getMaxSampleSize());
    }

    public OutlierModel getOutlierModel() {
        return outlierModel;
    }

    public List<Anomaly> detectAnomalies(ObservationTable table) {
        if (table == null || table.isEmpty()) {
            return List.of();
        }
        List<Anomaly> statistical = detectStatistical(table);
        List<Anomaly> ml = detectMl(table);
        List<Anomaly> pattern = detectPattern(table);
        metricsService.recordAnomalies(AnomalyMethod.STATISTICAL.name(), statistical.size());
        metricsService.recordAnomalies(AnomalyMethod.ML.name(), ml.size());
        metricsService.recordAnomalies(AnomalyMethod.PATTERN.name(), pattern.size());

        List<Anomaly> combined = new ArrayList<>(statistical.size() + ml.size() + pattern.size());
        combined.addAll(statistical);
        combined.addAll(ml);
        combined.addAll(pattern);
        // List.sort is stable, ties keep method order
        combined.sort(Comparator.comparingDouble(Anomaly::getScore).reversed());
        List<Anomaly> result = combined.size() > properties.getMaxResults()
                ? new ArrayList<>(combined.subList(0, properties.getMaxResults()))
                : combined;
        log.debug("Detected {} anomalies (statistical={}, ml={}, pattern={})",
                result.size(), statistical.size(), ml.size(), pattern.size());
        return result;
    }

    List<Anomaly> detectStatistical(ObservationTable table) {
        List<Anomaly> anomalies = new ArrayList<>();
        for (String column : table.numericColumns()) {
            double[] values = table.column(column);
            int count = 0;
            double sum = 0.0;
            for (double v : values) {
                if (!Double.isNaN(v)) {
                    count++;
                    sum += v;
                }
            }
            if (count < properties.getMinStatisticalSamples()) {
                continue;
            }
            double mean = sum / count;
            double squares = 0.0;
            for (double v : values) {
                if (!Double.isNaN(v)) {
                    squares += (v - mean) * (v - mean);
                }
            }
            double std = Math.sqrt(squares / (count - 1));
            if (std == 0.0) {
                continue;
            }
            for (int row = 0; row < values.length; row++) {
                double value = values[row];
                if (Double.isNaN(value)) {
                    continue;
                }
                double z = (value - mean) / std;
                double absZ = Math.abs(z);
                if (absZ <= properties.getZScoreThreshold()) {
                    continue;
                }
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("z_score", z);
                details.put("value", value);
                details.put("mean", mean);
                details.put("std", std);
                anomalies.add(Anomaly.builder()
                        .symbol(column)
                        .timestamp(table.rowLabel(row))
                        .method(AnomalyMethod.STATISTICAL)
                        .severity(zScoreSeverity(absZ))
                        .score(Math.min(absZ * 20.0, 100.0))
                        .details(details)
                        .build());
            }
        }
        return anomalies;
    }

    List<Anomaly> detectMl(ObservationTable table) {
        if (table.rowCount() < properties.getMl().getMinRows()) {
            return List.of();
        }
        List<String> features = table.numericColumns();
        if (features.isEmpty()) {
            return List.of();
        }
        double[][] matrix = table.meanFilledMatrix(features);
        if (!outlierModel.trainIfNeeded(features, matrix)) {
            log.warn("Outlier model unavailable, skipping ML detection");
            return List.of();
        }
        Optional<List<OutlierModel.RowScore>> scored;
        try {
            scored = outlierModel.score(features, matrix);
        } catch (RuntimeException e) {
            log.warn("Outlier scoring failed: {}", e.getMessage());
            return List.of();
        }
        if (scored.isEmpty()) {
            return List.of();
        }
        List<Anomaly> anomalies = new ArrayList<>();
        List<OutlierModel.RowScore> scores = scored.get();
        for (int row = 0; row < scores.size(); row++) {
            OutlierModel.RowScore rowScore = scores.get(row);
            if (!rowScore.outlier()) {
                continue;
            }
            double score = Math.abs(rowScore.isolationScore()) * 100.0;
            Map<String, Object> featureValues = new LinkedHashMap<>();
            for (int c = 0; c < features.size(); c++) {
                featureValues.put(features.get(c), matrix[row][c]);
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("anomaly_score", rowScore.isolationScore());
            details.put("features", featureValues);
            anomalies.add(Anomaly.builder()
                    .symbol(ML_SYMBOL)
                    .timestamp(table.rowLabel(row))
                    .method(AnomalyMethod.ML)
                    .severity(mlSeverity(score))
                    .score(score)
                    .details(details)
                    .build());
        }
        return anomalies;
    }

    List<Anomaly> detectPattern(ObservationTable table) {
        AnomalyProperties.Pattern pattern = properties.getPattern();
        String volumeColumn = pattern.getVolumeColumn();
        if (!table.hasColumn(volumeColumn)) {
            return List.of();
        }
        double[] column = table.column(volumeColumn);
        int window = pattern.getRollingWindow();
        // missing rows are dropped so the rolling window spans present values only
        int[] rows = new int[column.length];
        double[] volumes = new double[column.length];
        int present = 0;
        for (int row = 0; row < column.length; row++) {
            if (!Double.isNaN(column[row])) {
                rows[present] = row;
                volumes[present] = column[row];
                present++;
            }
        }
        if (present < window) {
            return List.of();
        }
        List<Anomaly> anomalies = new ArrayList<>();
        for (int index = window - 1; index < present; index++) {
            double sum = 0.0;
            for (int i = index - window + 1; i <= index; i++) {
                sum += volumes[i];
            }
            double average = sum / window;
            if (average == 0.0) {
                continue;
            }
            double ratio = volumes[index] / average;
            if (ratio <= pattern.getSpikeRatio()) {
                continue;
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("volume_ratio", ratio);
            details.put("volume", volumes[index]);
            details.put("avg_volume", average);
            anomalies.add(Anomaly.builder()
                    .symbol(volumeColumn)
                    .timestamp(table.rowLabel(rows[index]))
                    .method(AnomalyMethod.PATTERN)
                    .severity(AnomalySeverity.MEDIUM)
                    .score(Math.min(ratio * 25.0, 100.0))
                    .details(details)
                    .build());
        }
        return anomalies;
    }

    static AnomalySeverity zScoreSeverity(double absZ) {
        if (absZ > 4) {
            return AnomalySeverity.CRITICAL;
        }
        if (absZ > 3) {
            return AnomalySeverity.HIGH;
        }
        if (absZ > 2) {
            return AnomalySeverity.MEDIUM;
        }
        return AnomalySeverity.LOW;
    }

    static AnomalySeverity mlSeverity(double score) {
        if (score > 75) {
            return AnomalySeverity.HIGH;
        }
        if (score > 50) {
            return AnomalySeverity.MEDIUM;
        }
        return AnomalySeverity.LOW;
    }
}
