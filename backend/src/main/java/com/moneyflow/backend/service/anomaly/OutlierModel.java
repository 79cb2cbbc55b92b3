package com.moneyflow.backend.service.anomaly;

import com.amazon.randomcutforest.RandomCutForest;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Multivariate outlier model backed by a Random Cut Forest.
 * Trained once on the first qualifying table, then only used for scoring.
 */
@Slf4j
public class OutlierModel {

    public enum State {
        UNTRAINED,
        TRAINED
    }

    /**
     * @param isolationScore forest score mapped to {@code -(1 - 2^-raw)}, in (-1, 0]
     */
    public record RowScore(double rawScore, double isolationScore, boolean outlier) {}

    private final double contamination;
    private final long randomSeed;
    private final int numberOfTrees;
    private final int maxSampleSize;

    final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private State state = State.UNTRAINED;
    private RandomCutForest forest;
    private List<String> features = List.of();
    private double cutoff;

    public OutlierModel(double contamination, long randomSeed, int numberOfTrees, int maxSampleSize) {
        this.contamination = contamination;
        this.randomSeed = randomSeed;
        this.numberOfTrees = numberOfTrees;
        this.maxSampleSize = maxSampleSize;
    }

    public State getState() {
        lock.readLock().lock();
        try {
            return state;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> getFeatures() {
        lock.readLock().lock();
        try {
            return features;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Trains the forest unless it is already trained. Returns whether the model is trained afterwards.
     */
    public boolean trainIfNeeded(List<String> featureNames, double[][] rows) {
        if (getState() == State.TRAINED) {
            return true;
        }
        lock.writeLock().lock();
        try {
            if (state == State.TRAINED) {
                return true;
            }
            if (featureNames.isEmpty() || rows.length < 2) {
                return false;
            }
            RandomCutForest candidate = RandomCutForest.builder()
                    .dimensions(featureNames.size())
                    .numberOfTrees(numberOfTrees)
                    .sampleSize(Math.min(maxSampleSize, rows.length))
                    .randomSeed(randomSeed)
                    .outputAfter(1)
                    .build();
            for (double[] row : rows) {
                candidate.update(row);
            }
            double[] trainingScores = new double[rows.length];
            for (int i = 0; i < rows.length; i++) {
                trainingScores[i] = candidate.getAnomalyScore(rows[i]);
            }
            Arrays.sort(trainingScores);
            int index = (int) Math.floor((1.0 - contamination) * (trainingScores.length - 1));
            this.cutoff = trainingScores[index];
            this.forest = candidate;
            this.features = List.copyOf(featureNames);
            this.state = State.TRAINED;
            log.info("Outlier model trained on {} rows, {} features, cutoff={}", rows.length, featureNames.size(), cutoff);
            return true;
        } catch (RuntimeException e) {
            log.warn("Outlier model training failed: {}", e.getMessage());
            return false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Scores rows against the trained forest. Empty when untrained or when the feature set differs.
     */
    public Optional<List<RowScore>> score(List<String> featureNames, double[][] rows) {
        lock.readLock().lock();
        try {
            if (state != State.TRAINED) {
                return Optional.empty();
            }
            if (!features.equals(featureNames)) {
                log.debug("Feature set {} does not match trained set {}", featureNames, features);
                return Optional.empty();
            }
            List<RowScore> scores = new ArrayList<>(rows.length);
            for (double[] row : rows) {
                double raw = forest.getAnomalyScore(row);
                double isolation = -(1.0 - Math.pow(2.0, -raw));
                scores.add(new RowScore(raw, isolation, raw > 0.0 && raw >= cutoff));
            }
            return Optional.of(scores);
        } finally {
            lock.readLock().unlock();
        }
    }
}
