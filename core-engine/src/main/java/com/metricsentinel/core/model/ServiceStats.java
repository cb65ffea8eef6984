package com.metricsentinel.core.model;

import java.io.Serializable;

/**
 * Engine-wide counters for operational dashboards.
 *
 * @since 1.0.0
 */
public final class ServiceStats implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int totalModels;
    private final int trainedModels;
    private final int totalPatterns;
    private final int activePatterns;
    private final int totalAlerts;
    private final long totalDataPoints;
    private final int trackedSeries;

    public ServiceStats(int totalModels, int trainedModels, int totalPatterns, int activePatterns,
            int totalAlerts, long totalDataPoints, int trackedSeries) {
        this.totalModels = totalModels;
        this.trainedModels = trainedModels;
        this.totalPatterns = totalPatterns;
        this.activePatterns = activePatterns;
        this.totalAlerts = totalAlerts;
        this.totalDataPoints = totalDataPoints;
        this.trackedSeries = trackedSeries;
    }

    public int getTotalModels() {
        return totalModels;
    }

    public int getTrainedModels() {
        return trainedModels;
    }

    public int getTotalPatterns() {
        return totalPatterns;
    }

    public int getActivePatterns() {
        return activePatterns;
    }

    public int getTotalAlerts() {
        return totalAlerts;
    }

    public long getTotalDataPoints() {
        return totalDataPoints;
    }

    public int getTrackedSeries() {
        return trackedSeries;
    }

    @Override
    public String toString() {
        return "ServiceStats{" +
                "totalModels=" + totalModels +
                ", trainedModels=" + trainedModels +
                ", totalPatterns=" + totalPatterns +
                ", activePatterns=" + activePatterns +
                ", totalAlerts=" + totalAlerts +
                ", totalDataPoints=" + totalDataPoints +
                ", trackedSeries=" + trackedSeries +
                '}';
    }
}
