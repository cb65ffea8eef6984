package com.metricsentinel.core.model;

import java.io.Serializable;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregate view over the alerts of one organization within a time range.
 *
 * @since 1.0.0
 */
public final class AnomalyStats implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int totalAlerts;
    private final Map<Severity, Long> bySeverity;
    private final Map<AnomalyType, Long> byType;
    private final int acknowledged;
    private final int unacknowledged;
    private final double averageScore;

    private AnomalyStats(int totalAlerts, Map<Severity, Long> bySeverity, Map<AnomalyType, Long> byType,
            int acknowledged, double averageScore) {
        this.totalAlerts = totalAlerts;
        this.bySeverity = Collections.unmodifiableMap(bySeverity);
        this.byType = Collections.unmodifiableMap(byType);
        this.acknowledged = acknowledged;
        this.unacknowledged = totalAlerts - acknowledged;
        this.averageScore = averageScore;
    }

    /**
     * Summarize a collection of alerts.
     *
     * @param alerts the alerts to aggregate; may be empty
     * @return statistics; {@code averageScore} is 0 for an empty collection
     */
    public static AnomalyStats of(Collection<Alert> alerts) {
        Map<Severity, Long> bySeverity = new EnumMap<>(Severity.class);
        Map<AnomalyType, Long> byType = new EnumMap<>(AnomalyType.class);
        int acknowledged = 0;
        double totalScore = 0;

        for (Alert alert : alerts) {
            DetectionResult result = alert.getResult();
            bySeverity.merge(result.getSeverity(), 1L, Long::sum);
            byType.merge(result.getType(), 1L, Long::sum);
            totalScore += result.getScore();
            if (alert.isAcknowledged()) {
                acknowledged++;
            }
        }

        int total = alerts.size();
        return new AnomalyStats(total, bySeverity, byType, acknowledged,
                total > 0 ? totalScore / total : 0);
    }

    public int getTotalAlerts() {
        return totalAlerts;
    }

    public Map<Severity, Long> getBySeverity() {
        return bySeverity;
    }

    public Map<AnomalyType, Long> getByType() {
        return byType;
    }

    public int getAcknowledged() {
        return acknowledged;
    }

    public int getUnacknowledged() {
        return unacknowledged;
    }

    public double getAverageScore() {
        return averageScore;
    }

    @Override
    public String toString() {
        return "AnomalyStats{" +
                "totalAlerts=" + totalAlerts +
                ", bySeverity=" + bySeverity +
                ", byType=" + byType +
                ", acknowledged=" + acknowledged +
                ", unacknowledged=" + unacknowledged +
                ", averageScore=" + averageScore +
                '}';
    }
}
