package com.metricsentinel.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Caller-supplied input for training a {@link DetectionModel}.
 *
 * <p>
 * {@code parameters} are merged over the model's current parameters.
 * {@code accuracy} is recorded as reported; leave it {@code null} when the
 * caller did not measure one.
 * </p>
 *
 * @since 1.0.0
 */
public final class TrainingData implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<Double> samples;
    private final Map<String, Double> parameters;
    private final Double accuracy;

    public TrainingData(List<Double> samples, Map<String, Double> parameters, Double accuracy) {
        this.samples = samples != null ? List.copyOf(samples) : List.of();
        this.parameters = parameters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
                : Collections.emptyMap();
        this.accuracy = accuracy;
    }

    public static TrainingData ofSamples(List<Double> samples) {
        return new TrainingData(samples, null, null);
    }

    public List<Double> getSamples() {
        return samples;
    }

    public Map<String, Double> getParameters() {
        return parameters;
    }

    public Double getAccuracy() {
        return accuracy;
    }

    @Override
    public String toString() {
        return "TrainingData{" +
                "samples=" + samples.size() +
                ", parameters=" + parameters +
                ", accuracy=" + accuracy +
                '}';
    }
}
