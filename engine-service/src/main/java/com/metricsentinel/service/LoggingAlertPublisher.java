package com.metricsentinel.service;

import com.metricsentinel.core.engine.AlertListener;
import com.metricsentinel.core.model.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Writes every new alert as one JSON line to the {@value #ALERT_LOGGER}
 * logger, which the logging configuration routes to its own appender.
 */
public class LoggingAlertPublisher implements AlertListener {

    public static final String ALERT_LOGGER = "metricsentinel.alerts";

    private static final Logger ALERTS = LoggerFactory.getLogger(ALERT_LOGGER);

    private final AlertJsonSerializer serializer;

    public LoggingAlertPublisher(AlertJsonSerializer serializer) {
        this.serializer = Objects.requireNonNull(serializer, "AlertJsonSerializer must not be null");
    }

    @Override
    public void onAlert(Alert alert) {
        serializer.serialize(alert).ifPresent(ALERTS::info);
    }
}
