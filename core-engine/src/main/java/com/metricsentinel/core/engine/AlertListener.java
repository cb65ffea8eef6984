package com.metricsentinel.core.engine;

import com.metricsentinel.core.model.Alert;

/**
 * Callback invoked for every alert the engine creates.
 *
 * <p>
 * Listeners run on the sweep thread after the alert has been stored, so they
 * should hand off slow work. An exception thrown by a listener is logged and
 * does not affect other listeners or the sweep.
 * </p>
 */
@FunctionalInterface
public interface AlertListener {

    void onAlert(Alert alert);
}
