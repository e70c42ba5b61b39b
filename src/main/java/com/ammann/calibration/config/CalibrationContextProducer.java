/* (C)2026 */
package com.ammann.calibration.config;

import com.ammann.calibration.model.CalibrationContext;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

/**
 * CDI producer for the process-wide {@link CalibrationContext}.
 *
 * <p>The context is built once, on first injection, and shared by reference. It is
 * forced at startup by {@link com.ammann.calibration.startup.CalibrationStartupGate}
 * so that a malformed calibration stops the application before it accepts traffic.
 */
@ApplicationScoped
public class CalibrationContextProducer {

    @Produces
    @Singleton
    public CalibrationContext calibrationContext(CalibrationLoader loader) {
        return loader.load();
    }
}
