/* (C)2026 */
package com.ammann.calibration.startup;

import com.ammann.calibration.model.CalibrationContext;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Forces the calibration to load on application startup.
 * <p>
 * Injecting the {@link CalibrationContext} here runs the loader and the interaction
 * governor before the HTTP layer accepts requests. Any calibration error propagates out
 * of the startup observer and Quarkus aborts the boot, so the process never reports
 * ready with a malformed calibration.
 */
@ApplicationScoped
public class CalibrationStartupGate {

    private static final Logger LOG = Logger.getLogger(CalibrationStartupGate.class);

    @Inject CalibrationContext context;

    void onStart(@Observes StartupEvent event) {
        LOG.infof(
                "Calibration gate passed: cohort=%s version=%s, %d roles, graph order %s",
                context.cohort(), context.version(), context.weightSets().size(), context.topologicalOrder());
    }
}
