/* (C)2026 */
package com.ammann.calibration.health;

import com.ammann.calibration.model.CalibrationContext;
import com.ammann.calibration.service.CalibrationManifestService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

/**
 * Readiness of the calibration engine.
 *
 * <p>Only reachable once the calibration context exists, which implies every governor
 * check passed. Reports the loaded cohort and the size of the audit trail.
 */
@Readiness
@ApplicationScoped
public class CalibrationReadinessCheck implements HealthCheck {

    static final String NAME = "calibration-context";

    @Inject CalibrationContext context;

    @Inject CalibrationManifestService manifest;

    @Override
    public HealthCheckResponse call() {
        return HealthCheckResponse.named(NAME)
                .up()
                .withData("cohort", context.cohort())
                .withData("version", context.version())
                .withData("fingerprint", context.fingerprint())
                .withData("roles", context.weightSets().size())
                .withData("manifest-entries", manifest.size())
                .withData("signing", manifest.isSigningEnabled())
                .build();
    }
}
