/* (C)2026 */
package com.ammann.calibration.service;

import com.ammann.calibration.enumeration.DriftSeverity;
import com.ammann.calibration.exception.LayerNotFoundException;
import com.ammann.calibration.exception.ValidationException;
import com.ammann.calibration.model.BoundedParameter;
import com.ammann.calibration.model.CalibrationContext;
import com.ammann.calibration.model.CalibrationLayer;
import com.ammann.calibration.model.DriftReport;
import com.ammann.calibration.model.ParameterDrift;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Compares two versions of a calibration layer parameter by parameter.
 *
 * <p>The drift ratio is {@code |new - old| / |old|}; when {@code |old|} is below
 * {@value #NEAR_ZERO} the absolute difference is used instead. Severity thresholds are
 * defined by {@link DriftSeverity}. A report is flagged as dispersed when at least
 * {@value #DISPERSION_THRESHOLD} of the changed parameters drifted SIGNIFICANT or worse.
 */
@ApplicationScoped
public class DriftDetectionService {

    private static final Logger LOG = Logger.getLogger(DriftDetectionService.class);

    static final double NEAR_ZERO = 1e-6;
    static final double DISPERSION_THRESHOLD = 0.40;

    /**
     * Drift between two versions of a layer held by the calibration context.
     *
     * @param fromVersion older version; defaults to the predecessor of {@code toVersion}
     * @param toVersion newer version; defaults to the current version
     * @throws LayerNotFoundException if the layer or a named version does not exist
     * @throws ValidationException if no earlier version exists to compare against
     */
    public DriftReport detect(CalibrationContext context, String layerId, String fromVersion, String toVersion) {
        List<CalibrationLayer> history = context.layerHistory(layerId);
        if (history.isEmpty()) {
            throw new LayerNotFoundException(layerId);
        }

        CalibrationLayer current = isBlank(toVersion)
                ? history.get(history.size() - 1)
                : context.layerVersion(layerId, toVersion)
                        .orElseThrow(() -> new LayerNotFoundException(layerId, toVersion));

        CalibrationLayer baseline;
        if (isBlank(fromVersion)) {
            int index = history.indexOf(current);
            if (index < 1) {
                throw ValidationException.invalidParameter(
                        "from", fromVersion, "a version older than " + current.version() + " of layer " + layerId);
            }
            baseline = history.get(index - 1);
        } else {
            baseline = context.layerVersion(layerId, fromVersion)
                    .orElseThrow(() -> new LayerNotFoundException(layerId, fromVersion));
        }
        return compare(baseline, current);
    }

    /**
     * Compares {@code baseline} against {@code current}.
     *
     * @throws ValidationException if the two layers have different ids
     */
    public DriftReport compare(CalibrationLayer baseline, CalibrationLayer current) {
        if (!baseline.layerId().equals(current.layerId())) {
            throw ValidationException.invalidParameter(
                    "layer_id", current.layerId(), "the same layer as the baseline " + baseline.layerId());
        }

        List<ParameterDrift> drifts = new ArrayList<>();
        List<String> removed = new ArrayList<>();
        for (Map.Entry<String, BoundedParameter> entry : baseline.parameters().entrySet()) {
            BoundedParameter next = current.parameters().get(entry.getKey());
            if (next == null) {
                removed.add(entry.getKey());
                continue;
            }
            double previousValue = entry.getValue().value();
            double ratio = driftRatio(previousValue, next.value());
            DriftSeverity severity = DriftSeverity.fromRatio(ratio);
            if (severity != DriftSeverity.NONE) {
                drifts.add(new ParameterDrift(entry.getKey(), previousValue, next.value(), ratio, severity));
            }
        }
        List<String> added = current.parameters().keySet().stream()
                .filter(name -> !baseline.parameters().containsKey(name))
                .toList();

        DriftSeverity overall = drifts.stream()
                .map(ParameterDrift::severity)
                .max(Comparator.naturalOrder())
                .orElse(DriftSeverity.NONE);
        boolean dispersed = isDispersed(drifts);

        DriftReport report = new DriftReport(
                current.layerId(),
                baseline.version(),
                current.version(),
                drifts,
                added,
                removed,
                overall,
                dispersed,
                recommendations(drifts, added, removed, dispersed));

        LOG.infof(
                "Drift %s %s -> %s: severity=%s, changed=%d, added=%d, removed=%d",
                current.layerId(), baseline.version(), current.version(),
                overall, drifts.size(), added.size(), removed.size());
        return report;
    }

    static double driftRatio(double previousValue, double currentValue) {
        double delta = Math.abs(currentValue - previousValue);
        if (Math.abs(previousValue) < NEAR_ZERO) {
            return delta;
        }
        return delta / Math.abs(previousValue);
    }

    private static boolean isDispersed(List<ParameterDrift> drifts) {
        if (drifts.isEmpty()) {
            return false;
        }
        long significant = drifts.stream().filter(d -> d.severity().isSignificant()).count();
        return (double) significant / drifts.size() >= DISPERSION_THRESHOLD;
    }

    private static List<String> recommendations(
            List<ParameterDrift> drifts, List<String> added, List<String> removed, boolean dispersed) {
        List<String> recommendations = new ArrayList<>();
        if (dispersed) {
            recommendations.add(
                    "High parameter dispersion detected. Review calibration stability and consider recalibration.");
        }
        for (ParameterDrift drift : drifts) {
            if (drift.severity() == DriftSeverity.CRITICAL) {
                recommendations.add(String.format(
                        Locale.ROOT,
                        "CRITICAL: %s drifted %.1f%%. Immediate recalibration required.",
                        drift.name(), drift.driftRatio() * 100));
            }
        }
        if (!removed.isEmpty()) {
            recommendations.add("Parameters removed: " + removed + ". Confirm no consumer still reads them.");
        }
        if (!added.isEmpty()) {
            recommendations.add("Parameters added: " + added + ". Confirm each carries evidence in the rationale.");
        }
        if (recommendations.isEmpty()) {
            recommendations.add("No significant issues detected. Calibration stable.");
        }
        return recommendations;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
