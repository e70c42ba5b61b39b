/* (C)2026 */
package com.ammann.calibration.service;

import com.ammann.calibration.dto.EvaluationRequestDTO;
import com.ammann.calibration.enumeration.FusionRole;
import com.ammann.calibration.exception.ValidationException;
import com.ammann.calibration.model.CalibrationContext;
import com.ammann.calibration.model.CalibrationManifestEntry;
import com.ammann.calibration.model.FusionBreakdown;
import com.ammann.calibration.model.FusionDecision;
import com.ammann.calibration.model.FusionWeightSet;
import com.ammann.calibration.model.LayerScoreVector;
import com.ammann.calibration.model.ManifestInputs;
import com.ammann.calibration.model.VetoResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Evaluates one unit end to end.
 *
 * <p>Execution Flow:
 * <ol>
 *   <li>Validate the unit id, role, score vector and veto results. Any failure rejects the
 *       call with the offending field named; nothing is recorded.</li>
 *   <li>Run the veto cascade. A triggered veto replaces fusion.</li>
 *   <li>Otherwise fuse the scores with the role's weight set.</li>
 *   <li>Record the decision in the calibration manifest.</li>
 * </ol>
 *
 * <p>Only the manifest append is serialized; everything before it runs concurrently.
 */
@ApplicationScoped
public class FusionDecisionService {

    private static final Logger LOG = Logger.getLogger(FusionDecisionService.class);

    @Inject CalibrationContext context;

    @Inject ChoquetFusionEvaluator evaluator;

    @Inject VetoCoordinator vetoCoordinator;

    @Inject CalibrationManifestService manifest;

    @Inject MeterRegistry meterRegistry;

    /**
     * Validates a wire request and evaluates it.
     *
     * @throws ValidationException if any field of the request is missing or invalid
     */
    public FusionDecision evaluate(EvaluationRequestDTO request) {
        String unitId;
        FusionRole role;
        LayerScoreVector scores;
        List<VetoResult> vetoes;
        try {
            if (request == null) {
                throw new ValidationException("body", "Request body is required");
            }
            unitId = request.requireUnitId();
            role = request.toRole();
            scores = request.toScoreVector();
            vetoes = request.toVetoResults();
        } catch (ValidationException e) {
            reject(e);
            throw e;
        }
        return decide(unitId, role, scores, vetoes);
    }

    /**
     * Evaluates already-validated inputs.
     *
     * @param unitId identifier recorded in the manifest
     * @param role selects the weight set
     * @param scores layer scores
     * @param vetoes veto results in any order, possibly empty
     * @return the decision together with its manifest entry
     * @throws ValidationException if the loaded calibration has no weight set for {@code role}
     */
    public FusionDecision decide(
            String unitId, FusionRole role, LayerScoreVector scores, List<VetoResult> vetoes) {
        FusionWeightSet weights;
        try {
            weights = context.requireWeightSet(role);
        } catch (ValidationException e) {
            reject(e);
            throw e;
        }

        Optional<VetoResult> veto = vetoCoordinator.executeVetoCascade(vetoes);
        Double score = null;
        FusionBreakdown breakdown = null;
        if (veto.isPresent()) {
            VetoResult applied = veto.get();
            LOG.infof(
                    "Unit %s vetoed by layer %s (specificity %.3f): %s",
                    unitId, applied.layerId().symbol(), applied.specificityScore(), applied.reason());
            count("fusion_vetoes_total", "layer", applied.layerId().symbol());
        } else {
            breakdown = evaluator.explain(scores, weights);
            score = breakdown.total();
            LOG.debugf("Unit %s fused with %s: %.6f", unitId, weights.id(), score);
        }
        count("fusion_evaluations_total", "role", role.name());

        CalibrationManifestEntry entry = manifest.record(new ManifestInputs(
                unitId,
                role,
                weights.id(),
                scores,
                vetoes,
                context.fingerprint(),
                score,
                veto.orElse(null)));
        return new FusionDecision(unitId, role, score, veto.orElse(null), breakdown, entry);
    }

    private void reject(ValidationException e) {
        LOG.debugf("Evaluation rejected on field %s: %s", e.getField(), e.getMessage());
        if (meterRegistry != null) {
            Counter.builder("fusion_rejections_total")
                    .description("Evaluation calls rejected for invalid input")
                    .register(meterRegistry)
                    .increment();
        }
    }

    private void count(String name, String tag, String value) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.counter(name, tag, value).increment();
    }
}
