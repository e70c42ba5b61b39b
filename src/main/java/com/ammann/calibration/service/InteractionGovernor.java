/* (C)2026 */
package com.ammann.calibration.service;

import com.ammann.calibration.exception.CyclicDependencyException;
import com.ammann.calibration.exception.InteractionDensityException;
import com.ammann.calibration.exception.LevelInversionException;
import com.ammann.calibration.exception.ValidationException;
import com.ammann.calibration.model.ClampResult;
import com.ammann.calibration.model.DependencyGraph;
import com.ammann.calibration.model.FusionWeightSet;
import com.ammann.calibration.model.LevelInversion;
import com.ammann.calibration.model.MultiplicativeBounds;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Structural gatekeeper for the calibration.
 *
 * <p>Runs once at load time, never per evaluation:
 * <ul>
 *   <li>{@link #validate(DependencyGraph)} rejects cyclic graphs and level inversions and
 *       returns the topological order of the accepted graph</li>
 *   <li>{@link #certify(FusionWeightSet)} caps the share of interaction weights per role</li>
 * </ul>
 *
 * <p>It also certifies multiplicative combinations on request through
 * {@link #boundedProduct}, which clamps into a closed positive interval and logs every
 * clamp. This is the only class that raises {@link CyclicDependencyException} and
 * {@link LevelInversionException}.
 */
@ApplicationScoped
public class InteractionGovernor {

    private static final Logger LOG = Logger.getLogger(InteractionGovernor.class);

    static final double DEFAULT_MAX_INTERACTION_SHARE = 0.5;

    @ConfigProperty(name = "calibration.governor.min-product", defaultValue = "0.01")
    double minProduct = MultiplicativeBounds.DEFAULT.min();

    @ConfigProperty(name = "calibration.governor.max-product", defaultValue = "10.0")
    double maxProduct = MultiplicativeBounds.DEFAULT.max();

    @ConfigProperty(name = "calibration.governor.max-interaction-share", defaultValue = "0.5")
    double maxInteractionShare = DEFAULT_MAX_INTERACTION_SHARE;

    @Inject MeterRegistry meterRegistry;

    private final CycleDetector cycleDetector = new CycleDetector();
    private final LevelInversionDetector inversionDetector = new LevelInversionDetector();

    private Counter clampCounter;

    @PostConstruct
    void initMetrics() {
        if (meterRegistry == null) {
            LOG.warn("MeterRegistry not available - governor metrics disabled");
            return;
        }
        clampCounter =
                Counter.builder("governor_product_clamps_total")
                        .description("Multiplicative combinations clamped into the product bounds")
                        .register(meterRegistry);
    }

    /**
     * Validates the dependency graph.
     *
     * @param graph graph to check
     * @return topological order of the node ids
     * @throws CyclicDependencyException if the graph has a cycle (self-loops included)
     * @throws LevelInversionException if a primary edge flows from a higher tier to a lower one
     */
    public List<String> validate(DependencyGraph graph) {
        CycleDetector.Result sorted = cycleDetector.detect(graph);
        if (!sorted.acyclic()) {
            LOG.errorf("Dependency graph rejected, cycle: %s", String.join(" -> ", sorted.cycle()));
            throw new CyclicDependencyException(sorted.cycle());
        }

        List<LevelInversion> inversions = inversionDetector.detect(graph);
        if (!inversions.isEmpty()) {
            LOG.errorf("Dependency graph rejected, %d level inversion(s)", inversions.size());
            throw new LevelInversionException(inversions);
        }

        LOG.infof(
                "Dependency graph accepted: %d nodes, %d edges, order %s",
                graph.size(), graph.edges().size(), sorted.order());
        return sorted.order();
    }

    /**
     * Rejects a weight set whose interaction weights exceed the configured share of the
     * total capacity.
     *
     * @throws InteractionDensityException if the cap is exceeded
     */
    public void certify(FusionWeightSet weights) {
        double share = weights.interactionSum();
        if (share > maxInteractionShare + FusionWeightSet.TOLERANCE) {
            throw new InteractionDensityException(weights.role().name(), share, maxInteractionShare);
        }
        LOG.debugf(
                "Weight set %s certified: linear %.6f, interaction %.6f over %d pairs",
                weights.id(), weights.linearSum(), share, weights.interactions().size());
    }

    /** Product bounds from configuration. */
    public MultiplicativeBounds configuredBounds() {
        return new MultiplicativeBounds(minProduct, maxProduct);
    }

    /**
     * Multiplies the factors and clamps the product into the configured bounds.
     */
    public ClampResult boundedProduct(double... factors) {
        return boundedProduct(configuredBounds(), factors);
    }

    /**
     * Multiplies the factors and clamps the product into {@code bounds}. Clamping is
     * reported in the result and logged; it never throws.
     *
     * @param bounds closed positive interval
     * @param factors finite, non-negative factors
     * @return raw and clamped product
     * @throws ValidationException if no factor is given or a factor is negative or not finite
     */
    public ClampResult boundedProduct(MultiplicativeBounds bounds, double... factors) {
        if (factors == null || factors.length == 0) {
            throw ValidationException.missingField("factors");
        }
        double product = 1.0;
        for (int i = 0; i < factors.length; i++) {
            double factor = factors[i];
            if (!Double.isFinite(factor) || factor < 0.0) {
                throw ValidationException.invalidParameter(
                        "factors[" + i + "]", factor, "a finite value >= 0");
            }
            product *= factor;
        }

        double clampedValue = Math.max(bounds.min(), Math.min(bounds.max(), product));
        boolean clamped = clampedValue != product;
        if (clamped) {
            LOG.warnf(
                    "Multiplicative product clamped: raw=%s clamped=%s bounds=[%s, %s]",
                    product, clampedValue, bounds.min(), bounds.max());
            if (clampCounter != null) {
                clampCounter.increment();
            }
        }
        return new ClampResult(product, clampedValue, clamped, bounds.min(), bounds.max());
    }
}
