/* (C)2026 */
package com.ammann.calibration.service;

import com.ammann.calibration.model.VetoResult;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Applies layer veto results as a specificity-ordered cascade.
 *
 * <p>Ordering happens here, never at the caller: results are sorted by
 * {@link VetoResult#CASCADE_ORDER}, specificity descending with ties broken by the fixed
 * layer priority, and the first triggered result wins. That order is total, so the
 * selected veto depends only on the set of results, not on the order they were
 * produced in, even when one layer reports twice.
 */
@ApplicationScoped
public class VetoCoordinator {

    /**
     * Selects the veto that overrides fusion for a unit, if any.
     *
     * @param results veto results for one unit, in any order
     * @return the highest-ranked triggered result, or empty when none triggered
     */
    public Optional<VetoResult> executeVetoCascade(List<VetoResult> results) {
        if (results == null || results.isEmpty()) {
            return Optional.empty();
        }
        return order(results).stream().filter(VetoResult::triggered).findFirst();
    }

    /**
     * Returns a copy of {@code results} in cascade order.
     */
    public List<VetoResult> order(List<VetoResult> results) {
        List<VetoResult> sorted = new ArrayList<>(results);
        sorted.sort(VetoResult.CASCADE_ORDER);
        return sorted;
    }
}
