/* (C)2026 */
package com.ammann.calibration.exception;

import java.util.List;

/**
 * The dependency graph contains a cycle. The cycle is reported as a closed path whose
 * first and last elements are the same node.
 */
public class CyclicDependencyException extends CalibrationException {

    private final List<String> cycle;

    public CyclicDependencyException(List<String> cycle) {
        super("Dependency graph contains a cycle: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }
}
