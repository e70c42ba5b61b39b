/* (C)2026 */
package com.ammann.calibration.exception;

import com.ammann.calibration.model.LevelInversion;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One or more primary dependency edges feed a higher-tier value into a lower-tier
 * computation.
 */
public class LevelInversionException extends CalibrationException {

    private final List<LevelInversion> inversions;

    public LevelInversionException(List<LevelInversion> inversions) {
        super("Level inversion detected on edge(s): "
                + inversions.stream().map(LevelInversion::describe).collect(Collectors.joining(", ")));
        this.inversions = List.copyOf(inversions);
    }

    public List<LevelInversion> getInversions() {
        return inversions;
    }
}
