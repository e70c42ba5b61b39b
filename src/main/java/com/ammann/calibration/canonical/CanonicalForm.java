/* (C)2026 */
package com.ammann.calibration.canonical;

import java.util.Map;

/**
 * Implemented by calibration types that take part in deterministic hashing.
 *
 * <p>The returned map is a logical view of the instance. Key order is irrelevant:
 * {@link CanonicalJson} sorts keys before serializing.
 */
public interface CanonicalForm {

    Map<String, Object> canonicalForm();
}
