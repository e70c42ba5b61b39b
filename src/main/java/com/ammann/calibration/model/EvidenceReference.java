/* (C)2026 */
package com.ammann.calibration.model;

import com.ammann.calibration.canonical.CanonicalForm;
import com.ammann.calibration.exception.IncompleteProvenanceException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Provenance record tying a calibrated number to a reviewable source.
 *
 * @param locator repository-relative path under one of {@link #ACCEPTED_PREFIXES}
 * @param contentId optional content identifier (for example a digest of the file), may be null
 */
public record EvidenceReference(String locator, String contentId) implements CanonicalForm {

    /** Source code, artifact and documentation namespaces. */
    public static final List<String> ACCEPTED_PREFIXES = List.of("src/", "artifacts/", "docs/");

    public EvidenceReference {
        if (locator == null || locator.isBlank()) {
            throw new IncompleteProvenanceException("Evidence reference requires a locator");
        }
        if (!isAcceptedLocator(locator)) {
            throw new IncompleteProvenanceException(String.format(
                    "Evidence locator '%s' must start with one of %s and stay inside it",
                    locator, ACCEPTED_PREFIXES));
        }
        if (contentId != null && contentId.isBlank()) {
            contentId = null;
        }
    }

    public static EvidenceReference of(String locator) {
        return new EvidenceReference(locator, null);
    }

    public static boolean isAcceptedLocator(String locator) {
        return locator != null
                && !locator.contains("..")
                && ACCEPTED_PREFIXES.stream()
                        .anyMatch(p -> locator.startsWith(p) && locator.length() > p.length());
    }

    public Optional<String> optionalContentId() {
        return Optional.ofNullable(contentId);
    }

    @Override
    public Map<String, Object> canonicalForm() {
        Map<String, Object> form = new LinkedHashMap<>();
        form.put("locator", locator);
        form.put("content_id", contentId);
        return form;
    }
}
