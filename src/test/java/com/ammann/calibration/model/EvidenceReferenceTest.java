/* (C)2026 */
package com.ammann.calibration.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.calibration.exception.IncompleteProvenanceException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class EvidenceReferenceTest {

    @ParameterizedTest
    @ValueSource(strings = {
        "src/calibration/unit_layer.json",
        "artifacts/calibration/intrinsic_calibration_2024.json",
        "docs/calibration/base_layer.md"
    })
    void acceptsKnownNamespaces(String locator) {
        assertThat(EvidenceReference.of(locator).locator()).isEqualTo(locator);
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "tmp/notes.txt",
        "/etc/passwd",
        "src/",
        "docs/../secrets.txt",
        "https://example.org/docs/calibration.md",
        "Src/calibration.json"
    })
    void rejectsLocatorsOutsideAcceptedNamespaces(String locator) {
        assertThatThrownBy(() -> EvidenceReference.of(locator))
                .isInstanceOf(IncompleteProvenanceException.class)
                .hasMessageContaining(locator);
    }

    @Test
    void blankContentIdIsTreatedAsAbsent() {
        EvidenceReference reference = new EvidenceReference("docs/a.md", "  ");

        assertThat(reference.contentId()).isNull();
        assertThat(reference.optionalContentId()).isEmpty();
    }

    @Test
    void missingLocatorIsRejected() {
        assertThatThrownBy(() -> new EvidenceReference(null, "sha256:abc"))
                .isInstanceOf(IncompleteProvenanceException.class);
    }
}
