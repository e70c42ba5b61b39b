/* (C)2026 */
package com.ammann.calibration.enumeration;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import org.junit.jupiter.api.Test;

class LayerIdTest {

    @Test
    void resolvesEverySymbol() {
        for (LayerId layer : LayerId.values()) {
            assertThat(LayerId.fromSymbol(layer.symbol())).contains(layer);
        }
    }

    @Test
    void symbolMatchingIsCaseSensitive() {
        assertThat(LayerId.fromSymbol("@C")).contains(LayerId.CONGRUENCE);
        assertThat(LayerId.fromSymbol("@c")).isEmpty();
        assertThat(LayerId.fromSymbol("chain")).isEmpty();
        assertThat(LayerId.fromSymbol(null)).isEmpty();
    }

    @Test
    void priorityFollowsDeclarationOrder() {
        assertThat(Arrays.stream(LayerId.values()).map(LayerId::symbol))
                .containsExactly("@b", "@chain", "@u", "@q", "@d", "@p", "@C", "@m");
        assertThat(LayerId.BASE.priority()).isLessThan(LayerId.CHAIN.priority());
        assertThat(LayerId.META.priority()).isEqualTo(7);
    }
}
