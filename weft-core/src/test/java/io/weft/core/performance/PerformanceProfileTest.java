package io.weft.core.performance;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.weft.core.tool.ToolDefinition;
import org.junit.jupiter.api.Test;

class PerformanceProfileTest {

    @Test
    void shouldStartEmptyProfileAsFullyReliable() {
        PerformanceProfile profile = PerformanceProfile.empty("x");

        assertThat(profile.successRate()).isEqualTo(1.0);
        assertThat(profile.sampleCount()).isZero();
    }

    @Test
    void shouldNotMutateOnRecord() {
        PerformanceProfile initial = PerformanceProfile.initial(ToolDefinition.simple("x"));

        PerformanceProfile updated = initial.record(10, 0.5, false);

        assertThat(initial.sampleCount()).isZero();
        assertThat(updated.sampleCount()).isEqualTo(1);
        assertThat(updated.successRate()).isZero();
        assertThat(updated.averageCost()).isEqualTo(0.5);
    }

    @Test
    void shouldRejectNegativeSampleCount() {
        assertThatThrownBy(() -> new PerformanceProfile("x", 0, 0, 1, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
