package com.specsync.core.report;

import com.specsync.core.model.NextAction;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link StatusSummary}.
 */
class StatusSummaryTest {

    @Test
    void of_withMixedComponents_countsCompletionAndNextActions() {
        StatusSummary summary = StatusSummary.of(ReportFixtures.components());

        assertThat(summary.componentCount()).isEqualTo(2);
        assertThat(summary.completeCount()).isEqualTo(1);
        assertThat(summary.requirementCount()).isEqualTo(3);
        assertThat(summary.satisfiedCount()).isEqualTo(2);
        assertThat(summary.incomplete()).containsExactly("Shop.Orders");
        assertThat(summary.readyForWork()).containsExactly("Shop.Orders");
        assertThat(summary.nextActions())
            .containsEntry(NextAction.COMPLETE, 1)
            .containsEntry(NextAction.IMPLEMENT_CODE, 1);
        assertThat(summary.satisfactionRatio()).isCloseTo(0.667, within(0.001));
    }

    @Test
    void of_withNoComponents_isFullySatisfied() {
        StatusSummary summary = StatusSummary.of(List.of());

        assertThat(summary.componentCount()).isZero();
        assertThat(summary.satisfactionRatio()).isEqualTo(1.0);
    }
}
