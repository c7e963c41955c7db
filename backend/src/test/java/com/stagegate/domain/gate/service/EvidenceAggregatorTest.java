package com.stagegate.domain.gate.service;

import com.stagegate.domain.gate.model.EvidenceItem;
import com.stagegate.domain.gate.model.EvidenceStrength;
import com.stagegate.domain.gate.model.EvidenceSummary;
import com.stagegate.domain.gate.model.EvidenceType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EvidenceAggregatorTest {

    private EvidenceAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new EvidenceAggregator();
    }

    @Nested
    @DisplayName("averageQuality")
    class AverageQuality {

        @Test
        @DisplayName("empty list → 0")
        void empty() {
            assertThat(aggregator.averageQuality(List.of())).isZero();
        }

        @Test
        @DisplayName("null list → 0")
        void nullList() {
            assertThat(aggregator.averageQuality(null)).isZero();
        }

        @Test
        @DisplayName("plain arithmetic mean, contradictions included")
        void meanIncludesContradictions() {
            List<EvidenceItem> items = List.of(
                    EvidenceItem.of(EvidenceType.INTERVIEW, EvidenceStrength.MEDIUM, 0.8),
                    new EvidenceItem(EvidenceType.DESK, EvidenceStrength.WEAK, 0.4, true),
                    EvidenceItem.of(EvidenceType.EXPERIMENT, EvidenceStrength.STRONG, 0.9));

            assertThat(aggregator.averageQuality(items)).isCloseTo(0.7, within(1e-9));
        }

        @Test
        @DisplayName("missing scores count as 0, out-of-range scores are clamped")
        void missingAndOutOfRange() {
            List<EvidenceItem> items = List.of(
                    new EvidenceItem(EvidenceType.DESK, null, null, false),
                    new EvidenceItem(EvidenceType.DESK, null, 1.5, false),
                    new EvidenceItem(EvidenceType.DESK, null, -0.5, false),
                    new EvidenceItem(EvidenceType.DESK, null, Double.NaN, false));

            assertThat(aggregator.averageQuality(items)).isCloseTo(0.25, within(1e-9));
        }

        @Test
        @DisplayName("null items are ignored")
        void nullItems() {
            List<EvidenceItem> items = new ArrayList<>();
            items.add(null);
            items.add(EvidenceItem.of(EvidenceType.DESK, EvidenceStrength.WEAK, 0.6));

            assertThat(aggregator.averageQuality(items)).isCloseTo(0.6, within(1e-9));
        }
    }

    @Nested
    @DisplayName("counts and sets")
    class Counts {

        @Test
        @DisplayName("experimentCount counts only experiment items")
        void experiments() {
            List<EvidenceItem> items = List.of(
                    EvidenceItem.of(EvidenceType.EXPERIMENT, EvidenceStrength.STRONG, 0.9),
                    EvidenceItem.of(EvidenceType.EXPERIMENT, EvidenceStrength.WEAK, 0.3),
                    EvidenceItem.of(EvidenceType.ANALYTICS, EvidenceStrength.MEDIUM, 0.7),
                    new EvidenceItem(null, null, null, false));

            assertThat(aggregator.experimentCount(items)).isEqualTo(2);
        }

        @Test
        @DisplayName("strengthMix always has all three tiers")
        void strengthMixZeroFilled() {
            assertThat(aggregator.strengthMix(List.of()))
                    .containsEntry(EvidenceStrength.WEAK, 0)
                    .containsEntry(EvidenceStrength.MEDIUM, 0)
                    .containsEntry(EvidenceStrength.STRONG, 0)
                    .hasSize(3);
        }

        @Test
        @DisplayName("strengthMix counts per tier and skips missing strength")
        void strengthMixCounts() {
            List<EvidenceItem> items = List.of(
                    EvidenceItem.of(EvidenceType.INTERVIEW, EvidenceStrength.STRONG, 0.9),
                    EvidenceItem.of(EvidenceType.INTERVIEW, EvidenceStrength.STRONG, 0.8),
                    EvidenceItem.of(EvidenceType.DESK, EvidenceStrength.WEAK, 0.4),
                    new EvidenceItem(EvidenceType.DESK, null, 0.5, false));

            assertThat(aggregator.strengthMix(items))
                    .containsEntry(EvidenceStrength.WEAK, 1)
                    .containsEntry(EvidenceStrength.MEDIUM, 0)
                    .containsEntry(EvidenceStrength.STRONG, 2);
        }

        @Test
        @DisplayName("evidenceTypeSet holds distinct present types")
        void types() {
            List<EvidenceItem> items = List.of(
                    EvidenceItem.of(EvidenceType.INTERVIEW, EvidenceStrength.STRONG, 0.9),
                    EvidenceItem.of(EvidenceType.INTERVIEW, EvidenceStrength.WEAK, 0.2),
                    EvidenceItem.of(EvidenceType.ANALYTICS, EvidenceStrength.MEDIUM, 0.7));

            assertThat(aggregator.evidenceTypeSet(items))
                    .containsExactlyInAnyOrder(EvidenceType.INTERVIEW, EvidenceType.ANALYTICS);
        }
    }

    @Test
    @DisplayName("summarize combines every reducer")
    void summarize() {
        List<EvidenceItem> items = List.of(
                EvidenceItem.of(EvidenceType.EXPERIMENT, EvidenceStrength.STRONG, 1.0),
                new EvidenceItem(EvidenceType.INTERVIEW, EvidenceStrength.MEDIUM, 0.5, true));

        EvidenceSummary summary = aggregator.summarize(items);

        assertThat(summary.evidenceCount()).isEqualTo(2);
        assertThat(summary.experimentCount()).isEqualTo(1);
        assertThat(summary.averageQuality()).isCloseTo(0.75, within(1e-9));
        assertThat(summary.strengthCount(EvidenceStrength.STRONG)).isEqualTo(1);
        assertThat(summary.evidenceTypes()).contains(EvidenceType.EXPERIMENT, EvidenceType.INTERVIEW);
        assertThat(summary.contradictionCount()).isEqualTo(1);
    }
}
