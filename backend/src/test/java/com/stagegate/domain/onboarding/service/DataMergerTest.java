package com.stagegate.domain.onboarding.service;

import com.stagegate.domain.onboarding.model.ExtractedValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DataMergerTest {

    private DataMerger merger;

    @BeforeEach
    void setUp() {
        merger = new DataMerger();
    }

    @Nested
    @DisplayName("certainty rules")
    class Certainty {

        @Test
        @DisplayName("certain value is not replaced by an uncertain one")
        void certainKept() {
            Map<String, Object> merged = merger.mergeRaw(
                    Map.of("practice_name", "Confirmed"),
                    Map.of("practice_name", "uncertain: maybe"));

            assertThat(merged).containsExactly(Map.entry("practice_name", "Confirmed"));
        }

        @Test
        @DisplayName("uncertain value is replaced by a certain one")
        void uncertainReplaced() {
            Map<String, Object> merged = merger.mergeRaw(
                    Map.of("practice_name", "uncertain: old"),
                    Map.of("practice_name", "New"));

            assertThat(merged).containsExactly(Map.entry("practice_name", "New"));
        }

        @Test
        @DisplayName("uncertain replaces uncertain, certain replaces certain")
        void sameCertainty() {
            Map<String, ExtractedValue> merged = merger.merge(
                    Map.of("a", ExtractedValue.uncertain("old"), "b", ExtractedValue.certain("old")),
                    Map.of("a", ExtractedValue.uncertain("new"), "b", ExtractedValue.certain("new")));

            assertThat(merged.get("a")).isEqualTo(ExtractedValue.uncertain("new"));
            assertThat(merged.get("b")).isEqualTo(ExtractedValue.certain("new"));
        }

        @Test
        @DisplayName("non-string values are certain and overwrite")
        void nonString() {
            Map<String, Object> merged = merger.mergeRaw(
                    Map.of("team_size", "uncertain: a few"),
                    Map.of("team_size", 4, "target_industries", List.of("fintech", "health")));

            assertThat(merged)
                    .containsEntry("team_size", 4)
                    .containsEntry("target_industries", List.of("fintech", "health"));
        }
    }

    @Nested
    @DisplayName("skipping")
    class Skipping {

        @Test
        @DisplayName("null and empty incoming values leave existing data alone")
        void nullAndEmpty() {
            Map<String, Object> incoming = new HashMap<>();
            incoming.put("goals", null);
            incoming.put("frustrations", "");

            Map<String, Object> merged = merger.mergeRaw(
                    Map.of("goals", "Grow", "frustrations", "Admin work"), incoming);

            assertThat(merged)
                    .containsEntry("goals", "Grow")
                    .containsEntry("frustrations", "Admin work");
        }

        @Test
        @DisplayName("keys missing from incoming are kept")
        void untouchedKeys() {
            Map<String, Object> merged = merger.mergeRaw(Map.of("goals", "Grow"), Map.of("time_sinks", "Invoicing"));

            assertThat(merged).containsEntry("goals", "Grow").containsEntry("time_sinks", "Invoicing");
        }

        @Test
        @DisplayName("null maps are tolerated")
        void nullMaps() {
            assertThat(merger.merge(null, null)).isEmpty();
            assertThat(merger.mergeRaw(Map.of("goals", "Grow"), null)).containsEntry("goals", "Grow");
        }
    }

    @Test
    @DisplayName("existing map is never mutated")
    void noMutation() {
        Map<String, ExtractedValue> existing = new LinkedHashMap<>();
        existing.put("practice_name", ExtractedValue.uncertain("old"));
        Map<String, ExtractedValue> snapshot = new LinkedHashMap<>(existing);

        Map<String, ExtractedValue> merged = merger.merge(existing, Map.of("practice_name", ExtractedValue.certain("New")));

        assertThat(existing).isEqualTo(snapshot);
        assertThat(merged).isNotSameAs(existing);
        assertThat(merged.get("practice_name")).isEqualTo(ExtractedValue.certain("New"));
    }
}
