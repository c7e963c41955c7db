package com.stagegate.domain.onboarding.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExtractedValueTest {

    @Test
    @DisplayName("prefixed string → uncertain without the prefix")
    void uncertainPrefix() {
        ExtractedValue value = ExtractedValue.fromRaw("uncertain: maybe 5 people");

        assertThat(value.isUncertain()).isTrue();
        assertThat(value.value()).isEqualTo("maybe 5 people");
        assertThat(value.toRaw()).isEqualTo("uncertain: maybe 5 people");
    }

    @Test
    @DisplayName("plain string and non-string values are certain")
    void certain() {
        assertThat(ExtractedValue.fromRaw("Acme Advisory").isUncertain()).isFalse();
        assertThat(ExtractedValue.fromRaw(12).isUncertain()).isFalse();
        assertThat(ExtractedValue.fromRaw(12).toRaw()).isEqualTo(12);
    }

    @Test
    @DisplayName("prefix without the trailing space is plain text")
    void prefixNeedsSpace() {
        assertThat(ExtractedValue.fromRaw("uncertain:maybe").isUncertain()).isFalse();
    }

    @Test
    @DisplayName("null stays null, tagged values pass through")
    void nullAndTagged() {
        ExtractedValue tagged = ExtractedValue.certain("x");

        assertThat(ExtractedValue.fromRaw(null)).isNull();
        assertThat(ExtractedValue.fromRaw(tagged)).isSameAs(tagged);
    }

    @Test
    @DisplayName("only a certain empty string is empty")
    void empty() {
        assertThat(ExtractedValue.certain("").isEmpty()).isTrue();
        assertThat(ExtractedValue.uncertain("").isEmpty()).isFalse();
        assertThat(ExtractedValue.certain(0).isEmpty()).isFalse();
    }
}
