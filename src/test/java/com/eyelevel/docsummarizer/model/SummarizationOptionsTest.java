package com.eyelevel.docsummarizer.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SummarizationOptionsTest {

    @ParameterizedTest
    @CsvSource({"brief, BRIEF", "Detailed, DETAILED", "bullets, BULLET_POINTS", "bullet_points, BULLET_POINTS"})
    @DisplayName("Summary modes parse from wire values and constant names")
    void summaryModes(final String raw, final SummaryMode expected) {
        assertThat(SummaryMode.fromValue(raw)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({"openai, OPENAI", "hf, HUGGINGFACE", "HUGGINGFACE, HUGGINGFACE", " local , LOCAL"})
    @DisplayName("Backends parse from wire values and constant names")
    void backends(final String raw, final LlmBackend expected) {
        assertThat(LlmBackend.fromValue(raw)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Unknown values are rejected with the offending text")
    void unknownValues() {
        assertThatThrownBy(() -> SummaryMode.fromValue("verbose"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown summary mode: verbose");
        assertThatThrownBy(() -> LlmBackend.fromValue("gpt"))
                .hasMessage("Unknown LLM backend: gpt");
        assertThatThrownBy(() -> EntityType.fromValue("email"))
                .hasMessage("Unknown entity type: email");
    }

    @Test
    void entityTypesUseLowerCaseWireValues() {
        assertThat(EntityType.fromValue("organization")).isEqualTo(EntityType.ORGANIZATION);
        assertThat(EntityType.MONEY.getValue()).isEqualTo("money");
    }
}
