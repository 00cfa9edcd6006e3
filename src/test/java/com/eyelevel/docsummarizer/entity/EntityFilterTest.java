package com.eyelevel.docsummarizer.entity;

import com.eyelevel.docsummarizer.model.EntityType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class EntityFilterTest {

    private final EntityFilter filter = new EntityFilter();

    @ParameterizedTest
    @ValueSource(strings = {"A", " ", "12345", "ABC-DE-1234", "abc-de-1234", "John\nSmith"})
    @DisplayName("Noise is rejected")
    void rejectsNoise(final String text) {
        assertThat(filter.shouldKeep(text, EntityType.PERSON)).isFalse();
    }

    @Test
    @DisplayName("Ordinary names are kept")
    void keepsNames() {
        assertThat(filter.shouldKeep("John Smith", EntityType.PERSON)).isTrue();
        assertThat(filter.shouldKeep("Acme Widgets Inc", EntityType.ORGANIZATION)).isTrue();
    }

    @Test
    @DisplayName("Governorates recognized as people become locations")
    void reclassifiesGovernorates() {
        assertThat(filter.reclassify("Giza Governorate", EntityType.PERSON)).isEqualTo(EntityType.LOCATION);
        assertThat(filter.reclassify("John Smith", EntityType.PERSON)).isEqualTo(EntityType.PERSON);
        assertThat(filter.reclassify("Governorate Bank", EntityType.ORGANIZATION))
                .isEqualTo(EntityType.ORGANIZATION);
    }
}
