package com.eyelevel.docsummarizer.entity;

import com.eyelevel.docsummarizer.model.Entity;
import com.eyelevel.docsummarizer.model.EntityType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class EntityExtractorTest {

    private static final String CONTRACT = """
            Service Agreement
            This agreement was signed on January 22, 2013 by Mr. John Smith on behalf of Acme Widgets Inc and
            renewed on 2024-01-15. The annual fee is $1,250.00 with a late penalty of 5%.
            Payment is due 12/25/2023 at the offices in Austin, Texas for the Giza Governorate branch.
            """;

    @Nested
    @DisplayName("with the pattern recognizer")
    class WithPatternRecognizer {

        private final EntityExtractor extractor =
                new EntityExtractor(new PatternNamedEntityRecognizer(), new EntityFilter());

        @Test
        @DisplayName("Finds every entity category in a contract")
        void extractsAllCategories() {
            // when
            final EntityExtractionResult result = extractor.extract(CONTRACT, Set.of());

            // then
            assertThat(result.dates()).extracting(Entity::text)
                                      .containsExactlyInAnyOrder("January 22, 2013", "2024-01-15", "12/25/2023");
            assertThat(result.dates()).extracting(Entity::value)
                                      .containsExactlyInAnyOrder("2013-01-22", "2024-01-15", "2023-12-25");
            assertThat(result.money()).extracting(Entity::value).containsExactly(1250.0, 5.0);
            assertThat(result.people()).extracting(Entity::text).containsExactly("John Smith");
            assertThat(result.organizations()).extracting(Entity::text).containsExactly("Acme Widgets Inc");
            assertThat(result.locations()).extracting(Entity::text)
                                          .containsExactlyInAnyOrder("Austin, Texas", "Giza Governorate");
        }

        @Test
        @DisplayName("Confidence depends on how the entity was found")
        void confidenceByCategory() {
            final EntityExtractionResult result = extractor.extract(CONTRACT, Set.of());

            assertThat(result.dates()).allSatisfy(entity -> assertThat(entity.confidence()).isEqualTo(0.9));
            assertThat(result.money()).allSatisfy(entity -> assertThat(entity.confidence()).isEqualTo(0.95));
            assertThat(result.people()).allSatisfy(entity -> assertThat(entity.confidence()).isEqualTo(0.85));
        }

        @Test
        @DisplayName("Only the requested types are returned")
        void requestedTypesOnly() {
            final EntityExtractionResult result = extractor.extract(CONTRACT, Set.of(EntityType.MONEY));

            assertThat(result.entities()).isNotEmpty()
                                         .allSatisfy(entity -> assertThat(entity.type()).isEqualTo(EntityType.MONEY));
        }

        @Test
        @DisplayName("Blank text yields no entities")
        void blankText() {
            assertThat(extractor.extract("   ", Set.of()).entities()).isEmpty();
            assertThat(extractor.extract(null, Set.of()).entities()).isEmpty();
        }

        @Test
        @DisplayName("Repeated mentions are reported once")
        void duplicatesCollapse() {
            final EntityExtractionResult result = extractor.extract("Paid $40.00 today and $40.00 tomorrow.",
                                                                    Set.of(EntityType.MONEY));

            assertThat(result.money()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("with a stubbed recognizer")
    @ExtendWith(MockitoExtension.class)
    class WithStubbedRecognizer {

        @Mock
        private NamedEntityRecognizer recognizer;

        @Test
        @DisplayName("Recognizer noise is filtered and the most confident duplicate wins")
        void filtersAndDeduplicates() {
            // given
            when(recognizer.recognize(anyString(), any())).thenReturn(List.of(
                    new Entity(EntityType.ORGANIZATION, "ABC-DE-1234", null, 0.99),
                    new Entity(EntityType.PERSON, "X", null, 0.99),
                    new Entity(EntityType.PERSON, "Jane Doe", null, 0.6),
                    new Entity(EntityType.PERSON, "Jane Doe", null, 0.8),
                    new Entity(EntityType.PERSON, "Cairo Governorate", null, 0.7)));
            final EntityExtractor extractor = new EntityExtractor(recognizer, new EntityFilter());

            // when
            final EntityExtractionResult result = extractor.extract("irrelevant text", Set.of());

            // then
            assertThat(result.people()).singleElement()
                                       .satisfies(entity -> assertThat(entity.confidence()).isEqualTo(0.8));
            assertThat(result.locations()).extracting(Entity::text).containsExactly("Cairo Governorate");
            assertThat(result.organizations()).isEmpty();
        }

        @Test
        @DisplayName("A reclassified entity of an unrequested type is dropped")
        void reclassifiedOutsideRequest() {
            when(recognizer.recognize(anyString(), any())).thenReturn(List.of(
                    new Entity(EntityType.PERSON, "Cairo Governorate", null, 0.7)));
            final EntityExtractor extractor = new EntityExtractor(recognizer, new EntityFilter());

            final EntityExtractionResult result = extractor.extract("irrelevant text", Set.of(EntityType.PERSON));

            assertThat(result.entities()).isEmpty();
        }

        @Test
        @DisplayName("The recognizer is not consulted for dates and money only")
        void recognizerSkipped() {
            final EntityExtractor extractor = new EntityExtractor(recognizer, new EntityFilter());

            extractor.extract("On 2024-01-15 we paid $5.", Set.of(EntityType.DATE, EntityType.MONEY));

            verifyNoInteractions(recognizer);
        }
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "Jan 5, 2024        | 2024-01-05",
            "March 3rd, 2021    | 2021-03-03",
            "12/25/2023         | 2023-12-25",
            "25-12-2023         | 2023-12-25",
            "2024-02-29         | 2024-02-29"
    })
    @DisplayName("Dates are normalized to ISO-8601")
    void parseDate(final String raw, final String expected) {
        assertThat(EntityExtractor.parseDate(raw)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Unparseable dates keep no normalized value")
    void unparseableDate() {
        assertThat(EntityExtractor.parseDate("13/45/99")).isNull();
    }

    @Test
    @DisplayName("Amounts drop currency symbols and separators")
    void parseAmount() {
        assertThat(EntityExtractor.parseAmount("$1,250.00")).isEqualTo(1250.0);
        assertThat(EntityExtractor.parseAmount("12.5%")).isEqualTo(12.5);
    }
}
