package com.eyelevel.docsummarizer.entity;

import com.eyelevel.docsummarizer.model.Entity;
import com.eyelevel.docsummarizer.model.EntityType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds dates and monetary amounts with regular expressions and delegates people, organizations and
 * locations to a {@link NamedEntityRecognizer}. Results are de-duplicated on (type, text), keeping
 * the most confident candidate.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EntityExtractor {

    static final double DATE_CONFIDENCE = 0.9;
    static final double MONEY_CONFIDENCE = 0.95;

    private static final Set<EntityType> NAMED_TYPES =
            EnumSet.of(EntityType.PERSON, EntityType.ORGANIZATION, EntityType.LOCATION);

    private static final List<Pattern> DATE_PATTERNS = List.of(
            Pattern.compile("\\b(?:Jan(?:uary)?|Feb(?:ruary)?|Mar(?:ch)?|Apr(?:il)?|May|Jun(?:e)?|Jul(?:y)?"
                            + "|Aug(?:ust)?|Sep(?:tember)?|Oct(?:ober)?|Nov(?:ember)?|Dec(?:ember)?)"
                            + "\\s+\\d{1,2}(?:st|nd|rd|th)?,?\\s+\\d{4}\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b\\d{1,2}[-/]\\d{1,2}[-/]\\d{2,4}\\b"),
            Pattern.compile("\\b\\d{4}-\\d{2}-\\d{2}\\b"));

    private static final List<Pattern> MONEY_PATTERNS = List.of(
            Pattern.compile("\\$\\s*\\d{1,3}(?:,\\d{3})*(?:\\.\\d{2})?"),
            Pattern.compile("\\b\\d+(?:\\.\\d+)?%"));

    private static final Pattern ORDINAL_SUFFIX = Pattern.compile("(\\d)(?:st|nd|rd|th)\\b",
                                                                  Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            formatter("MMM d yyyy"),
            formatter("MMMM d yyyy"),
            formatter("M/d/yyyy"),
            formatter("d-M-yyyy"),
            formatter("yyyy-MM-dd"));

    private final NamedEntityRecognizer namedEntityRecognizer;
    private final EntityFilter entityFilter;

    /**
     * @param text  The document text.
     * @param types The types to extract; empty means all.
     * @return The de-duplicated entities in discovery order.
     */
    public EntityExtractionResult extract(final String text, final Set<EntityType> types) {
        if (text == null || text.isBlank()) {
            return new EntityExtractionResult(List.of());
        }
        final Set<EntityType> wanted = types == null || types.isEmpty()
                ? EnumSet.allOf(EntityType.class)
                : EnumSet.copyOf(types);

        final List<Entity> candidates = new ArrayList<>();
        if (wanted.contains(EntityType.DATE)) {
            candidates.addAll(extractDates(text));
        }
        if (wanted.contains(EntityType.MONEY)) {
            candidates.addAll(extractMoney(text));
        }
        final Set<EntityType> namedTypes = EnumSet.copyOf(NAMED_TYPES);
        namedTypes.retainAll(wanted);
        if (!namedTypes.isEmpty()) {
            for (final Entity candidate : namedEntityRecognizer.recognize(text, namedTypes)) {
                if (!entityFilter.shouldKeep(candidate.text(), candidate.type())) {
                    continue;
                }
                final EntityType finalType = entityFilter.reclassify(candidate.text(), candidate.type());
                if (wanted.contains(finalType)) {
                    candidates.add(new Entity(finalType, candidate.text(), candidate.value(), candidate.confidence()));
                }
            }
        }

        final List<Entity> entities = deduplicate(candidates);
        log.info("Extracted {} entities from {} characters of text.", entities.size(), text.length());
        return new EntityExtractionResult(entities);
    }

    private List<Entity> extractDates(final String text) {
        final List<Entity> dates = new ArrayList<>();
        for (final String match : matches(DATE_PATTERNS, text)) {
            dates.add(new Entity(EntityType.DATE, match, parseDate(match), DATE_CONFIDENCE));
        }
        return dates;
    }

    private List<Entity> extractMoney(final String text) {
        final List<Entity> amounts = new ArrayList<>();
        for (final String match : matches(MONEY_PATTERNS, text)) {
            amounts.add(new Entity(EntityType.MONEY, match, parseAmount(match), MONEY_CONFIDENCE));
        }
        return amounts;
    }

    private static Set<String> matches(final List<Pattern> patterns, final String text) {
        final Set<String> found = new LinkedHashSet<>();
        for (final Pattern pattern : patterns) {
            final Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                found.add(matcher.group());
            }
        }
        return found;
    }

    /**
     * @return The ISO-8601 date, or {@code null} when none of the known layouts fit.
     */
    static String parseDate(final String raw) {
        String normalized = raw.replace(",", "");
        normalized = ORDINAL_SUFFIX.matcher(normalized).replaceAll("$1");
        normalized = WHITESPACE.matcher(normalized.trim()).replaceAll(" ");
        for (final DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(normalized, format).toString();
            } catch (DateTimeParseException e) {
                log.trace("Date '{}' does not match layout {}", raw, format);
            }
        }
        return null;
    }

    static Double parseAmount(final String raw) {
        final String cleaned = raw.replace("$", "").replace(",", "").replace("%", "").strip();
        try {
            return Double.valueOf(cleaned);
        } catch (NumberFormatException e) {
            log.debug("Amount '{}' is not numeric", raw);
            return null;
        }
    }

    private static List<Entity> deduplicate(final List<Entity> candidates) {
        final Map<String, Entity> best = new LinkedHashMap<>();
        for (final Entity candidate : candidates) {
            best.merge(candidate.type() + "|" + candidate.text(), candidate,
                       (kept, other) -> other.confidence() > kept.confidence() ? other : kept);
        }
        return List.copyOf(best.values());
    }

    private static DateTimeFormatter formatter(final String pattern) {
        return new DateTimeFormatterBuilder().parseCaseInsensitive()
                                             .appendPattern(pattern)
                                             .toFormatter(Locale.ENGLISH);
    }
}
