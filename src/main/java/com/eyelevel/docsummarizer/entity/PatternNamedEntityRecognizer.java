package com.eyelevel.docsummarizer.entity;

import com.eyelevel.docsummarizer.model.Entity;
import com.eyelevel.docsummarizer.model.EntityType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based recognizer driven by surface cues: honorifics for people, corporate suffixes for
 * organizations and "City, Region" phrases after a locative preposition for locations.
 */
@Slf4j
@Component
public class PatternNamedEntityRecognizer implements NamedEntityRecognizer {

    static final double CONFIDENCE = 0.85;

    private static final String NAME_WORD = "[A-Z][a-z]+(?:-[A-Z][a-z]+)?";

    private static final Pattern PERSON = Pattern.compile(
            "\\b(?:Mr|Mrs|Ms|Miss|Dr|Prof)\\.?[ \\t]+(" + NAME_WORD + "(?:[ \\t]+[A-Z]\\.)?(?:[ \\t]+" + NAME_WORD
            + "){0,2})");

    private static final Pattern ORGANIZATION = Pattern.compile(
            "\\b((?:[A-Z][A-Za-z&'-]*[ \\t]+){1,4}"
            + "(?:Inc|Corp|Corporation|LLC|Ltd|Limited|Company|Co|Group|Bank|University|Association|Foundation"
            + "|GmbH|PLC))\\b");

    private static final Pattern LOCATION = Pattern.compile(
            "\\b(?:in|at|from|near|to)[ \\t]+(" + NAME_WORD + "(?:[ \\t]+" + NAME_WORD + ")?,[ \\t]+(?:[A-Z]{2}\\b|"
            + NAME_WORD + "(?:[ \\t]+" + NAME_WORD + ")?))");

    private static final Pattern REGION = Pattern.compile("\\b(" + NAME_WORD + "[ \\t]+Governorate)\\b");

    @Override
    public List<Entity> recognize(final String text, final Set<EntityType> types) {
        final List<Entity> entities = new ArrayList<>();
        if (types.contains(EntityType.PERSON)) {
            collect(PERSON, text, EntityType.PERSON, entities);
        }
        if (types.contains(EntityType.ORGANIZATION)) {
            collect(ORGANIZATION, text, EntityType.ORGANIZATION, entities);
        }
        if (types.contains(EntityType.LOCATION)) {
            collect(LOCATION, text, EntityType.LOCATION, entities);
            collect(REGION, text, EntityType.LOCATION, entities);
        }
        log.debug("Pattern recognizer produced {} candidates for types {}", entities.size(), types);
        return entities;
    }

    private static void collect(final Pattern pattern, final String text, final EntityType type,
                                final List<Entity> sink) {
        final Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            final String match = matcher.group(1).trim();
            sink.add(new Entity(type, match, match, CONFIDENCE));
        }
    }
}
