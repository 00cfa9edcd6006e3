package com.eyelevel.docsummarizer.entity;

import com.eyelevel.docsummarizer.model.Entity;
import com.eyelevel.docsummarizer.model.EntityType;

import java.util.List;

/**
 * Entities found in a document, in discovery order, with views per category.
 */
public record EntityExtractionResult(List<Entity> entities) {

    public EntityExtractionResult {
        entities = List.copyOf(entities);
    }

    public List<Entity> dates() {
        return ofType(EntityType.DATE);
    }

    public List<Entity> money() {
        return ofType(EntityType.MONEY);
    }

    public List<Entity> people() {
        return ofType(EntityType.PERSON);
    }

    public List<Entity> organizations() {
        return ofType(EntityType.ORGANIZATION);
    }

    public List<Entity> locations() {
        return ofType(EntityType.LOCATION);
    }

    public List<Entity> ofType(final EntityType type) {
        return entities.stream().filter(entity -> entity.type() == type).toList();
    }
}
