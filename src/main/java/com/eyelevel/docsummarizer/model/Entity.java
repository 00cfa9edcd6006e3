package com.eyelevel.docsummarizer.model;

/**
 * An entity found in the document text.
 *
 * @param type       The entity category.
 * @param text       The excerpt exactly as it appears in the document.
 * @param value      A normalized value when one could be derived (ISO date string, numeric amount), otherwise {@code null}.
 * @param confidence A score between 0 and 1.
 */
public record Entity(EntityType type, String text, Object value, double confidence) {
}
