package com.eyelevel.docsummarizer.entity;

import com.eyelevel.docsummarizer.model.Entity;
import com.eyelevel.docsummarizer.model.EntityType;

import java.util.List;
import java.util.Set;

/**
 * Finds people, organizations and locations in free text. Implementations return raw candidates;
 * noise filtering and de-duplication happen in {@link EntityExtractor}.
 */
public interface NamedEntityRecognizer {

    /**
     * @param text  The document text.
     * @param types The named-entity types wanted, a subset of PERSON, ORGANIZATION and LOCATION.
     * @return Candidate entities of the requested types.
     */
    List<Entity> recognize(String text, Set<EntityType> types);
}
