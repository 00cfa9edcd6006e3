package com.eyelevel.docsummarizer.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * The final output of a completed job, assembled from the stage outputs. It carries no timing
 * information, so identical input and options always produce an equal result.
 */
@Value
@Builder
public class JobResult {

    String summary;

    @Singular
    List<Entity> entities;

    @Singular("metadataEntry")
    Map<String, Object> metadata;
}
