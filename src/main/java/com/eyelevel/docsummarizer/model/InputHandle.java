package com.eyelevel.docsummarizer.model;

import lombok.Builder;
import lombok.Value;

/**
 * A reference to a stored source document. The orchestration core treats it as opaque and only
 * hands it to the extraction stage.
 */
@Value
@Builder
public class InputHandle {

    /**
     * Absolute path of the stored document.
     */
    String location;
    String originalFilename;
    long sizeBytes;
    /**
     * Total page count observed when the document was accepted; {@code null} if it was not inspected.
     */
    Integer pageCount;
}
