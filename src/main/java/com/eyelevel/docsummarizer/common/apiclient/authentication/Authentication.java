package com.eyelevel.docsummarizer.common.apiclient.authentication;

import java.util.Map;

/**
 * Applies a credential scheme to the headers of an outbound request.
 */
public interface Authentication {

    /**
     * @param headers The mutable header map of the request being prepared.
     */
    void applyAuthentication(Map<String, String> headers);

    /**
     * @return {@code true} when a credential is available to apply.
     */
    boolean isConfigured();
}
