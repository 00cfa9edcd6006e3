package com.eyelevel.docsummarizer.dto.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

/**
 * Envelope for every REST response, successful or not.
 **/
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    /**
     * A message to display to the user.
     */
    private final String displayMessage;

    /**
     * The response data, or error detail for failed requests.
     */
    private final T response;

    private final Boolean showMessage;

    private final Integer statusCode;

    public static <T> ApiResponse<T> error(final String displayMessage) {
        return ApiResponse.<T>builder().displayMessage(displayMessage).showMessage(true).build();
    }

    @SuppressWarnings("unchecked")
    public static <T> ApiResponse<T> error(final String displayMessage, final String detail) {
        return ApiResponse.<T>builder()
                          .displayMessage(displayMessage)
                          .response((T) detail)
                          .showMessage(true)
                          .build();
    }
}
