package com.eyelevel.docsummarizer.exception.json;

import java.io.Serial;

public class JsonParsingException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 2238604775190117380L;

    public JsonParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
