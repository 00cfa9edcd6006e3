package com.eyelevel.docsummarizer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

/**
 * The style of summary a client asks for.
 */
@Getter
@RequiredArgsConstructor
public enum SummaryMode {
    BRIEF("brief"),
    DETAILED("detailed"),
    BULLET_POINTS("bullets");

    @JsonValue
    private final String value;

    /**
     * Resolves a mode from either its wire value ("bullets") or its constant name ("BULLET_POINTS").
     *
     * @param text The raw value, case-insensitive.
     * @return The matching mode.
     * @throws IllegalArgumentException if nothing matches.
     */
    @JsonCreator
    public static SummaryMode fromValue(final String text) {
        return Arrays.stream(values())
                .filter(mode -> mode.value.equalsIgnoreCase(text.trim()) || mode.name().equalsIgnoreCase(text.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown summary mode: " + text));
    }
}
