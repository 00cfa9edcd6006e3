package com.eyelevel.docsummarizer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

@Getter
@RequiredArgsConstructor
public enum EntityType {
    DATE("date"),
    MONEY("money"),
    PERSON("person"),
    ORGANIZATION("organization"),
    LOCATION("location");

    @JsonValue
    private final String value;

    @JsonCreator
    public static EntityType fromValue(final String text) {
        return Arrays.stream(values())
                .filter(type -> type.value.equalsIgnoreCase(text.trim()) || type.name().equalsIgnoreCase(text.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown entity type: " + text));
    }
}
