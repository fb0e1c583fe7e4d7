package com.menuvo.menuImport.job.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Kind of entity a review selection refers to.
 */
public enum SelectionEntityType {

    CATEGORY("category"),
    ITEM("item"),
    OPTION_GROUP("optionGroup");

    private final String value;

    SelectionEntityType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SelectionEntityType fromValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown selection type: " + value));
    }
}
