package com.menuvo.menuImport.comparison.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Classification of an extracted entity against the live menu.
 */
public enum DiffAction {

    CREATE("create"),
    UPDATE("update"),
    SKIP("skip");

    private final String value;

    DiffAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static DiffAction fromValue(String value) {
        return Arrays.stream(values())
                .filter(action -> action.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown diff action: " + value));
    }

    /**
     * Whether applying this action writes to the live menu.
     */
    public boolean isApplicable() {
        return this != SKIP;
    }
}
