package com.menuvo.menuImport.menu.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * Selection behavior of an option group.
 */
public enum OptionGroupType {

    SINGLE_SELECT("single_select"),
    MULTI_SELECT("multi_select"),
    QUANTITY_SELECT("quantity_select");

    private final String value;

    OptionGroupType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Lenient lookup: accepts "single_select", "single-select", "Single Select" and so on.
     * Unknown or missing values fall back to {@link #SINGLE_SELECT}.
     */
    @JsonCreator
    public static OptionGroupType fromValue(String value) {
        if (value == null) {
            return SINGLE_SELECT;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s-]+", "_");
        return Arrays.stream(values())
                .filter(type -> type.value.equals(normalized))
                .findFirst()
                .orElse(SINGLE_SELECT);
    }
}
