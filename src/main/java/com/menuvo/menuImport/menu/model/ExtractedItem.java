package com.menuvo.menuImport.menu.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Menu item as read from the merchant's document.
 * Immutable; changed copies are made with {@link #toBuilder()}.
 */
@Value
@AllArgsConstructor
@Builder(toBuilder = true)
public class ExtractedItem {

    private String name;

    private String description;

    /**
     * Price in minor currency units (cents), never negative.
     */
    private long price;

    private List<String> allergens;

    /**
     * Name of the containing category.
     */
    private String categoryName;
}
