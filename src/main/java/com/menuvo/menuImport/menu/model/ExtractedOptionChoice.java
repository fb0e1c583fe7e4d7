package com.menuvo.menuImport.menu.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * One selectable choice of an option group.
 */
@Value
@AllArgsConstructor
@Builder(toBuilder = true)
public class ExtractedOptionChoice {

    private String name;

    /**
     * Surcharge in minor currency units; negative for discounts.
     */
    private long priceModifier;
}
