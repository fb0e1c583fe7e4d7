package com.menuvo.menuImport.comparison.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One field that differs between an extracted item and its matched live item.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FieldChange {

    public static final String PRICE = "price";
    public static final String DESCRIPTION = "description";

    private String field;

    private Object oldValue;

    private Object newValue;
}
