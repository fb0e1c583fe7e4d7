package com.menuvo.menuImport.menu.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Category as read from the merchant's document, with its items in document order.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ExtractedCategory {

    private String name;

    private String description;

    @Builder.Default
    private List<ExtractedItem> items = new ArrayList<>();
}
