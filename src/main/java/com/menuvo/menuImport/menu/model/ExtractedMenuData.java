package com.menuvo.menuImport.menu.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured menu produced by the AI extraction step.
 * Input contract of the comparison step.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ExtractedMenuData {

    @Builder.Default
    private List<ExtractedCategory> categories = new ArrayList<>();

    @Builder.Default
    private List<ExtractedOptionGroup> optionGroups = new ArrayList<>();

    /**
     * Model's own estimate of extraction quality, 0.0 to 1.0.
     */
    private double confidence;

    public int itemCount() {
        return categories.stream().mapToInt(category -> category.getItems().size()).sum();
    }
}
