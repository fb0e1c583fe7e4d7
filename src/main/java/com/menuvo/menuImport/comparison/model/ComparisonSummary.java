package com.menuvo.menuImport.comparison.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-action counts of a comparison. Reporting only.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ComparisonSummary {

    private int totalCategories;
    private int newCategories;
    private int updatedCategories;
    private int skippedCategories;

    private int totalItems;
    private int newItems;
    private int updatedItems;
    private int skippedItems;

    private int totalOptionGroups;
    private int newOptionGroups;
    private int updatedOptionGroups;
    private int skippedOptionGroups;
}
