package com.menuvo.menuImport.comparison.model;

import com.menuvo.menuImport.menu.model.ExtractedMenuData;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Full reconciliation result of an import.
 * Stored on the job and read back by review and apply, so the JSON shape must stay stable.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MenuComparisonData {

    private ExtractedMenuData extractedMenu;

    @Builder.Default
    private List<CategoryComparison> categories = new ArrayList<>();

    @Builder.Default
    private List<OptionGroupComparison> optionGroups = new ArrayList<>();

    private ComparisonSummary summary;
}
