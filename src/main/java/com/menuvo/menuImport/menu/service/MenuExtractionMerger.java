package com.menuvo.menuImport.menu.service;

import com.menuvo.menuImport.menu.model.ExtractedCategory;
import com.menuvo.menuImport.menu.model.ExtractedMenuData;
import com.menuvo.menuImport.menu.model.ExtractedOptionGroup;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Combines the extraction results of several chunks into one.
 *
 * - Categories with the same name (ignoring case) become one category; items are concatenated
 *   in chunk order, duplicates included.
 * - Option groups with the same name (ignoring case) become one group; {@code appliesTo} is
 *   the union of both lists, other fields come from the first occurrence.
 * - Confidence is the mean over the inputs.
 *
 * Inputs are not modified.
 */
public class MenuExtractionMerger {

    private MenuExtractionMerger() {}

    public static ExtractedMenuData merge(List<ExtractedMenuData> extractions) {
        if (extractions == null || extractions.isEmpty()) {
            return ExtractedMenuData.builder().confidence(0.0).build();
        }

        Map<String, ExtractedCategory> categories = new LinkedHashMap<>();
        Map<String, ExtractedOptionGroup> optionGroups = new LinkedHashMap<>();
        double totalConfidence = 0;

        for (ExtractedMenuData extraction : extractions) {
            totalConfidence += extraction.getConfidence();

            for (ExtractedCategory category : extraction.getCategories()) {
                categories.merge(key(category.getName()), copy(category), MenuExtractionMerger::mergeCategories);
            }

            for (ExtractedOptionGroup group : extraction.getOptionGroups()) {
                optionGroups.merge(key(group.getName()), copy(group), MenuExtractionMerger::mergeOptionGroups);
            }
        }

        return ExtractedMenuData.builder()
                .categories(new ArrayList<>(categories.values()))
                .optionGroups(new ArrayList<>(optionGroups.values()))
                .confidence(totalConfidence / extractions.size())
                .build();
    }

    private static ExtractedCategory mergeCategories(ExtractedCategory first, ExtractedCategory second) {
        first.getItems().addAll(second.getItems());
        return first;
    }

    private static ExtractedOptionGroup mergeOptionGroups(ExtractedOptionGroup first, ExtractedOptionGroup second) {
        LinkedHashSet<String> appliesTo = new LinkedHashSet<>(first.getAppliesTo());
        appliesTo.addAll(second.getAppliesTo());
        return first.toBuilder().appliesTo(new ArrayList<>(appliesTo)).build();
    }

    private static ExtractedCategory copy(ExtractedCategory category) {
        return category.toBuilder().items(new ArrayList<>(category.getItems())).build();
    }

    private static ExtractedOptionGroup copy(ExtractedOptionGroup group) {
        return group.toBuilder()
                .choices(new ArrayList<>(group.getChoices()))
                .appliesTo(new ArrayList<>(group.getAppliesTo()))
                .build();
    }

    private static String key(String name) {
        return name == null ? "" : name.toLowerCase(Locale.ROOT);
    }
}
