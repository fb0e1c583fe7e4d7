package com.menuvo.menuImport.job.service;

import com.menuvo.menuImport.comparison.model.CategoryComparison;
import com.menuvo.menuImport.comparison.model.ItemComparison;
import com.menuvo.menuImport.comparison.model.MenuChangeSet;
import com.menuvo.menuImport.comparison.model.MenuComparisonData;
import com.menuvo.menuImport.comparison.model.OptionGroupComparison;
import com.menuvo.menuImport.job.dto.ImportSelection;
import com.menuvo.menuImport.job.dto.SelectionEntityType;

import java.util.Collection;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the change set of a reviewed import: only entities whose (type, extracted name) was
 * selected and whose action writes to the live menu are included.
 */
public class MenuChangeSetFactory {

    private MenuChangeSetFactory() {}

    public static MenuChangeSet fromSelections(String storeId,
                                               MenuComparisonData comparison,
                                               Collection<ImportSelection> selections) {
        Set<String> categories = namesOf(selections, SelectionEntityType.CATEGORY);
        Set<String> items = namesOf(selections, SelectionEntityType.ITEM);
        Set<String> optionGroups = namesOf(selections, SelectionEntityType.OPTION_GROUP);

        MenuChangeSet changeSet = MenuChangeSet.builder().storeId(storeId).build();

        for (CategoryComparison category : comparison.getCategories()) {
            if (category.getAction().isApplicable() && categories.contains(category.getExtracted().getName())) {
                changeSet.getCategories().add(MenuChangeSet.CategoryChange.builder()
                        .action(category.getAction())
                        .existingId(category.getExistingId())
                        .name(category.getExtracted().getName())
                        .description(category.getExtracted().getDescription())
                        .build());
            }
            for (ItemComparison item : category.getItems()) {
                if (item.getAction().isApplicable() && items.contains(item.getExtracted().getName())) {
                    changeSet.getItems().add(MenuChangeSet.ItemChange.builder()
                            .action(item.getAction())
                            .existingId(item.getExistingId())
                            .categoryExistingId(category.getExistingId())
                            .item(item.getExtracted())
                            .build());
                }
            }
        }

        for (OptionGroupComparison group : comparison.getOptionGroups()) {
            if (group.getAction().isApplicable() && optionGroups.contains(group.getExtracted().getName())) {
                changeSet.getOptionGroups().add(MenuChangeSet.OptionGroupChange.builder()
                        .action(group.getAction())
                        .existingId(group.getExistingId())
                        .group(group.getExtracted())
                        .build());
            }
        }

        return changeSet;
    }

    private static Set<String> namesOf(Collection<ImportSelection> selections, SelectionEntityType type) {
        return selections.stream()
                .filter(selection -> selection.getType() == type)
                .map(ImportSelection::getExtractedName)
                .collect(Collectors.toSet());
    }
}
