package com.menuvo.menuImport.comparison.model;

import com.menuvo.menuImport.menu.model.ExtractedItem;
import com.menuvo.menuImport.menu.model.ExtractedOptionGroup;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Subset of a comparison selected for writing to the live menu.
 * Only create and update entries are ever part of a change set.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MenuChangeSet {

    private String storeId;

    @Builder.Default
    private List<CategoryChange> categories = new ArrayList<>();

    @Builder.Default
    private List<ItemChange> items = new ArrayList<>();

    @Builder.Default
    private List<OptionGroupChange> optionGroups = new ArrayList<>();

    public boolean isEmpty() {
        return categories.isEmpty() && items.isEmpty() && optionGroups.isEmpty();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class CategoryChange {

        private DiffAction action;

        /**
         * Live category to patch; null for create.
         */
        private String existingId;

        private String name;

        private String description;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class ItemChange {

        private DiffAction action;

        /**
         * Live item to patch; null for create.
         */
        private String existingId;

        /**
         * Live category the item's extracted category matched, if any.
         */
        private String categoryExistingId;

        private ExtractedItem item;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class OptionGroupChange {

        private DiffAction action;

        private String existingId;

        private ExtractedOptionGroup group;
    }
}
