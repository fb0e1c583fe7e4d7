package com.menuvo.menuImport.menu.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Read model of a store's live menu, used as the reference side of a comparison.
 * Never modified by the import pipeline.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExistingMenuSnapshot {

    @Builder.Default
    private List<ExistingCategory> categories = new ArrayList<>();

    @Builder.Default
    private List<ExistingOptionGroup> optionGroups = new ArrayList<>();

    public static ExistingMenuSnapshot empty() {
        return new ExistingMenuSnapshot();
    }

    public List<String> categoryNames() {
        return categories.stream().map(ExistingCategory::getName).toList();
    }

    public List<String> itemNames() {
        return categories.stream()
                .flatMap(category -> category.getItems().stream())
                .map(ExistingItem::getName)
                .toList();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder(toBuilder = true)
    public static class ExistingCategory {

        private String id;

        private String name;

        private String description;

        @Builder.Default
        private List<ExistingItem> items = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder(toBuilder = true)
    public static class ExistingItem {

        private String id;

        private String name;

        private String description;

        /**
         * Price in minor currency units.
         */
        private long price;

        private List<String> allergens;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder(toBuilder = true)
    public static class ExistingOptionGroup {

        private String id;

        private String name;

        private String description;

        private String type;
    }
}
