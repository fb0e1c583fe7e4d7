package com.menuvo.menuImport.menu.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.menuvo.menuImport.comparison.model.DiffAction;
import com.menuvo.menuImport.comparison.model.MenuChangeSet;
import com.menuvo.menuImport.menu.model.ExistingMenuSnapshot;
import com.menuvo.menuImport.menu.model.ExistingMenuSnapshot.ExistingCategory;
import com.menuvo.menuImport.menu.model.ExistingMenuSnapshot.ExistingItem;
import com.menuvo.menuImport.menu.model.ExistingMenuSnapshot.ExistingOptionGroup;
import com.menuvo.menuImport.menu.model.ExtractedItem;
import com.menuvo.menuImport.menu.model.ExtractedOptionGroup;
import com.menuvo.menuImport.util.JsonFileLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live menus held in memory, one per store, seeded from a classpath JSON resource.
 *
 * Snapshots handed out are deep copies. Writes to one store are serialized through
 * {@code ConcurrentHashMap.compute}.
 */
@Slf4j
@Repository
public class InMemoryMenuRepository implements ExistingMenuProvider, LiveMenuWriter {

    private final Map<String, ExistingMenuSnapshot> menus = new ConcurrentHashMap<>();

    public InMemoryMenuRepository(@Value("${menu-import.menus.seed-resource:data/menus.json}") String seedResource) {
        Map<String, ExistingMenuSnapshot> seed = JsonFileLoader.loadAsObjectOrNull(
                seedResource, new TypeReference<Map<String, ExistingMenuSnapshot>>() {});
        if (seed != null) {
            seed.forEach((storeId, menu) -> menus.put(storeId, copy(menu)));
        }
        log.info("Live menus loaded - resource: {}, stores: {}", seedResource, menus.size());
    }

    @Override
    public ExistingMenuSnapshot getExistingMenu(String storeId) {
        ExistingMenuSnapshot menu = menus.get(storeId);
        if (menu == null) {
            log.debug("No live menu for store - storeId: {}", storeId);
            return ExistingMenuSnapshot.empty();
        }
        synchronized (menu) {
            return copy(menu);
        }
    }

    @Override
    public void apply(MenuChangeSet changeSet) {
        menus.compute(changeSet.getStoreId(), (storeId, current) -> {
            ExistingMenuSnapshot menu = current != null ? current : ExistingMenuSnapshot.empty();
            synchronized (menu) {
                changeSet.getCategories().forEach(change -> applyCategory(menu, change));
                changeSet.getItems().forEach(change -> applyItem(menu, change));
                changeSet.getOptionGroups().forEach(change -> applyOptionGroup(menu, change));
            }
            return menu;
        });
        log.info("Live menu updated - storeId: {}, categories: {}, items: {}, optionGroups: {}",
                changeSet.getStoreId(), changeSet.getCategories().size(),
                changeSet.getItems().size(), changeSet.getOptionGroups().size());
    }

    private void applyCategory(ExistingMenuSnapshot menu, MenuChangeSet.CategoryChange change) {
        if (change.getAction() == DiffAction.CREATE) {
            menu.getCategories().add(ExistingCategory.builder()
                    .id(newId())
                    .name(change.getName())
                    .description(change.getDescription())
                    .build());
            return;
        }
        findCategory(menu, change.getExistingId()).ifPresentOrElse(
                category -> {
                    if (change.getDescription() != null) {
                        category.setDescription(change.getDescription());
                    }
                },
                () -> log.warn("Category to update not found - categoryId: {}", change.getExistingId()));
    }

    private void applyItem(ExistingMenuSnapshot menu, MenuChangeSet.ItemChange change) {
        ExtractedItem item = change.getItem();
        if (change.getAction() == DiffAction.CREATE) {
            ExistingCategory category = findCategory(menu, change.getCategoryExistingId())
                    .or(() -> findCategoryByName(menu, item.getCategoryName()))
                    .orElseGet(() -> {
                        ExistingCategory created = ExistingCategory.builder()
                                .id(newId())
                                .name(item.getCategoryName())
                                .build();
                        menu.getCategories().add(created);
                        return created;
                    });
            category.getItems().add(ExistingItem.builder()
                    .id(newId())
                    .name(item.getName())
                    .description(item.getDescription())
                    .price(item.getPrice())
                    .allergens(item.getAllergens() != null ? new ArrayList<>(item.getAllergens()) : null)
                    .build());
            return;
        }
        findItem(menu, change.getExistingId()).ifPresentOrElse(
                existing -> {
                    existing.setPrice(item.getPrice());
                    existing.setDescription(item.getDescription());
                    if (item.getAllergens() != null) {
                        existing.setAllergens(new ArrayList<>(item.getAllergens()));
                    }
                },
                () -> log.warn("Item to update not found - itemId: {}", change.getExistingId()));
    }

    private void applyOptionGroup(ExistingMenuSnapshot menu, MenuChangeSet.OptionGroupChange change) {
        ExtractedOptionGroup group = change.getGroup();
        if (change.getAction() == DiffAction.CREATE) {
            menu.getOptionGroups().add(ExistingOptionGroup.builder()
                    .id(newId())
                    .name(group.getName())
                    .description(group.getDescription())
                    .type(group.getType().getValue())
                    .build());
            return;
        }
        menu.getOptionGroups().stream()
                .filter(existing -> existing.getId().equals(change.getExistingId()))
                .findFirst()
                .ifPresentOrElse(
                        existing -> {
                            existing.setType(group.getType().getValue());
                            if (group.getDescription() != null) {
                                existing.setDescription(group.getDescription());
                            }
                        },
                        () -> log.warn("Option group to update not found - optionGroupId: {}", change.getExistingId()));
    }

    private static Optional<ExistingCategory> findCategory(ExistingMenuSnapshot menu, String categoryId) {
        if (categoryId == null) {
            return Optional.empty();
        }
        return menu.getCategories().stream()
                .filter(category -> categoryId.equals(category.getId()))
                .findFirst();
    }

    private static Optional<ExistingCategory> findCategoryByName(ExistingMenuSnapshot menu, String name) {
        if (name == null) {
            return Optional.empty();
        }
        return menu.getCategories().stream()
                .filter(category -> name.equalsIgnoreCase(category.getName()))
                .findFirst();
    }

    private static Optional<ExistingItem> findItem(ExistingMenuSnapshot menu, String itemId) {
        return menu.getCategories().stream()
                .flatMap(category -> category.getItems().stream())
                .filter(item -> item.getId().equals(itemId))
                .findFirst();
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }

    private static ExistingMenuSnapshot copy(ExistingMenuSnapshot menu) {
        List<ExistingCategory> categories = new ArrayList<>();
        for (ExistingCategory category : menu.getCategories()) {
            List<ExistingItem> items = new ArrayList<>();
            for (ExistingItem item : category.getItems()) {
                items.add(item.toBuilder()
                        .allergens(item.getAllergens() != null ? new ArrayList<>(item.getAllergens()) : null)
                        .build());
            }
            categories.add(category.toBuilder().items(items).build());
        }
        List<ExistingOptionGroup> optionGroups = new ArrayList<>();
        for (ExistingOptionGroup group : menu.getOptionGroups()) {
            optionGroups.add(group.toBuilder().build());
        }
        return new ExistingMenuSnapshot(categories, optionGroups);
    }
}
