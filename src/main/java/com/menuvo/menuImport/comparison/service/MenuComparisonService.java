package com.menuvo.menuImport.comparison.service;

import com.menuvo.menuImport.comparison.model.CategoryComparison;
import com.menuvo.menuImport.comparison.model.ComparisonSummary;
import com.menuvo.menuImport.comparison.model.DiffAction;
import com.menuvo.menuImport.comparison.model.FieldChange;
import com.menuvo.menuImport.comparison.model.ItemComparison;
import com.menuvo.menuImport.comparison.model.MenuComparisonData;
import com.menuvo.menuImport.comparison.model.OptionGroupComparison;
import com.menuvo.menuImport.comparison.util.StringSimilarity;
import com.menuvo.menuImport.menu.model.ExistingMenuSnapshot;
import com.menuvo.menuImport.menu.model.ExistingMenuSnapshot.ExistingCategory;
import com.menuvo.menuImport.menu.model.ExistingMenuSnapshot.ExistingItem;
import com.menuvo.menuImport.menu.model.ExistingMenuSnapshot.ExistingOptionGroup;
import com.menuvo.menuImport.menu.model.ExtractedCategory;
import com.menuvo.menuImport.menu.model.ExtractedItem;
import com.menuvo.menuImport.menu.model.ExtractedMenuData;
import com.menuvo.menuImport.menu.model.ExtractedOptionGroup;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.ToDoubleFunction;

/**
 * Menu comparison engine - reconciles extracted menu data against a live menu snapshot.
 *
 * Every extracted entity is matched against all candidates in its scope and takes the candidate
 * with the highest score (first one wins on ties, no minimum score). The score then decides the
 * action:
 * - score >= exact threshold and nothing changed: skip
 * - score >= update threshold: update
 * - otherwise: create
 *
 * Pure and synchronous; the snapshot is never modified.
 */
@Slf4j
@Service
public class MenuComparisonService {

    public static final double DEFAULT_EXACT_THRESHOLD = 0.95;
    public static final double DEFAULT_UPDATE_THRESHOLD = 0.70;

    /**
     * Above this name similarity the name alone decides the item score.
     */
    static final double NAME_DOMINANCE_THRESHOLD = 0.9;
    static final double NAME_WEIGHT = 0.8;
    static final double PRICE_WEIGHT = 0.2;

    private final double exactThreshold;
    private final double updateThreshold;

    public MenuComparisonService(
            @Value("${menu-import.comparison.exact-threshold:" + DEFAULT_EXACT_THRESHOLD + "}") double exactThreshold,
            @Value("${menu-import.comparison.update-threshold:" + DEFAULT_UPDATE_THRESHOLD + "}") double updateThreshold) {
        if (updateThreshold > exactThreshold) {
            throw new IllegalArgumentException("Update threshold " + updateThreshold
                    + " must not exceed exact threshold " + exactThreshold);
        }
        this.exactThreshold = exactThreshold;
        this.updateThreshold = updateThreshold;
    }

    /**
     * Compares extracted menu data with the live menu.
     *
     * @param extracted Output of menu extraction
     * @param existing Live menu snapshot, may be empty
     * @return Hierarchical diff with summary
     */
    public MenuComparisonData compare(ExtractedMenuData extracted, ExistingMenuSnapshot existing) {
        List<CategoryComparison> categories = extracted.getCategories().stream()
                .map(category -> compareCategory(category, existing.getCategories()))
                .toList();

        List<OptionGroupComparison> optionGroups = extracted.getOptionGroups().stream()
                .map(group -> compareOptionGroup(group, existing.getOptionGroups()))
                .toList();

        ComparisonSummary summary = summarize(categories, optionGroups);

        log.debug("Menu compared - categories: {} new / {} updated / {} skipped, items: {} new / {} updated / {} skipped",
                summary.getNewCategories(), summary.getUpdatedCategories(), summary.getSkippedCategories(),
                summary.getNewItems(), summary.getUpdatedItems(), summary.getSkippedItems());

        return MenuComparisonData.builder()
                .extractedMenu(extracted)
                .categories(new ArrayList<>(categories))
                .optionGroups(new ArrayList<>(optionGroups))
                .summary(summary)
                .build();
    }

    /**
     * Maps a match score to an action.
     *
     * @param score Best match score
     * @param hasChanges Whether the entity (or any of its children) differs from its match
     */
    public DiffAction classify(double score, boolean hasChanges) {
        if (score >= exactThreshold && !hasChanges) {
            return DiffAction.SKIP;
        }
        if (score >= updateThreshold) {
            return DiffAction.UPDATE;
        }
        return DiffAction.CREATE;
    }

    /**
     * Item score: name similarity alone once it exceeds 0.9, otherwise a blend of 80% name
     * and 20% price similarity.
     */
    public static double itemMatchScore(ExtractedItem extracted, ExistingItem existing) {
        double nameSimilarity = StringSimilarity.similarity(extracted.getName(), existing.getName());
        if (nameSimilarity > NAME_DOMINANCE_THRESHOLD) {
            return nameSimilarity;
        }
        return nameSimilarity * NAME_WEIGHT + priceSimilarity(extracted.getPrice(), existing.getPrice()) * PRICE_WEIGHT;
    }

    static double priceSimilarity(long extractedPrice, long existingPrice) {
        if (existingPrice == 0) {
            return 0.0;
        }
        return Math.max(0.0, 1.0 - (double) Math.abs(extractedPrice - existingPrice) / existingPrice);
    }

    private CategoryComparison compareCategory(ExtractedCategory category, List<ExistingCategory> candidates) {
        Match<ExistingCategory> match = bestMatch(candidates,
                candidate -> StringSimilarity.similarity(category.getName(), candidate.getName()));

        List<ExistingItem> itemCandidates = match.candidate() != null ? match.candidate().getItems() : List.of();
        List<ItemComparison> items = category.getItems().stream()
                .map(item -> compareItem(item, itemCandidates))
                .toList();

        boolean itemsChanged = items.stream().anyMatch(item -> item.getAction() != DiffAction.SKIP);
        DiffAction action = classify(match.score(), itemsChanged);
        boolean matched = action != DiffAction.CREATE && match.candidate() != null;

        return CategoryComparison.builder()
                .extracted(category)
                .existingId(matched ? match.candidate().getId() : null)
                .existingName(matched ? match.candidate().getName() : null)
                .action(action)
                .matchScore(match.score())
                .items(new ArrayList<>(items))
                .build();
    }

    private ItemComparison compareItem(ExtractedItem item, List<ExistingItem> candidates) {
        Match<ExistingItem> match = bestMatch(candidates, candidate -> itemMatchScore(item, candidate));

        List<FieldChange> changes = match.candidate() != null ? detectChanges(item, match.candidate()) : List.of();
        DiffAction action = classify(match.score(), !changes.isEmpty());
        boolean matched = action != DiffAction.CREATE && match.candidate() != null;

        return ItemComparison.builder()
                .extracted(item)
                .existingId(matched ? match.candidate().getId() : null)
                .existingName(matched ? match.candidate().getName() : null)
                .action(action)
                .matchScore(match.score())
                .changes(action == DiffAction.UPDATE ? new ArrayList<>(changes) : new ArrayList<>())
                .build();
    }

    private OptionGroupComparison compareOptionGroup(ExtractedOptionGroup group, List<ExistingOptionGroup> candidates) {
        Match<ExistingOptionGroup> match = bestMatch(candidates,
                candidate -> StringSimilarity.similarity(group.getName(), candidate.getName()));

        DiffAction action = classify(match.score(), false);
        boolean matched = action != DiffAction.CREATE && match.candidate() != null;

        return OptionGroupComparison.builder()
                .extracted(group)
                .existingId(matched ? match.candidate().getId() : null)
                .existingName(matched ? match.candidate().getName() : null)
                .action(action)
                .matchScore(match.score())
                .build();
    }

    private static List<FieldChange> detectChanges(ExtractedItem item, ExistingItem existing) {
        List<FieldChange> changes = new ArrayList<>();
        if (item.getPrice() != existing.getPrice()) {
            changes.add(new FieldChange(FieldChange.PRICE, existing.getPrice(), item.getPrice()));
        }
        String newDescription = blankToNull(item.getDescription());
        String oldDescription = blankToNull(existing.getDescription());
        if (!Objects.equals(newDescription, oldDescription)) {
            changes.add(new FieldChange(FieldChange.DESCRIPTION, oldDescription, newDescription));
        }
        return changes;
    }

    private static <T> Match<T> bestMatch(List<T> candidates, ToDoubleFunction<T> scorer) {
        T best = null;
        double bestScore = 0.0;
        for (T candidate : candidates) {
            double score = scorer.applyAsDouble(candidate);
            if (best == null || score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        return new Match<>(best, bestScore);
    }

    private static ComparisonSummary summarize(List<CategoryComparison> categories,
                                               List<OptionGroupComparison> optionGroups) {
        List<DiffAction> categoryActions = categories.stream().map(CategoryComparison::getAction).toList();
        List<DiffAction> itemActions = categories.stream()
                .flatMap(category -> category.getItems().stream())
                .map(ItemComparison::getAction)
                .toList();
        List<DiffAction> optionGroupActions = optionGroups.stream().map(OptionGroupComparison::getAction).toList();

        return ComparisonSummary.builder()
                .totalCategories(categoryActions.size())
                .newCategories(count(categoryActions, DiffAction.CREATE))
                .updatedCategories(count(categoryActions, DiffAction.UPDATE))
                .skippedCategories(count(categoryActions, DiffAction.SKIP))
                .totalItems(itemActions.size())
                .newItems(count(itemActions, DiffAction.CREATE))
                .updatedItems(count(itemActions, DiffAction.UPDATE))
                .skippedItems(count(itemActions, DiffAction.SKIP))
                .totalOptionGroups(optionGroupActions.size())
                .newOptionGroups(count(optionGroupActions, DiffAction.CREATE))
                .updatedOptionGroups(count(optionGroupActions, DiffAction.UPDATE))
                .skippedOptionGroups(count(optionGroupActions, DiffAction.SKIP))
                .build();
    }

    private static int count(List<DiffAction> actions, DiffAction action) {
        return (int) actions.stream().filter(action::equals).count();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }

    private record Match<T>(T candidate, double score) {}
}
