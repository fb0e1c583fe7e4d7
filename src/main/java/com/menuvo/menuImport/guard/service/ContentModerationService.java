package com.menuvo.menuImport.guard.service;

import com.menuvo.menuImport.menu.model.ExtractedCategory;
import com.menuvo.menuImport.menu.model.ExtractedItem;
import com.menuvo.menuImport.menu.model.ExtractedMenuData;
import com.menuvo.menuImport.menu.model.ExtractedOptionChoice;
import com.menuvo.menuImport.menu.model.ExtractedOptionGroup;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Content moderation for extracted menu data.
 *
 * Any name or description matching the blocklist is replaced as a whole by a fixed placeholder.
 * Fields are never partially redacted.
 */
@Slf4j
@Service
public class ContentModerationService {

    public static final String FILTERED_CATEGORY = "[Filtered Category]";
    public static final String FILTERED_ITEM = "[Filtered Item]";
    public static final String FILTERED_OPTION = "[Filtered Option]";
    public static final String FILTERED_CHOICE = "[Filtered Choice]";
    public static final String FILTERED_DESCRIPTION = "[Filtered]";

    private static final List<Pattern> BLOCKED_CONTENT_PATTERNS = List.of(
            Pattern.compile("\\bn[i1]gg[ae3]r?s?\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bf[a@]gg?[o0]t?s?\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bk[i1]k[e3]s?\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bch[i1]nks?\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bsp[i1]cs?\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bw[e3]tb[a@]cks?\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bf+u+c+k+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bs+h+[i1]+t+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bc+u+n+t+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\ba+s+s+h+o+l+e+", Pattern.CASE_INSENSITIVE)
    );

    /**
     * Returns a moderated copy of the menu data; the input is left untouched.
     */
    public ExtractedMenuData moderate(ExtractedMenuData data) {
        return data.toBuilder()
                .categories(data.getCategories().stream().map(this::moderateCategory).toList())
                .optionGroups(data.getOptionGroups().stream().map(this::moderateOptionGroup).toList())
                .build();
    }

    /**
     * Whether the text matches any blocklist pattern. Null text never matches.
     */
    public boolean containsBlockedContent(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        return BLOCKED_CONTENT_PATTERNS.stream().anyMatch(pattern -> pattern.matcher(text).find());
    }

    private ExtractedCategory moderateCategory(ExtractedCategory category) {
        return category.toBuilder()
                .name(replaceIfBlocked(category.getName(), FILTERED_CATEGORY))
                .description(replaceIfBlocked(category.getDescription(), FILTERED_DESCRIPTION))
                .items(category.getItems().stream().map(this::moderateItem).toList())
                .build();
    }

    private ExtractedItem moderateItem(ExtractedItem item) {
        return item.toBuilder()
                .name(replaceIfBlocked(item.getName(), FILTERED_ITEM))
                .description(replaceIfBlocked(item.getDescription(), FILTERED_DESCRIPTION))
                .categoryName(replaceIfBlocked(item.getCategoryName(), FILTERED_CATEGORY))
                .build();
    }

    private ExtractedOptionGroup moderateOptionGroup(ExtractedOptionGroup group) {
        return group.toBuilder()
                .name(replaceIfBlocked(group.getName(), FILTERED_OPTION))
                .description(replaceIfBlocked(group.getDescription(), FILTERED_DESCRIPTION))
                .choices(group.getChoices().stream().map(this::moderateChoice).toList())
                .build();
    }

    private ExtractedOptionChoice moderateChoice(ExtractedOptionChoice choice) {
        return choice.toBuilder()
                .name(replaceIfBlocked(choice.getName(), FILTERED_CHOICE))
                .build();
    }

    private String replaceIfBlocked(String text, String placeholder) {
        if (containsBlockedContent(text)) {
            log.debug("Blocked content replaced - placeholder: {}", placeholder);
            return placeholder;
        }
        return text;
    }
}
