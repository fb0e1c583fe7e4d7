package com.menuvo.menuImport.menu.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.menuvo.menuImport.ai.exception.AiResponseParseException;
import com.menuvo.menuImport.menu.model.ExtractedCategory;
import com.menuvo.menuImport.menu.model.ExtractedItem;
import com.menuvo.menuImport.menu.model.ExtractedMenuData;
import com.menuvo.menuImport.menu.model.ExtractedOptionChoice;
import com.menuvo.menuImport.menu.model.ExtractedOptionGroup;
import com.menuvo.menuImport.menu.model.OptionGroupType;
import com.menuvo.menuImport.menu.util.NameFormatter;
import com.menuvo.menuImport.util.LogPreview;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns model output of any shape into {@link ExtractedMenuData}.
 *
 * Two shapes are understood:
 * - Canonical: an object with a {@code categories} array. Category and item names are title-cased,
 *   field types are coerced.
 * - Recovery: any other object. Every top-level array (except confidence and option group keys)
 *   becomes a category named after its key. Item names are kept as the model wrote them.
 *
 * Missing confidence defaults to {@link #DEFAULT_CONFIDENCE}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MenuResponseNormalizer {

    public static final double DEFAULT_CONFIDENCE = 0.7;

    static final String UNKNOWN_CATEGORY = "Unknown Category";
    static final String UNKNOWN_ITEM = "Unknown Item";
    static final String UNKNOWN_OPTION_GROUP = "Unknown Option";

    /**
     * Keys accepted for the option group list, in order of preference.
     */
    private static final List<String> OPTION_GROUP_KEYS = List.of("optionGroups", "option_groups", "options");

    private static final Set<String> RESERVED_KEYS = Set.of("confidence", "optionGroups", "option_groups", "options");

    private final ObjectMapper objectMapper;

    /**
     * Parses free-text model output: strips a markdown code fence if present, reads the rest as
     * JSON and normalizes it.
     *
     * @param rawContent Raw model output
     * @return Normalized menu data
     * @throws AiResponseParseException if the content is not a JSON object after fence stripping
     */
    public ExtractedMenuData parse(String rawContent) {
        String cleaned = stripCodeFence(rawContent);
        JsonNode node;
        try {
            node = objectMapper.readTree(cleaned);
        } catch (JsonProcessingException e) {
            log.debug("Failed to parse AI response as JSON - preview: {}", LogPreview.of(cleaned));
            throw new AiResponseParseException(e);
        }
        return normalize(node);
    }

    /**
     * Normalizes an already parsed model response.
     *
     * @throws AiResponseParseException if the node is not a JSON object
     */
    public ExtractedMenuData normalize(JsonNode raw) {
        if (raw == null || !raw.isObject()) {
            log.debug("AI response is not a JSON object - nodeType: {}", raw == null ? null : raw.getNodeType());
            throw new AiResponseParseException();
        }

        List<ExtractedCategory> categories = raw.path("categories").isArray()
                ? normalizeCanonicalCategories(raw.get("categories"))
                : recoverCategories(raw);

        return ExtractedMenuData.builder()
                .categories(categories)
                .optionGroups(normalizeOptionGroups(findOptionGroups(raw)))
                .confidence(readConfidence(raw.get("confidence")))
                .build();
    }

    static String stripCodeFence(String content) {
        if (content == null) {
            return "";
        }
        String cleaned = content.strip();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.strip();
    }

    private List<ExtractedCategory> normalizeCanonicalCategories(JsonNode categoriesNode) {
        List<ExtractedCategory> categories = new ArrayList<>();
        for (JsonNode categoryNode : categoriesNode) {
            if (!categoryNode.isObject()) {
                continue;
            }
            String name = NameFormatter.toTitleCase(textOrDefault(categoryNode.get("name"), UNKNOWN_CATEGORY));
            categories.add(ExtractedCategory.builder()
                    .name(name)
                    .description(optionalText(categoryNode.get("description")))
                    .items(normalizeItems(categoryNode.get("items"), name, true))
                    .build());
        }
        return categories;
    }

    private List<ExtractedCategory> recoverCategories(JsonNode raw) {
        List<ExtractedCategory> categories = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = raw.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (RESERVED_KEYS.contains(field.getKey()) || !field.getValue().isArray()) {
                continue;
            }
            String name = NameFormatter.keyToCategoryName(field.getKey());
            categories.add(ExtractedCategory.builder()
                    .name(name)
                    .items(normalizeItems(field.getValue(), name, false))
                    .build());
        }
        if (!categories.isEmpty()) {
            log.debug("AI response recovered from non-canonical shape - categories: {}", categories.size());
        }
        return categories;
    }

    private List<ExtractedItem> normalizeItems(JsonNode itemsNode, String categoryName, boolean titleCaseNames) {
        List<ExtractedItem> items = new ArrayList<>();
        if (itemsNode == null || !itemsNode.isArray()) {
            return items;
        }
        for (JsonNode itemNode : itemsNode) {
            if (itemNode.isTextual() && !itemNode.asText().isBlank()) {
                items.add(ExtractedItem.builder()
                        .name(titleCaseNames ? NameFormatter.toTitleCase(itemNode.asText()) : itemNode.asText().strip())
                        .categoryName(categoryName)
                        .build());
                continue;
            }
            if (!itemNode.isObject()) {
                continue;
            }
            String name = textOrDefault(itemNode.get("name"), UNKNOWN_ITEM);
            items.add(ExtractedItem.builder()
                    .name(titleCaseNames ? NameFormatter.toTitleCase(name) : name)
                    .description(optionalText(itemNode.get("description")))
                    .price(Math.max(0, readAmount(itemNode.get("price"))))
                    .allergens(readStringList(itemNode.get("allergens")))
                    .categoryName(categoryName)
                    .build());
        }
        return items;
    }

    private JsonNode findOptionGroups(JsonNode raw) {
        for (String key : OPTION_GROUP_KEYS) {
            JsonNode node = raw.get(key);
            if (node != null && node.isArray()) {
                return node;
            }
        }
        return null;
    }

    private List<ExtractedOptionGroup> normalizeOptionGroups(JsonNode groupsNode) {
        List<ExtractedOptionGroup> groups = new ArrayList<>();
        if (groupsNode == null) {
            return groups;
        }
        for (JsonNode groupNode : groupsNode) {
            if (!groupNode.isObject()) {
                continue;
            }
            List<ExtractedOptionChoice> choices = new ArrayList<>();
            JsonNode choicesNode = groupNode.get("choices");
            if (choicesNode != null && choicesNode.isArray()) {
                for (JsonNode choiceNode : choicesNode) {
                    if (choiceNode.isObject()) {
                        choices.add(new ExtractedOptionChoice(
                                textOrDefault(choiceNode.get("name"), UNKNOWN_ITEM),
                                readAmount(choiceNode.get("priceModifier"))));
                    }
                }
            }
            List<String> appliesTo = readStringList(groupNode.get("appliesTo"));
            groups.add(ExtractedOptionGroup.builder()
                    .name(textOrDefault(groupNode.get("name"), UNKNOWN_OPTION_GROUP))
                    .description(optionalText(groupNode.get("description")))
                    .type(OptionGroupType.fromValue(optionalText(groupNode.get("type"))))
                    .required(groupNode.path("isRequired").asBoolean(false))
                    .choices(choices)
                    .appliesTo(appliesTo != null ? appliesTo : new ArrayList<>())
                    .build());
        }
        return groups;
    }

    private static double readConfidence(JsonNode node) {
        if (node == null || !node.isNumber()) {
            return DEFAULT_CONFIDENCE;
        }
        return Math.min(1.0, Math.max(0.0, node.asDouble()));
    }

    /**
     * Reads an amount in minor units. Accepts numbers and numeric strings; anything else is 0.
     */
    private static long readAmount(JsonNode node) {
        if (node == null) {
            return 0;
        }
        if (node.isNumber()) {
            return Math.round(node.asDouble());
        }
        if (node.isTextual()) {
            try {
                return Math.round(Double.parseDouble(node.asText().strip()));
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }

    private static String textOrDefault(JsonNode node, String defaultValue) {
        String text = optionalText(node);
        return text != null ? text : defaultValue;
    }

    private static String optionalText(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String text = node.asText().strip();
        return text.isEmpty() ? null : text;
    }

    private static List<String> readStringList(JsonNode node) {
        if (node == null || !node.isArray()) {
            return null;
        }
        List<String> values = new ArrayList<>();
        for (JsonNode element : node) {
            String text = optionalText(element);
            if (text != null) {
                values.add(text);
            }
        }
        return values;
    }
}
