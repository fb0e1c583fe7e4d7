package com.menuvo.menuImport.menu.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.menuvo.menuImport.ai.exception.AiResponseParseException;
import com.menuvo.menuImport.menu.model.ExtractedCategory;
import com.menuvo.menuImport.menu.model.ExtractedItem;
import com.menuvo.menuImport.menu.model.ExtractedMenuData;
import com.menuvo.menuImport.menu.model.ExtractedOptionGroup;
import com.menuvo.menuImport.menu.model.OptionGroupType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MenuResponseNormalizerTest {

    private final MenuResponseNormalizer normalizer = new MenuResponseNormalizer(new ObjectMapper());

    @Test
    void canonicalShapeIsTitleCasedAndCoerced() {
        String content = """
                {
                  "categories": [
                    {
                      "name": "main DISHES",
                      "items": [
                        {"name": "wiener schnitzel", "price": 1450.4, "categoryName": "whatever",
                         "allergens": ["gluten", 7]},
                        {"name": "pommes", "price": "390"},
                        {"name": "free bread", "price": -5}
                      ]
                    }
                  ],
                  "optionGroups": [
                    {"name": "Size", "type": "multi-select", "isRequired": true,
                     "choices": [{"name": "Large", "priceModifier": 200}, {"name": "Kids", "priceModifier": -100}],
                     "appliesTo": ["Wiener Schnitzel"]}
                  ],
                  "confidence": 0.92
                }
                """;

        ExtractedMenuData data = normalizer.parse(content);

        ExtractedCategory category = data.getCategories().get(0);
        assertThat(category.getName()).isEqualTo("Main Dishes");
        assertThat(category.getItems()).extracting(ExtractedItem::getName)
                .containsExactly("Wiener Schnitzel", "Pommes", "Free Bread");
        assertThat(category.getItems()).extracting(ExtractedItem::getPrice).containsExactly(1450L, 390L, 0L);
        assertThat(category.getItems().get(0).getAllergens()).containsExactly("gluten", "7");
        assertThat(category.getItems()).allSatisfy(item -> assertThat(item.getCategoryName()).isEqualTo("Main Dishes"));

        ExtractedOptionGroup group = data.getOptionGroups().get(0);
        assertThat(group.getType()).isEqualTo(OptionGroupType.MULTI_SELECT);
        assertThat(group.isRequired()).isTrue();
        assertThat(group.getChoices().get(1).getPriceModifier()).isEqualTo(-100);
        assertThat(group.getAppliesTo()).containsExactly("Wiener Schnitzel");
        assertThat(data.getConfidence()).isEqualTo(0.92);
    }

    @Test
    void codeFenceIsStripped() {
        String content = "```json\n{\"categories\": [], \"optionGroups\": [], \"confidence\": 0.5}\n```";

        ExtractedMenuData data = normalizer.parse(content);

        assertThat(data.getCategories()).isEmpty();
        assertThat(data.getConfidence()).isEqualTo(0.5);
    }

    @Test
    void topLevelArraysBecomeCategoriesWhenShapeIsNotCanonical() {
        String content = """
                ```
                {
                  "hot_drinks": [{"name": "flat white", "price": 380}, "espresso"],
                  "BBQ_specials": [{"name": "Caesar Salad", "price": 950, "description": "Romaine, parmesan"}],
                  "note": "not a list",
                  "option_groups": [{"name": "Milk", "type": "single_select", "isRequired": false,
                                     "choices": [{"name": "Oat", "priceModifier": 50}], "appliesTo": []}]
                }
                ```""";

        ExtractedMenuData data = normalizer.parse(content);

        assertThat(data.getCategories()).extracting(ExtractedCategory::getName)
                .containsExactly("Hot Drinks", "BBQ Specials");
        assertThat(data.getCategories().get(0).getItems()).extracting(ExtractedItem::getName)
                .containsExactly("flat white", "espresso");
        assertThat(data.getCategories().get(1).getItems().get(0).getDescription()).isEqualTo("Romaine, parmesan");
        assertThat(data.getOptionGroups()).extracting(ExtractedOptionGroup::getName).containsExactly("Milk");
        assertThat(data.getConfidence()).isEqualTo(MenuResponseNormalizer.DEFAULT_CONFIDENCE);
    }

    @Test
    void optionsKeyIsAcceptedForOptionGroups() {
        String content = "{\"pizza\": [{\"name\": \"Margherita\", \"price\": 1200}],"
                + " \"options\": [{\"name\": \"Extras\", \"choices\": []}]}";

        ExtractedMenuData data = normalizer.parse(content);

        assertThat(data.getCategories()).extracting(ExtractedCategory::getName).containsExactly("Pizza");
        assertThat(data.getOptionGroups()).extracting(ExtractedOptionGroup::getName).containsExactly("Extras");
        assertThat(data.getOptionGroups().get(0).getType()).isEqualTo(OptionGroupType.SINGLE_SELECT);
    }

    @Test
    void confidenceIsClampedToUnitRange() {
        ExtractedMenuData data = normalizer.parse("{\"categories\": [], \"confidence\": 7}");

        assertThat(data.getConfidence()).isEqualTo(1.0);
    }

    @Test
    void unparseableContentFailsWithGenericMessage() {
        assertThatThrownBy(() -> normalizer.parse("Sorry, I can't help with that."))
                .isInstanceOf(AiResponseParseException.class)
                .hasMessage(AiResponseParseException.DEFAULT_MESSAGE);
    }

    @Test
    void nonObjectJsonIsRejected() {
        assertThatThrownBy(() -> normalizer.parse("[1, 2, 3]"))
                .isInstanceOf(AiResponseParseException.class);
    }
}
