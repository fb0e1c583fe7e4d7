package com.menuvo.menuImport.menu.model;

import com.menuvo.menuImport.ai.service.StructuredOutputSchema;

import java.util.List;
import java.util.Map;

/**
 * Function definition for structured menu extraction.
 * Defines the JSON schema the model must fill when schema-constrained output is available.
 */
public class MenuExtractionFunctionDefinition {

    private MenuExtractionFunctionDefinition() {}

    public static final String FUNCTION_NAME = "report_extracted_menu";
    public static final String FUNCTION_DESCRIPTION = """
        Reports the menu extracted from the merchant's document.
        Use this function to return every category with its items, every option group,
        and your confidence in the extraction.
        """;

    public static Map<String, Object> getFunctionSchema() {
        Map<String, Object> item = Map.of(
            "type", "object",
            "properties", Map.of(
                "name", Map.of("type", "string", "description", "Item name as printed on the menu"),
                "description", Map.of("type", "string", "description", "Item description, if any"),
                "price", Map.of(
                    "type", "integer",
                    "description", "Price in cents (9.99 becomes 999), 0 if no price is given",
                    "minimum", 0
                ),
                "allergens", Map.of(
                    "type", "array",
                    "items", Map.of("type", "string"),
                    "description", "Allergens mentioned for the item"
                ),
                "categoryName", Map.of("type", "string", "description", "Name of the parent category")
            ),
            "required", List.of("name", "price", "categoryName")
        );

        Map<String, Object> category = Map.of(
            "type", "object",
            "properties", Map.of(
                "name", Map.of("type", "string", "description", "Category name"),
                "description", Map.of("type", "string", "description", "Category description, if any"),
                "items", Map.of("type", "array", "items", item)
            ),
            "required", List.of("name", "items")
        );

        Map<String, Object> choice = Map.of(
            "type", "object",
            "properties", Map.of(
                "name", Map.of("type", "string", "description", "Choice name"),
                "priceModifier", Map.of(
                    "type", "integer",
                    "description", "Surcharge in cents, negative for a discount"
                )
            ),
            "required", List.of("name", "priceModifier")
        );

        Map<String, Object> optionGroup = Map.of(
            "type", "object",
            "properties", Map.of(
                "name", Map.of("type", "string", "description", "Option group name, e.g. Size or Extras"),
                "description", Map.of("type", "string", "description", "Option group description, if any"),
                "type", Map.of(
                    "type", "string",
                    "enum", List.of("single_select", "multi_select", "quantity_select")
                ),
                "isRequired", Map.of("type", "boolean", "description", "Whether a choice must be made"),
                "choices", Map.of("type", "array", "items", choice),
                "appliesTo", Map.of(
                    "type", "array",
                    "items", Map.of("type", "string"),
                    "description", "Names of the items this group is offered on"
                )
            ),
            "required", List.of("name", "type", "isRequired", "choices", "appliesTo")
        );

        return Map.of(
            "type", "object",
            "properties", Map.of(
                "categories", Map.of("type", "array", "items", category),
                "optionGroups", Map.of("type", "array", "items", optionGroup),
                "confidence", Map.of(
                    "type", "number",
                    "description", "Confidence in the extraction from 0.0 to 1.0",
                    "minimum", 0.0,
                    "maximum", 1.0
                )
            ),
            "required", List.of("categories", "optionGroups", "confidence")
        );
    }

    public static StructuredOutputSchema asStructuredOutputSchema() {
        return new StructuredOutputSchema(FUNCTION_NAME, FUNCTION_DESCRIPTION, getFunctionSchema());
    }
}
