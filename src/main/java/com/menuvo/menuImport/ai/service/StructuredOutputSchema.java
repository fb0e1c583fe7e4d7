package com.menuvo.menuImport.ai.service;

import java.util.Map;

/**
 * JSON schema a structured completion must conform to.
 *
 * @param name Identifier of the schema (function name on the wire)
 * @param description What the output represents, shown to the model
 * @param schema JSON schema as nested maps and lists
 */
public record StructuredOutputSchema(String name, String description, Map<String, Object> schema) {
}
