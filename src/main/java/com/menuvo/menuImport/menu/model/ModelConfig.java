package com.menuvo.menuImport.menu.model;

/**
 * Model used for extraction and whether it can be forced to answer in a fixed JSON schema.
 */
public record ModelConfig(String id, boolean supportsStructuredOutput) {
}
