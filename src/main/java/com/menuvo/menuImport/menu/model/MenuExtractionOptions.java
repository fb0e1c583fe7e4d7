package com.menuvo.menuImport.menu.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Per-run settings for menu extraction.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MenuExtractionOptions {

    private ModelConfig model;

    /**
     * Category names of the live menu, offered to the model so it reuses them.
     */
    @Builder.Default
    private List<String> existingCategoryNames = List.of();

    /**
     * Item names of the live menu, offered to the model so it reuses them.
     */
    @Builder.Default
    private List<String> existingItemNames = List.of();

    /**
     * Id used to correlate log lines of one run (the import job id).
     */
    private String correlationId;
}
