package com.menuvo.menuImport.comparison.model;

import com.menuvo.menuImport.menu.model.ExtractedItem;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ItemComparison {

    private ExtractedItem extracted;

    /**
     * Id of the matched live item; null when the action is create.
     */
    private String existingId;

    private String existingName;

    private DiffAction action;

    /**
     * Score of the best candidate, 0.0 to 1.0.
     */
    private double matchScore;

    /**
     * Differing fields; only filled when the action is update.
     */
    @Builder.Default
    private List<FieldChange> changes = new ArrayList<>();
}
