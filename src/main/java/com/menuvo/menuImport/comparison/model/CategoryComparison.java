package com.menuvo.menuImport.comparison.model;

import com.menuvo.menuImport.menu.model.ExtractedCategory;
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
public class CategoryComparison {

    private ExtractedCategory extracted;

    private String existingId;

    private String existingName;

    private DiffAction action;

    private double matchScore;

    @Builder.Default
    private List<ItemComparison> items = new ArrayList<>();
}
