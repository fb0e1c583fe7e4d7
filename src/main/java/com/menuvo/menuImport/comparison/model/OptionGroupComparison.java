package com.menuvo.menuImport.comparison.model;

import com.menuvo.menuImport.menu.model.ExtractedOptionGroup;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OptionGroupComparison {

    private ExtractedOptionGroup extracted;

    private String existingId;

    private String existingName;

    private DiffAction action;

    private double matchScore;
}
