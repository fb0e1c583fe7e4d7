package com.menuvo.menuImport.job.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of applying a reviewed import.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ApplyChangesResult {

    private boolean success;

    private AppliedCounts applied;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AppliedCounts {
        private int categories;
        private int items;
        private int optionGroups;
    }
}
