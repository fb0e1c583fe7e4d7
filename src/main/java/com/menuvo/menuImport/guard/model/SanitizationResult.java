package com.menuvo.menuImport.guard.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of neutralizing prompt injection patterns in untrusted menu text.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SanitizationResult {

    /**
     * Input text with every injection pattern replaced by a placeholder.
     */
    private String sanitized;

    /**
     * Whether at least one injection pattern was found.
     * Audit signal only; processing continues on the sanitized text.
     */
    private boolean suspicious;
}
