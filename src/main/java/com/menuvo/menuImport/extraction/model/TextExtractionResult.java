package com.menuvo.menuImport.extraction.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Plain text extracted from a menu file, ready for AI structuring.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class TextExtractionResult {

    private String text;

    private ExtractionMetadata metadata;

    public boolean isTruncated() {
        return metadata != null && metadata.isTruncated();
    }
}
