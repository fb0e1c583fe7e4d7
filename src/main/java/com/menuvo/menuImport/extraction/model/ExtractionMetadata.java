package com.menuvo.menuImport.extraction.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Facts about the source document gathered while extracting its text.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ExtractionMetadata {

    /**
     * Data rows (spreadsheet rows below the header row, or delimited rows). Null for free text.
     */
    private Integer rowCount;

    /**
     * Sheet names in workbook order. Spreadsheets only.
     */
    private List<String> sheetNames;

    /**
     * Column headers. Tabular text only.
     */
    private List<String> headers;

    /**
     * Whether the text was cut at {@code TextExtractionService.MAX_TEXT_LENGTH}.
     */
    private boolean truncated;
}
