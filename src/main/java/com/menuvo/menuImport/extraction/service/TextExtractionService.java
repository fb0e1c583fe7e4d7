package com.menuvo.menuImport.extraction.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.menuvo.menuImport.extraction.exception.TextExtractionException;
import com.menuvo.menuImport.extraction.model.ExtractionMetadata;
import com.menuvo.menuImport.extraction.model.MenuFileType;
import com.menuvo.menuImport.extraction.model.TextExtractionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Text extraction adapter - turns the raw bytes of a menu file into plain text for the AI step.
 *
 * Responsibilities:
 * - Render spreadsheets sheet by sheet as comma-delimited blocks under "## Sheet:" headers
 * - Render delimited text as a "header / separator / rows" table
 * - Pretty-print structured data (JSON)
 * - Pass free text and markdown through, trimmed
 * - Cap the output at {@link #MAX_TEXT_LENGTH} characters and flag truncation
 *
 * No I/O and no shared mutable state: identical bytes always yield identical text.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TextExtractionService {

    /**
     * Upper bound on text forwarded to the AI step.
     */
    public static final int MAX_TEXT_LENGTH = 200_000;

    private static final String TABLE_SEPARATOR = "-".repeat(50);

    private static final CsvMapper CSV_MAPPER = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    private final ObjectMapper objectMapper;

    /**
     * Extracts text from a file whose format is given as a free-form string.
     *
     * @throws com.menuvo.menuImport.extraction.exception.UnsupportedFormatException if the format is unknown
     */
    public TextExtractionResult extract(byte[] content, String declaredFormat) {
        return extract(content, MenuFileType.fromValue(declaredFormat));
    }

    /**
     * Extracts text from a file of a known format.
     *
     * @param content Raw file bytes
     * @param fileType Declared format
     * @return Extracted text, never longer than {@link #MAX_TEXT_LENGTH}
     * @throws TextExtractionException if the bytes cannot be read as the declared format
     */
    public TextExtractionResult extract(byte[] content, MenuFileType fileType) {
        TextExtractionResult result = switch (fileType) {
            case XLSX -> extractFromSpreadsheet(content);
            case CSV -> extractFromDelimitedText(content);
            case JSON -> extractFromJson(content);
            case MD, TXT -> extractFromText(content);
        };

        return truncate(result);
    }

    private TextExtractionResult truncate(TextExtractionResult result) {
        String text = result.getText();
        if (text.length() <= MAX_TEXT_LENGTH) {
            return result;
        }

        log.warn("Menu text truncated due to size limit - originalLength: {}, maxLength: {}",
                text.length(), MAX_TEXT_LENGTH);

        int cut = MAX_TEXT_LENGTH;
        if (Character.isHighSurrogate(text.charAt(cut - 1))) {
            cut--;
        }

        return result.toBuilder()
                .text(text.substring(0, cut))
                .metadata(result.getMetadata().toBuilder().truncated(true).build())
                .build();
    }

    private TextExtractionResult extractFromSpreadsheet(byte[] content) {
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(content))) {
            DataFormatter formatter = new DataFormatter();
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();

            StringBuilder fullText = new StringBuilder();
            List<String> sheetNames = new ArrayList<>();
            int totalRows = 0;

            for (Sheet sheet : workbook) {
                sheetNames.add(sheet.getSheetName());
                fullText.append("## Sheet: ").append(sheet.getSheetName()).append('\n');

                int width = 0;
                for (Row row : sheet) {
                    width = Math.max(width, row.getLastCellNum());
                }

                boolean headerSeen = false;
                for (int r = Math.max(0, sheet.getFirstRowNum()); r <= sheet.getLastRowNum(); r++) {
                    Row row = sheet.getRow(r);
                    List<String> values = new ArrayList<>(width);
                    for (int c = 0; c < width; c++) {
                        Cell cell = row != null ? row.getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL) : null;
                        values.add(cell != null ? formatter.formatCellValue(cell, evaluator) : "");
                    }

                    boolean blank = values.stream().allMatch(String::isBlank);
                    if (!blank) {
                        if (headerSeen) {
                            totalRows++;
                        }
                        headerSeen = true;
                    }
                    fullText.append(toCsvLine(values)).append('\n');
                }
                fullText.append("\n\n");
            }

            return TextExtractionResult.builder()
                    .text(fullText.toString().strip())
                    .metadata(ExtractionMetadata.builder()
                            .rowCount(totalRows)
                            .sheetNames(sheetNames)
                            .build())
                    .build();

        } catch (IOException | RuntimeException e) {
            throw new TextExtractionException("Failed to read spreadsheet: " + e.getMessage(), e);
        }
    }

    private TextExtractionResult extractFromDelimitedText(byte[] content) {
        List<String[]> rows;
        try (MappingIterator<String[]> iterator = CSV_MAPPER.readerFor(String[].class).readValues(decode(content))) {
            rows = iterator.readAll();
        } catch (IOException | RuntimeException e) {
            throw new TextExtractionException("Failed to read delimited text: " + e.getMessage(), e);
        }

        List<String> headers = rows.isEmpty() ? List.of() : Arrays.stream(rows.get(0)).map(String::trim).toList();

        StringBuilder text = new StringBuilder();
        text.append(String.join(" | ", headers)).append('\n');
        text.append(TABLE_SEPARATOR).append('\n');

        for (String[] row : rows.subList(Math.min(1, rows.size()), rows.size())) {
            List<String> values = new ArrayList<>(headers.size());
            for (int i = 0; i < headers.size(); i++) {
                values.add(i < row.length && row[i] != null ? row[i] : "");
            }
            text.append(String.join(" | ", values)).append('\n');
        }

        return TextExtractionResult.builder()
                .text(text.toString().strip())
                .metadata(ExtractionMetadata.builder()
                        .rowCount(Math.max(0, rows.size() - 1))
                        .headers(headers)
                        .build())
                .build();
    }

    private TextExtractionResult extractFromJson(byte[] content) {
        try {
            JsonNode data = objectMapper.readTree(decode(content));
            if (data == null || data.isMissingNode()) {
                throw new TextExtractionException("Failed to read JSON: document is empty", null);
            }
            return TextExtractionResult.builder()
                    .text(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(data))
                    .metadata(new ExtractionMetadata())
                    .build();
        } catch (JsonProcessingException e) {
            throw new TextExtractionException("Failed to read JSON: " + e.getOriginalMessage(), e);
        }
    }

    private TextExtractionResult extractFromText(byte[] content) {
        return TextExtractionResult.builder()
                .text(decode(content).strip())
                .metadata(new ExtractionMetadata())
                .build();
    }

    private static String decode(byte[] content) {
        String text = new String(content, StandardCharsets.UTF_8);
        return text.startsWith("\uFEFF") ? text.substring(1) : text;
    }

    private static String toCsvLine(List<String> values) {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                line.append(',');
            }
            String value = values.get(i);
            if (value.indexOf(',') >= 0 || value.indexOf('"') >= 0 || value.indexOf('\n') >= 0) {
                line.append('"').append(value.replace("\"", "\"\"")).append('"');
            } else {
                line.append(value);
            }
        }
        return line.toString();
    }
}
