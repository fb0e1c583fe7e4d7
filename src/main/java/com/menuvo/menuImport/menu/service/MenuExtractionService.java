package com.menuvo.menuImport.menu.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.menuvo.menuImport.ai.service.AiCompletionService;
import com.menuvo.menuImport.guard.model.SanitizationResult;
import com.menuvo.menuImport.guard.service.ContentModerationService;
import com.menuvo.menuImport.guard.service.PromptSanitizer;
import com.menuvo.menuImport.menu.model.ExtractedCategory;
import com.menuvo.menuImport.menu.model.ExtractedMenuData;
import com.menuvo.menuImport.menu.model.MenuExtractionFunctionDefinition;
import com.menuvo.menuImport.menu.model.MenuExtractionOptions;
import com.menuvo.menuImport.menu.model.ModelConfig;
import com.menuvo.menuImport.menu.prompt.MenuExtractionPrompt;
import com.menuvo.menuImport.menu.util.TextChunker;
import com.menuvo.menuImport.util.LogPreview;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Menu extraction engine - turns extracted document text into {@link ExtractedMenuData}.
 *
 * Responsibilities:
 * - Split long text into line-aligned chunks
 * - Sanitize each chunk and wrap it in the menu content delimiter
 * - Call the AI service per chunk (schema-constrained or free-text, by model capability)
 * - Merge chunk results, moderate content, re-stamp item category names
 *
 * Chunks are processed one after another. No retries: AI failures propagate to the caller.
 */
@Slf4j
@Service
public class MenuExtractionService {

    public static final int DEFAULT_CHUNK_SIZE = 50_000;

    private final AiCompletionService aiCompletionService;
    private final PromptSanitizer promptSanitizer;
    private final MenuResponseNormalizer responseNormalizer;
    private final ContentModerationService contentModerationService;
    private final int chunkSize;

    public MenuExtractionService(AiCompletionService aiCompletionService,
                                 PromptSanitizer promptSanitizer,
                                 MenuResponseNormalizer responseNormalizer,
                                 ContentModerationService contentModerationService,
                                 @Value("${menu-import.extraction.chunk-size:" + DEFAULT_CHUNK_SIZE + "}") int chunkSize) {
        this.aiCompletionService = aiCompletionService;
        this.promptSanitizer = promptSanitizer;
        this.responseNormalizer = responseNormalizer;
        this.contentModerationService = contentModerationService;
        this.chunkSize = chunkSize;
    }

    /**
     * Extracts structured menu data from text.
     *
     * @param text Document text, already bounded by the text extraction step
     * @param options Model and existing-name context
     * @return Moderated menu data whose items carry their category's name
     * @throws com.menuvo.menuImport.ai.exception.AiResponseParseException if a chunk's output cannot be parsed
     * @throws com.menuvo.menuImport.ai.exception.AiServiceException if the AI service call fails
     */
    public ExtractedMenuData extractMenu(String text, MenuExtractionOptions options) {
        String correlationId = options.getCorrelationId();
        ModelConfig model = options.getModel();

        List<String> chunks = TextChunker.split(text, chunkSize);
        if (chunks.isEmpty()) {
            log.warn("No menu text to extract - correlationId: {}", correlationId);
            return ExtractedMenuData.builder().confidence(0.0).build();
        }

        log.debug("Step MENU_EXTRACT - correlationId: {}, model: {}, structured: {}, textLength: {}, chunks: {}",
                correlationId, model.id(), model.supportsStructuredOutput(), text.length(), chunks.size());

        List<ExtractedMenuData> extractions = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            extractions.add(extractChunk(chunks.get(i), i, options));
        }

        ExtractedMenuData extraction = extractions.size() == 1
                ? extractions.get(0)
                : MenuExtractionMerger.merge(extractions);

        ExtractedMenuData result = restampCategoryNames(contentModerationService.moderate(extraction));

        log.info("Menu extracted - correlationId: {}, categories: {}, items: {}, optionGroups: {}, confidence: {}",
                correlationId, result.getCategories().size(), result.itemCount(),
                result.getOptionGroups().size(), result.getConfidence());

        return result;
    }

    private ExtractedMenuData extractChunk(String chunk, int chunkIndex, MenuExtractionOptions options) {
        String correlationId = options.getCorrelationId();
        ModelConfig model = options.getModel();

        SanitizationResult sanitization = promptSanitizer.sanitize(chunk);
        if (sanitization.isSuspicious()) {
            log.warn("Suspicious content detected in menu file - potential prompt injection attempt - "
                            + "correlationId: {}, chunk: {}, preview: {}",
                    correlationId, chunkIndex + 1, LogPreview.of(chunk));
        }

        String userPrompt = MenuExtractionPrompt.buildUserPrompt(
                sanitization.getSanitized(),
                options.getExistingCategoryNames(),
                options.getExistingItemNames());

        log.debug("Calling AI for chunk {} - correlationId: {}, promptLength: {}",
                chunkIndex + 1, correlationId, userPrompt.length());

        if (model.supportsStructuredOutput()) {
            JsonNode structured = aiCompletionService.completeStructured(
                    model.id(),
                    MenuExtractionPrompt.SYSTEM_PROMPT,
                    userPrompt,
                    MenuExtractionFunctionDefinition.asStructuredOutputSchema());
            return responseNormalizer.normalize(structured);
        }

        String content = aiCompletionService.completeText(model.id(), MenuExtractionPrompt.SYSTEM_PROMPT, userPrompt);
        log.debug("AI raw response - correlationId: {}, chunk: {}, preview: {}",
                correlationId, chunkIndex + 1, LogPreview.of(content));
        return responseNormalizer.parse(content);
    }

    private static ExtractedMenuData restampCategoryNames(ExtractedMenuData data) {
        List<ExtractedCategory> categories = data.getCategories().stream()
                .map(category -> category.toBuilder()
                        .items(category.getItems().stream()
                                .map(item -> item.toBuilder().categoryName(category.getName()).build())
                                .toList())
                        .build())
                .toList();
        return data.toBuilder().categories(categories).build();
    }
}
