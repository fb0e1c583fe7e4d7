package com.menuvo.menuImport.ai.service;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * AI completion service used by menu extraction.
 * Schema-constrained completion is not available on every model.
 */
public interface AiCompletionService {

    /**
     * Requests output constrained to a JSON schema.
     *
     * @return The parsed JSON output
     * @throws com.menuvo.menuImport.ai.exception.AiServiceException on transport or provider failure
     * @throws com.menuvo.menuImport.ai.exception.AiResponseParseException if no parseable output came back
     */
    JsonNode completeStructured(String model, String systemPrompt, String userPrompt, StructuredOutputSchema schema);

    /**
     * Requests free text output.
     *
     * @return Raw model output, possibly empty
     * @throws com.menuvo.menuImport.ai.exception.AiServiceException on transport or provider failure
     */
    String completeText(String model, String systemPrompt, String userPrompt);
}
