package com.menuvo.menuImport.ai.service;

import com.menuvo.menuImport.ai.dto.GroqApiRequest;
import com.menuvo.menuImport.ai.dto.GroqApiResponse;
import com.menuvo.menuImport.ai.exception.AiServiceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;

/**
 * Client for interacting with Groq API.
 * Handles HTTP communication with Groq's chat completions endpoint.
 * No retries: callers decide whether a failed call is worth repeating.
 */
@Slf4j
@Service
public class GroqApiClient {

    public static final String DEFAULT_API_URL = "https://api.groq.com/openai/v1/chat/completions";

    private final RestClient restClient;
    private final String apiKey;
    private final Double temperature;
    private final Integer maxCompletionTokens;

    public GroqApiClient(RestClient.Builder restClientBuilder,
                         @Value("${groq.api.url:" + DEFAULT_API_URL + "}") String apiUrl,
                         @Value("${groq.api.key:}") String apiKey,
                         @Value("${groq.api.temperature:0.1}") Double temperature,
                         @Value("${groq.api.max-completion-tokens:8192}") Integer maxCompletionTokens) {
        this.restClient = restClientBuilder
                .baseUrl(apiUrl)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.apiKey = apiKey;
        this.temperature = temperature;
        this.maxCompletionTokens = maxCompletionTokens;
    }

    /**
     * Calls Groq API with a system prompt and a user message.
     *
     * @param systemPrompt System prompt for the task
     * @param userMessage User message to process
     * @param model Model to use for the API call
     * @return GroqApiResponse with the result
     * @throws AiServiceException if the API key is missing or the call fails
     */
    public GroqApiResponse callGroqApi(String systemPrompt, String userMessage, String model) {
        return execute(buildRequest(systemPrompt, userMessage, model).build());
    }

    /**
     * Calls Groq API with function calling support.
     *
     * @param systemPrompt System prompt for the task
     * @param userMessage User message to process
     * @param tools List of tools (functions) available to the model
     * @param toolChoice Tool choice strategy ("none", "auto" or "required")
     * @param model Model to use for the API call
     * @return GroqApiResponse with the result
     * @throws AiServiceException if the API key is missing or the call fails
     */
    public GroqApiResponse callGroqApiWithTools(String systemPrompt, String userMessage,
                                                List<GroqApiRequest.Tool> tools, String toolChoice, String model) {
        GroqApiRequest request = buildRequest(systemPrompt, userMessage, model)
                .tools(tools)
                .toolChoice(toolChoice != null ? toolChoice : "auto")
                .build();
        return execute(request);
    }

    private GroqApiRequest.GroqApiRequestBuilder buildRequest(String systemPrompt, String userMessage, String model) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new AiServiceException("Groq API key is not configured. Set groq.api.key in application.yaml");
        }
        if (model == null || model.isBlank()) {
            throw new AiServiceException("No model configured for the Groq API call");
        }

        return GroqApiRequest.builder()
                .messages(List.of(
                        GroqApiRequest.Message.builder()
                                .role("system")
                                .content(systemPrompt)
                                .build(),
                        GroqApiRequest.Message.builder()
                                .role("user")
                                .content(userMessage)
                                .build()
                ))
                .model(model)
                .temperature(temperature)
                .maxCompletionTokens(maxCompletionTokens)
                .topP(1.0)
                .stream(false);
    }

    private GroqApiResponse execute(GroqApiRequest request) {
        log.debug("Calling Groq API - model: {}, message length: {}, tools: {}",
                request.getModel(),
                request.getMessages().get(1).getContent().length(),
                request.getTools() != null ? request.getTools().size() : 0);

        GroqApiResponse response;
        try {
            response = restClient.post()
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .body(request)
                    .retrieve()
                    .body(GroqApiResponse.class);
        } catch (RestClientException e) {
            log.error("Error calling Groq API - model: {}", request.getModel(), e);
            throw new AiServiceException("Failed to call Groq API: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new AiServiceException("Groq API returned null response");
        }

        log.debug("Groq API response received - model: {}, tokens used: {}, hasToolCalls: {}",
                response.getModel(), response.getTotalTokens(), response.hasToolCalls());

        return response;
    }
}
