package com.menuvo.menuImport.ai.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.menuvo.menuImport.ai.dto.GroqApiRequest;
import com.menuvo.menuImport.ai.dto.GroqApiResponse;
import com.menuvo.menuImport.ai.exception.AiResponseParseException;
import com.menuvo.menuImport.util.LogPreview;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * {@link AiCompletionService} backed by Groq.
 *
 * Schema-constrained output is obtained through forced function calling: the schema becomes
 * the parameters of a single tool and the model must call it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GroqCompletionService implements AiCompletionService {

    private static final String TOOL_CHOICE_REQUIRED = "required";

    private final GroqApiClient groqApiClient;
    private final ObjectMapper objectMapper;

    @Override
    public JsonNode completeStructured(String model, String systemPrompt, String userPrompt,
                                       StructuredOutputSchema schema) {
        GroqApiRequest.Tool tool = GroqApiRequest.Tool.builder()
                .type("function")
                .function(GroqApiRequest.Function.builder()
                        .name(schema.name())
                        .description(schema.description())
                        .parameters(schema.schema())
                        .build())
                .build();

        GroqApiResponse response = groqApiClient.callGroqApiWithTools(
                systemPrompt, userPrompt, List.of(tool), TOOL_CHOICE_REQUIRED, model);

        GroqApiResponse.ToolCall toolCall = response.getToolCalls().stream()
                .filter(call -> call.getFunction() != null && schema.name().equals(call.getFunction().getName()))
                .findFirst()
                .orElseThrow(() -> {
                    log.warn("Groq API did not return the expected function call - model: {}, function: {}",
                            model, schema.name());
                    return new AiResponseParseException();
                });

        String arguments = toolCall.getFunction().getArguments();
        if (arguments == null || arguments.isBlank()) {
            throw new AiResponseParseException();
        }

        try {
            return objectMapper.readTree(arguments);
        } catch (JsonProcessingException e) {
            log.debug("Unparseable function arguments - preview: {}", LogPreview.of(arguments));
            throw new AiResponseParseException(e);
        }
    }

    @Override
    public String completeText(String model, String systemPrompt, String userPrompt) {
        String content = groqApiClient.callGroqApi(systemPrompt, userPrompt, model).getContent();
        return content != null ? content : "";
    }
}
