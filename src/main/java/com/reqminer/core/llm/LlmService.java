package com.reqminer.core.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Wraps Spring AI's {@link ChatClient} to produce structured (typed) output from LLM calls.
 * <p>
 * Uses {@link BeanOutputConverter} to derive a JSON schema from the target class,
 * append format instructions to the user prompt, and deserialize the response.
 * When the converter rejects the response, a lenient Jackson parse is attempted.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private static final ObjectMapper LENIENT_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true)
            .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
            .configure(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_AS_NULL, true)
            .registerModule(new ParameterNamesModule());

    private final ChatClient chatClient;

    public LlmService(ChatClient.Builder builder,
                      @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this.chatClient = builder.build();
        log.info("LlmService initialized with OpenAI base-url: {}", baseUrl);
    }

    /**
     * Sends a system + user prompt to the LLM and returns the response
     * deserialized into the given {@code outputType}.
     *
     * @throws LlmEmptyResponseException if the model returned no content
     * @throws LlmParseException         if the content matches neither the converter nor lenient parsing
     */
    public <T> T structuredCall(String systemPrompt, String userPrompt, Class<T> outputType) {
        log.info("LLM call started for {}", outputType.getSimpleName());
        long start = System.currentTimeMillis();
        var converter = new BeanOutputConverter<>(outputType);
        String response = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt + "\n\n" + converter.getFormat())
                .call()
                .content();
        long elapsed = System.currentTimeMillis() - start;
        log.info("LLM call complete for {} ({}s)", outputType.getSimpleName(), String.format("%.1f", elapsed / 1000.0));

        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content for " + outputType.getSimpleName());
        }
        try {
            return converter.convert(response);
        } catch (RuntimeException e) {
            log.warn("Converter rejected LLM response for {}: {}", outputType.getSimpleName(), e.getMessage());
            log.debug("Raw LLM response: {}", response);
            return parseLeniently(response, outputType);
        }
    }

    static <T> T parseLeniently(String json, Class<T> outputType) {
        String cleaned = stripCodeFence(json);
        try {
            T result = LENIENT_MAPPER.readValue(cleaned, outputType);
            log.info("Lenient parsing succeeded for {}", outputType.getSimpleName());
            return result;
        } catch (Exception e) {
            log.error("Lenient parsing failed for {}: {}", outputType.getSimpleName(), e.getMessage());
            throw new LlmParseException("Failed to parse LLM response to " + outputType.getSimpleName()
                    + ": " + e.getMessage(), e);
        }
    }

    static String stripCodeFence(String json) {
        String cleaned = json.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }
}
