package com.reqminer.core.llm;

import com.reqminer.core.intent.IntentParser;
import com.reqminer.core.model.IntentParseResult;
import com.reqminer.core.model.MiningContext;
import org.springframework.stereotype.Component;

/**
 * Identifies the task categories of a request with an LLM.
 */
@Component
public class LlmIntentParser implements IntentParser {

    private static final String SYSTEM_PROMPT = """
            You are an intent parser. Identify which task categories the user's request needs.
            Allowed categories:
            - "answer": respond to a question directly
            - "collect": gather data or information
            - "process": transform, clean or organise data
            - "analyze": examine data for patterns, metrics or insight
            - "generate": produce content, plans or solutions
            Return every category that applies, most important first, with a short reasoning.
            Put a one-sentence restatement of the request in output.

            Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;

    public LlmIntentParser(LlmService llmService) {
        this.llmService = llmService;
    }

    @Override
    public IntentParseResult parse(String text, MiningContext context) {
        return llmService.structuredCall(SYSTEM_PROMPT, text, IntentParseResult.class);
    }
}
