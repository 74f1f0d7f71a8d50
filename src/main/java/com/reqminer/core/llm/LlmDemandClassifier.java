package com.reqminer.core.llm;

import com.reqminer.core.classify.DemandClassifier;
import com.reqminer.core.model.DemandAnalysis;
import com.reqminer.core.model.MiningContext;
import org.springframework.stereotype.Component;

/**
 * Classifies request readiness against the SMART criteria with an LLM.
 */
@Component
public class LlmDemandClassifier implements DemandClassifier {

    private static final String SYSTEM_PROMPT = """
            You are a requirements analyst. Assess whether the user's request is ready for planning.
            Evaluate the SMART criteria, each as true or false:
            - specific: the goal and subject are concrete
            - measurable: success can be measured
            - achievable: the request is realistic
            - relevant: the purpose or context is clear
            - time_bound: a timeframe is given
            Then choose demand_state:
            - "SMART_COMPLIANT" when at least four criteria hold and the scope is focused
            - "SMART_LARGE_SCOPE" when the criteria hold but the scope is high complexity or broad
            - "VAGUE_UNCLEAR" otherwise
            When the request is not compliant, list up to three short questions in clarification_needed.
            Describe the scope with complexity (low, medium, high), time_span and domain_breadth (narrow, broad).
            Give a confidence between 0 and 1 and a one-paragraph reasoning.

            Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;

    public LlmDemandClassifier(LlmService llmService) {
        this.llmService = llmService;
    }

    @Override
    public DemandAnalysis classify(String text, MiningContext context) {
        String userPrompt = "Domain: " + context.domain() + "\n\nRequest:\n" + text;
        return llmService.structuredCall(SYSTEM_PROMPT, userPrompt, DemandAnalysis.class);
    }
}
