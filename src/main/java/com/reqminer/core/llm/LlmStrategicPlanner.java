package com.reqminer.core.llm;

import com.reqminer.core.model.Blueprint;
import com.reqminer.core.model.ClarificationExchange;
import com.reqminer.core.model.MiningContext;
import com.reqminer.core.model.PlanningContext;
import com.reqminer.core.model.Roadmap;
import com.reqminer.core.planner.StrategicPlanner;
import org.springframework.stereotype.Component;

/**
 * Designs blueprints and roadmaps for complex requests with an LLM.
 */
@Component
public class LlmStrategicPlanner implements StrategicPlanner {

    private static final String PLAN_PROMPT = """
            You are a solution architect. Design a blueprint for the user's problem.
            Use the planning context that follows the problem: intent categories, complexity,
            analysis focus areas, framework hints and earlier clarifications.
            Produce:
            - problem_analysis: a concise analysis of the problem
            - approach: the recommended overall approach
            - recommended_frameworks: analytical or strategic frameworks worth applying
            - key_questions: questions the work must answer
            - risks: the main risks of the approach

            Respond with valid JSON matching the schema provided.
            """;

    private static final String ROADMAP_PROMPT = """
            You are a delivery planner. Turn the confirmed blueprint into an ordered execution roadmap.
            Each step has an order starting at 1, a short title, a description and depends_on,
            listing the orders of the steps it requires. Estimate the total duration.

            Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;

    public LlmStrategicPlanner(LlmService llmService) {
        this.llmService = llmService;
    }

    @Override
    public Blueprint plan(String problem, PlanningContext requirements, MiningContext context) {
        return llmService.structuredCall(PLAN_PROMPT, describe(problem, requirements), Blueprint.class);
    }

    @Override
    public Roadmap generateRoadmap(Blueprint blueprint, MiningContext context) {
        var prompt = new StringBuilder()
                .append("Problem analysis: ").append(blueprint.problemAnalysis()).append('\n')
                .append("Approach: ").append(blueprint.approach()).append('\n');
        if (blueprint.recommendedFrameworks() != null && !blueprint.recommendedFrameworks().isEmpty()) {
            prompt.append("Frameworks: ").append(String.join(", ", blueprint.recommendedFrameworks())).append('\n');
        }
        if (blueprint.keyQuestions() != null && !blueprint.keyQuestions().isEmpty()) {
            prompt.append("Key questions: ").append(String.join("; ", blueprint.keyQuestions())).append('\n');
        }
        return llmService.structuredCall(ROADMAP_PROMPT, prompt.toString(), Roadmap.class);
    }

    static String describe(String problem, PlanningContext requirements) {
        var prompt = new StringBuilder("Problem:\n").append(problem).append("\n\nPlanning context:\n");
        prompt.append("- Domain: ").append(requirements.domain()).append('\n');
        prompt.append("- Demand state: ").append(requirements.demandState()).append('\n');
        prompt.append("- Categories: ").append(String.join(", ", requirements.categories())).append('\n');
        if (requirements.complexity() != null) {
            prompt.append("- Complexity: ").append(requirements.complexity().level()).append('\n');
        }
        if (!requirements.analysisFocus().isEmpty()) {
            prompt.append("- Analysis focus: ").append(String.join(", ", requirements.analysisFocus())).append('\n');
        }
        if (!requirements.frameworkHints().isEmpty()) {
            prompt.append("- Framework hints: ").append(String.join(", ", requirements.frameworkHints())).append('\n');
        }
        for (ClarificationExchange exchange : requirements.clarificationHistory()) {
            prompt.append("- Clarified (round ").append(exchange.round()).append("): ")
                    .append(exchange.question()).append(" -> ").append(exchange.response()).append('\n');
        }
        return prompt.toString();
    }
}
