package com.reqminer.core.nodes;

import com.reqminer.core.intent.IntentCategories;
import com.reqminer.core.intent.IntentParser;
import com.reqminer.core.intent.RequestHeuristics;
import com.reqminer.core.model.IntentAnalysis;
import com.reqminer.core.model.IntentParseResult;
import com.reqminer.core.model.ServiceStatus;
import com.reqminer.core.state.MiningState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Identifies task categories and assesses request complexity.
 * <p>
 * Categories come from the {@link IntentParser}; when it fails or yields nothing
 * valid, they are extracted from the request text by keyword.
 */
@Component
public class IntentAnalysisNode {

    private static final Logger log = LoggerFactory.getLogger(IntentAnalysisNode.class);

    private final IntentParser intentParser;

    public IntentAnalysisNode(IntentParser intentParser) {
        this.intentParser = intentParser;
    }

    public Map<String, Object> apply(MiningState state) {
        String input = state.userInput();

        List<String> categories;
        String reasoning = "";
        String output = "";
        boolean fromFallback = false;
        try {
            IntentParseResult parsed = intentParser.parse(input, state.context());
            categories = parsed == null ? List.of() : parsed.categories();
            if (parsed != null) {
                reasoning = parsed.reasoning() == null ? "" : parsed.reasoning();
                output = parsed.output() == null ? "" : parsed.output();
            }
        } catch (RuntimeException e) {
            log.warn("Intent parser failed, extracting categories by keyword: {}", e.getMessage());
            categories = List.of();
        }

        if (categories == null || categories.isEmpty()) {
            categories = IntentCategories.extractFromText(input);
            fromFallback = true;
        } else {
            categories = IntentCategories.validate(categories);
        }

        var complexity = RequestHeuristics.assessComplexity(input, categories);
        var analysis = new IntentAnalysis(categories, complexity, reasoning, output, fromFallback);
        log.info("Intent analysis: categories={}, complexity={}", categories, complexity.level());

        return Map.of(
                MiningState.INTENT_ANALYSIS, analysis,
                MiningState.STATUS, ServiceStatus.PROCESSING.name()
        );
    }
}
