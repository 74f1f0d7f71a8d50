package com.reqminer.core.intent;

import com.reqminer.core.model.EntitiesKeywords;
import com.reqminer.core.model.IntentAnalysis;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Derives the analysis focus and framework hints handed to the strategic planner.
 */
public final class PlanningHints {

    private static final Map<String, List<String>> FOCUS_BY_CATEGORY = Map.of(
            IntentCategories.ANALYZE, List.of("data_analysis", "performance_metrics", "trend_identification"),
            IntentCategories.GENERATE, List.of("content_creation", "strategy_development", "solution_design"),
            IntentCategories.PROCESS, List.of("workflow_optimization", "process_improvement", "automation_opportunities"),
            IntentCategories.COLLECT, List.of("data_gathering", "information_consolidation", "source_validation"));

    private static final List<String> FOCUS_ORDER = List.of(
            IntentCategories.ANALYZE, IntentCategories.GENERATE, IntentCategories.PROCESS, IntentCategories.COLLECT);

    private record KeywordGroup(List<String> terms, List<String> frameworks) {}

    private static final List<KeywordGroup> FRAMEWORK_GROUPS = List.of(
            new KeywordGroup(List.of("financial", "revenue", "profit", "cost", "budget"),
                    List.of("Financial Ratio Analysis", "Cost-Benefit Analysis", "ROI Analysis")),
            new KeywordGroup(List.of("performance", "kpi", "metric", "benchmark"),
                    List.of("Performance Gap Analysis", "Balanced Scorecard", "KPI Framework")),
            new KeywordGroup(List.of("market", "customer", "competitor", "segment"),
                    List.of("Market Analysis", "Customer Segmentation", "Competitive Analysis")),
            new KeywordGroup(List.of("strategy", "plan", "roadmap", "vision"),
                    List.of("Strategic Planning", "SWOT Analysis", "Scenario Planning")),
            new KeywordGroup(List.of("process", "workflow", "procedure", "operation"),
                    List.of("Business Process Modeling", "Value Stream Mapping", "Lean Analysis")));

    private static final Map<String, List<String>> FRAMEWORKS_BY_CATEGORY = Map.of(
            IntentCategories.ANALYZE, List.of("Root Cause Analysis", "Data Analysis Framework"),
            IntentCategories.GENERATE, List.of("Content Strategy Framework", "Solution Design Framework"),
            IntentCategories.PROCESS, List.of("Process Optimization Framework", "Workflow Design"));

    private PlanningHints() {}

    public static List<String> analysisFocus(IntentAnalysis intent) {
        var focus = new LinkedHashSet<String>();
        for (String category : FOCUS_ORDER) {
            if (intent.categories().contains(category)) {
                focus.addAll(FOCUS_BY_CATEGORY.get(category));
            }
        }
        String level = intent.complexity() == null ? "medium" : intent.complexity().level();
        if ("high".equals(level)) {
            focus.addAll(List.of("stakeholder_analysis", "risk_assessment", "dependency_mapping"));
        } else if ("medium".equals(level)) {
            focus.addAll(List.of("requirement_analysis", "feasibility_assessment"));
        }
        return List.copyOf(focus);
    }

    public static List<String> frameworkHints(EntitiesKeywords entities, IntentAnalysis intent) {
        String combined = Stream.of(entities.capitalized(), entities.technicalTerms(), entities.actionWords(),
                        entities.numbers(), entities.keywords())
                .flatMap(List::stream)
                .map(s -> s.toLowerCase(Locale.ROOT))
                .reduce("", (a, b) -> a + " " + b);

        var hints = new LinkedHashSet<String>();
        for (KeywordGroup group : FRAMEWORK_GROUPS) {
            if (group.terms().stream().anyMatch(combined::contains)) {
                hints.addAll(group.frameworks());
            }
        }
        for (String category : FOCUS_ORDER) {
            if (FRAMEWORKS_BY_CATEGORY.containsKey(category) && intent.categories().contains(category)) {
                hints.addAll(FRAMEWORKS_BY_CATEGORY.get(category));
            }
        }
        return List.copyOf(hints);
    }
}
