package com.reqminer.core.intent;

import com.reqminer.core.model.ComplexityAssessment;
import com.reqminer.core.model.EntitiesKeywords;
import com.reqminer.core.model.ExecutionStrategy;
import com.reqminer.core.model.QuestionType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Deterministic text heuristics that support intent analysis and the simple planning path.
 */
public final class RequestHeuristics {

    private static final List<String> CONJUNCTIONS = List.of("and", "or", "but", "also", "then");

    private static final Map<String, List<String>> QUESTION_INDICATORS = new LinkedHashMap<>();

    static {
        QUESTION_INDICATORS.put("factual", List.of("what is", "define", "who is", "when did", "where is"));
        QUESTION_INDICATORS.put("procedural", List.of("how to", "how do", "steps to", "process of"));
        QUESTION_INDICATORS.put("causal", List.of("why", "because", "reason", "cause"));
        QUESTION_INDICATORS.put("comparative", List.of("compare", "difference", "versus", "better"));
        QUESTION_INDICATORS.put("analytical", List.of("analyze", "evaluate", "assess", "examine"));
        QUESTION_INDICATORS.put("creative", List.of("create", "design", "imagine", "brainstorm"));
    }

    private static final List<String> QUESTION_MARKERS = List.of("?", "what", "how", "why", "when", "where", "who");

    private static final Map<String, String> AGENT_FOR_CATEGORY = Map.of(
            IntentCategories.ANSWER, "researcher",
            IntentCategories.COLLECT, "researcher",
            IntentCategories.PROCESS, "analyst",
            IntentCategories.ANALYZE, "analyst",
            IntentCategories.GENERATE, "writer");

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for",
            "of", "with", "by", "is", "are", "was", "were", "be", "been", "have",
            "has", "had", "do", "does", "did", "will", "would", "could", "should");

    private static final int MAX_KEYWORDS = 10;

    private RequestHeuristics() {}

    // ── Complexity ───────────────────────────────────────────────────

    public static ComplexityAssessment assessComplexity(String text, List<String> categories) {
        String lower = text.toLowerCase(Locale.ROOT);
        int wordCount = words(text).size();
        int questionMarks = (int) text.chars().filter(c -> c == '?').count();
        int conjunctions = (int) CONJUNCTIONS.stream().filter(lower::contains).count();

        var factors = new LinkedHashMap<String, Integer>();
        factors.put("category_count", categories.size());
        factors.put("text_length", text.length());
        factors.put("word_count", wordCount);
        factors.put("question_marks", questionMarks);
        factors.put("conjunctions", conjunctions);

        double score = 0.0;
        if (categories.size() > 1) {
            score += 0.3;
        }
        if (wordCount > 20) {
            score += 0.2;
        } else if (wordCount > 10) {
            score += 0.1;
        }
        if (questionMarks > 1) {
            score += 0.2;
        }
        score += 0.1 * Math.min(conjunctions, 3);

        String level = score > 0.6 ? "high" : score > 0.3 ? "medium" : "low";
        String effort = score > 0.7 ? "high" : score > 0.4 ? "medium" : "low";
        return new ComplexityAssessment(level, Math.min(score, 1.0), Map.copyOf(factors), effort,
                recommendationsFor(level));
    }

    static List<String> recommendationsFor(String level) {
        return switch (level) {
            case "low" -> List.of(
                    "Single agent execution should be sufficient",
                    "Direct processing recommended");
            case "medium" -> List.of(
                    "Consider breaking into subtasks",
                    "May benefit from specialized agents",
                    "Monitor execution progress");
            case "high" -> List.of(
                    "Decompose into multiple subtasks",
                    "Use multiple specialized agents",
                    "Implement step-by-step execution",
                    "Consider workflow orchestration");
            default -> List.of();
        };
    }

    // ── Question type ────────────────────────────────────────────────

    public static QuestionType classifyQuestionType(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        var scores = new LinkedHashMap<String, Double>();
        QUESTION_INDICATORS.forEach((type, indicators) -> {
            long matches = indicators.stream().filter(lower::contains).count();
            if (matches > 0) {
                scores.put(type, Math.min((double) matches / indicators.size(), 1.0));
            }
        });
        if (scores.isEmpty()) {
            scores.put("factual", 0.5);
        }

        String primary = null;
        double best = -1;
        for (var entry : scores.entrySet()) {
            if (entry.getValue() > best) {
                primary = entry.getKey();
                best = entry.getValue();
            }
        }
        boolean isQuestion = QUESTION_MARKERS.stream().anyMatch(lower::contains);
        return new QuestionType(primary, best, Map.copyOf(scores), isQuestion);
    }

    // ── Execution strategy ───────────────────────────────────────────

    public static ExecutionStrategy suggestExecutionStrategy(List<String> categories, ComplexityAssessment complexity) {
        String level = complexity == null ? "low" : complexity.level();
        var agents = new LinkedHashSet<String>();
        for (String category : categories) {
            agents.add(AGENT_FOR_CATEGORY.getOrDefault(category, "researcher"));
        }

        String mode = "sequential";
        int steps = categories.size();
        boolean parallel = false;
        boolean workflow = false;
        var notes = new ArrayList<String>();

        if ("high".equals(level)) {
            mode = "workflow";
            workflow = true;
            steps = categories.size() * 2;
        } else if ("medium".equals(level) && categories.size() > 2) {
            mode = "parallel";
            parallel = true;
        }

        if (categories.contains(IntentCategories.COLLECT) && categories.contains(IntentCategories.ANALYZE)) {
            mode = "sequential";
            notes.add("Data collection must precede analysis");
        }
        if (categories.contains(IntentCategories.PROCESS) && categories.contains(IntentCategories.GENERATE)) {
            mode = "sequential";
            notes.add("Data processing should precede content generation");
        }

        return new ExecutionStrategy(mode, List.copyOf(agents), steps, parallel, workflow, List.copyOf(notes));
    }

    // ── Entities and keywords ────────────────────────────────────────

    public static EntitiesKeywords extractEntitiesAndKeywords(String text) {
        List<String> originalWords = words(text);
        List<String> lowerWords = originalWords.stream().map(w -> w.toLowerCase(Locale.ROOT)).toList();

        var keywords = new ArrayList<String>();
        for (String word : lowerWords) {
            if (!STOP_WORDS.contains(word) && word.length() > 2) {
                keywords.add(stripPunctuation(word));
            }
        }

        List<String> numbers = lowerWords.stream().filter(w -> w.chars().allMatch(Character::isDigit)).toList();
        List<String> capitalized = originalWords.stream()
                .filter(w -> w.length() > 1 && Character.isUpperCase(w.charAt(0)))
                .toList();
        List<String> technical = keywords.stream().filter(w -> w.length() > 6).toList();
        List<String> actions = keywords.stream()
                .filter(w -> w.endsWith("ing") || w.endsWith("ed") || w.endsWith("er") || w.endsWith("ly"))
                .toList();

        int unique = new LinkedHashSet<>(lowerWords).size();
        double complexityScore = lowerWords.isEmpty() ? 0.0 : (double) unique / lowerWords.size();

        return new EntitiesKeywords(
                List.copyOf(keywords.subList(0, Math.min(MAX_KEYWORDS, keywords.size()))),
                numbers, capitalized, technical, actions,
                lowerWords.size(), unique, complexityScore);
    }

    private static List<String> words(String text) {
        String trimmed = text == null ? "" : text.trim();
        return trimmed.isEmpty() ? List.of() : Arrays.asList(trimmed.split("\\s+"));
    }

    private static String stripPunctuation(String word) {
        int start = 0;
        int end = word.length();
        while (start < end && ".,!?;:".indexOf(word.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && ".,!?;:".indexOf(word.charAt(end - 1)) >= 0) {
            end--;
        }
        return word.substring(start, end);
    }
}
