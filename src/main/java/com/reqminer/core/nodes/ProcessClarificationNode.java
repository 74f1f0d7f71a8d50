package com.reqminer.core.nodes;

import com.reqminer.core.model.ClarificationExchange;
import com.reqminer.core.model.FeedbackPayload;
import com.reqminer.core.model.ServiceStatus;
import com.reqminer.core.model.TranscriptMessage;
import com.reqminer.core.state.MiningState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds clarification answers into the request text before it is classified again.
 */
@Component
public class ProcessClarificationNode {

    private static final Logger log = LoggerFactory.getLogger(ProcessClarificationNode.class);

    public Map<String, Object> apply(MiningState state) {
        List<String> responses = state.userFeedback().map(FeedbackPayload::responses).orElse(List.of())
                .stream().filter(r -> r != null && !r.isBlank()).toList();
        int round = state.currentRound();
        List<String> questions = state.clarificationQuestions();

        var history = new ArrayList<>(state.clarificationHistory());
        for (int i = 0; i < responses.size(); i++) {
            String question = i < questions.size() ? questions.get(i) : "";
            history.add(new ClarificationExchange(round, question, responses.get(i)));
        }

        var updates = new HashMap<String, Object>();
        updates.put(MiningState.CLARIFICATION_HISTORY, List.copyOf(history));
        updates.put(MiningState.CLARIFICATION_QUESTIONS, List.of());
        updates.put(MiningState.FEEDBACK_TYPE, "");
        updates.put(MiningState.STATUS, ServiceStatus.PROCESSING.name());

        if (responses.isEmpty()) {
            log.warn("Clarification feedback for round {} carried no responses", round);
            return updates;
        }

        String joined = String.join("; ", responses);
        updates.put(MiningState.USER_INPUT, enrich(state.userInput(), round, joined));
        updates.put(MiningState.MESSAGES, state.messagesWith(TranscriptMessage.user(joined)));
        log.info("Applied {} clarification response(s) from round {}", responses.size(), round);
        return updates;
    }

    static String enrich(String input, int round, String joinedResponses) {
        return input + "\n\nAdditional clarification (round " + round + "): " + joinedResponses;
    }
}
