package com.reqminer.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Feedback supplied when resuming a paused session.
 *
 * @param type         the decision being answered; may be null, in which case the pending type applies
 * @param confirmation whether a proposed strategy or blueprint is accepted
 * @param responses    answers to clarification questions, in question order
 * @param adjustments  free-text changes requested when a proposal is rejected
 * @param unknownType  a type name the client sent that matches no {@link FeedbackType}; null otherwise
 */
public record FeedbackPayload(
    FeedbackType type,
    boolean confirmation,
    List<String> responses,
    String adjustments,
    String unknownType
) implements Serializable {

    public FeedbackPayload {
        responses = responses == null ? List.of() : responses.stream().filter(Objects::nonNull).toList();
        adjustments = adjustments == null ? "" : adjustments;
        unknownType = unknownType == null || unknownType.isBlank() ? null : unknownType.trim();
    }

    public FeedbackPayload(FeedbackType type, boolean confirmation, List<String> responses, String adjustments) {
        this(type, confirmation, responses, adjustments, null);
    }

    public static FeedbackPayload clarification(List<String> responses) {
        return new FeedbackPayload(FeedbackType.CLARIFICATION, false, responses, null);
    }

    public static FeedbackPayload confirm(FeedbackType type) {
        return new FeedbackPayload(type, true, List.of(), null);
    }

    public static FeedbackPayload adjust(FeedbackType type, String adjustments) {
        return new FeedbackPayload(type, false, List.of(), adjustments);
    }

    /**
     * Parses a client-supplied type name. A name matching no known type is kept as
     * {@link #unknownType()} rather than read as absent.
     */
    public static FeedbackPayload fromRequest(String rawType, boolean confirmation,
                                              List<String> responses, String adjustments) {
        FeedbackType type = FeedbackType.fromValue(rawType);
        String unknown = type == null ? rawType : null;
        return new FeedbackPayload(type, confirmation, responses, adjustments, unknown);
    }

    public boolean hasAdjustments() {
        return !adjustments.isBlank();
    }

    public boolean hasUnknownType() {
        return unknownType != null;
    }
}
