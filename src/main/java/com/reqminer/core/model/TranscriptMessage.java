package com.reqminer.core.model;

import java.io.Serializable;

/**
 * One entry of a session transcript.
 */
public record TranscriptMessage(String role, String content) implements Serializable {

    public static final String ASSISTANT = "assistant";
    public static final String USER = "user";

    public static TranscriptMessage assistant(String content) {
        return new TranscriptMessage(ASSISTANT, content);
    }

    public static TranscriptMessage user(String content) {
        return new TranscriptMessage(USER, content);
    }
}
