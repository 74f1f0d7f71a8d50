package com.reqminer.core.model;

import java.io.Serializable;

/**
 * One answered clarification question.
 */
public record ClarificationExchange(
    int round,
    String question,
    String response
) implements Serializable {}
