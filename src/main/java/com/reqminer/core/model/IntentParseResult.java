package com.reqminer.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Raw output of the intent parser: candidate task categories and its rationale.
 */
public record IntentParseResult(
    List<String> categories,
    String reasoning,
    String output
) implements Serializable {}
