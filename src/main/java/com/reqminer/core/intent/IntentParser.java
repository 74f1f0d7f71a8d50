package com.reqminer.core.intent;

import com.reqminer.core.model.IntentParseResult;
import com.reqminer.core.model.MiningContext;

/**
 * Extracts candidate task categories (answer, collect, process, analyze, generate) from a request.
 */
public interface IntentParser {

    IntentParseResult parse(String text, MiningContext context);
}
