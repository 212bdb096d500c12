package com.deepansh.billbot.llm;

import java.util.function.Consumer;

/**
 * Text-generation collaborator: turns accumulated citations into a streamed answer.
 * Each chunk is handed to {@code onChunk} as it arrives; the caller does not
 * inspect chunk semantics.
 */
public interface AnswerGenerator {

    /**
     * Blocks until the answer is complete or the request is cancelled.
     * @throws com.deepansh.billbot.exception.AnswerGenerationException on any failure
     */
    void streamAnswer(AnswerRequest request, Consumer<String> onChunk);

    /** False when no provider is configured; callers then skip answer generation. */
    boolean isEnabled();
}
