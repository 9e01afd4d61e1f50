package com.raditha.similarity.ai;

import java.io.IOException;

/**
 * Single-shot access to a language model: a prompt goes in, free text comes
 * out. Callers must not assume the reply is well formed and are responsible
 * for limiting how many calls they make at once.
 */
@FunctionalInterface
public interface SemanticJudge {

    /**
     * Ask the model.
     *
     * @param prompt Complete prompt text
     * @return The model's reply text
     * @throws IOException          on transport or service failures
     * @throws InterruptedException if the calling thread is interrupted
     */
    String judge(String prompt) throws IOException, InterruptedException;
}
