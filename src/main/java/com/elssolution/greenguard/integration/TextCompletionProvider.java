package com.elssolution.greenguard.integration;

import java.io.IOException;
import java.time.Duration;

/** Blocking text-generation call used by the AI classifier. */
public interface TextCompletionProvider {

    boolean isConfigured();

    /**
     * @return raw model text
     * @throws IOException on transport errors, timeouts and non-2xx answers
     * @throws InterruptedException if the calling run was cancelled
     */
    String complete(String prompt, Duration timeout) throws IOException, InterruptedException;
}
