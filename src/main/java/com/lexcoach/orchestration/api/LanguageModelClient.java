package com.lexcoach.orchestration.api;

import com.lexcoach.orchestration.exception.ProviderTimeoutException;
import com.lexcoach.orchestration.exception.ProviderUnavailableException;

/**
 * Boundary to the language model. Prompt wording and provider selection live behind this interface.
 */
public interface LanguageModelClient {

    /**
     * Sends one instruction with its structured context and returns the raw text reply.
     *
     * @param purpose a short label used for logging (e.g. "plan", "respond").
     * @param instruction the system instruction.
     * @param context the user-side context, already rendered to text.
     * @return the model reply, possibly empty.
     * @throws ProviderUnavailableException if the provider rejected or failed the call.
     * @throws ProviderTimeoutException if the provider did not answer in time.
     */
    String complete(String purpose, String instruction, String context);
}
