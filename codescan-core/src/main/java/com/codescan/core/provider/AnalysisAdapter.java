package com.codescan.core.provider;

/**
 * Sends a prompt to an analysis provider and returns its text completion.
 *
 * <p>Implementations must be safe to call from several scan workers at once.
 *
 * @see AnalysisAdapterFactory
 */
public interface AnalysisAdapter {

    /**
     * Submits a prompt.
     *
     * @param prompt full prompt text
     * @return raw completion text
     * @throws ProviderException if the provider cannot be reached, rejects the request,
     *                           times out or returns an unreadable payload
     */
    String analyze(String prompt) throws ProviderException;
}
