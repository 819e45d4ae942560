package com.phillippitts.aibakeoff.service.provider;

import com.phillippitts.aibakeoff.domain.Provider;
import com.phillippitts.aibakeoff.domain.TranslationPair;
import com.phillippitts.aibakeoff.exception.ProviderException;

/**
 * Contract for chat-completion providers benchmarked on translation.
 *
 * <p>Implementations issue one blocking request per call and must be safe for concurrent use.
 */
public interface TranslationProvider {

    /**
     * Returns the vendor identity used to tag measurement records.
     */
    Provider provider();

    /**
     * Returns whether the credential required by this provider is present.
     *
     * <p>Optional baseline providers that are not configured are skipped by the scenario
     * runners instead of being counted as failures.
     */
    boolean isConfigured();

    /**
     * Translates {@code pair.text()} from {@code pair.source()} to {@code pair.target()}.
     *
     * @param pair input text and language pair
     * @return translated text and optional token usage
     * @throws ProviderException if the credential is missing, the response is not 2xx,
     *         or the body cannot be parsed
     */
    TranslationResult translate(TranslationPair pair);
}
