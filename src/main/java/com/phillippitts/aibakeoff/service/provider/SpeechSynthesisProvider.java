package com.phillippitts.aibakeoff.service.provider;

import com.phillippitts.aibakeoff.domain.Provider;
import com.phillippitts.aibakeoff.exception.ProviderException;

/**
 * Contract for text-to-speech providers.
 *
 * <p>Implementations may speak a request/response protocol or a streaming session protocol;
 * either way {@link #synthesize(String, String)} blocks until the complete audio payload is
 * available or the call has failed.
 */
public interface SpeechSynthesisProvider {

    Provider provider();

    /**
     * Returns whether the credential required by this provider is present.
     */
    boolean isConfigured();

    /**
     * Synthesizes {@code text}.
     *
     * @param text text to speak
     * @param language language code of the text
     * @return the synthesized audio
     * @throws ProviderException if the call fails for any reason
     */
    SpeechResult synthesize(String text, String language);
}
