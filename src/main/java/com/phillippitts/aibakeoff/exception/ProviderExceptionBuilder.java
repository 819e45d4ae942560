package com.phillippitts.aibakeoff.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing ProviderException with HTTP and contextual detail.
 *
 * <p>The base message is kept verbatim so that callers control the leading text (for
 * example {@code "Groq chat failed: 429 {...}"}); optional metadata is appended in
 * parentheses.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw ProviderExceptionBuilder.create("ElevenLabs TTS failed: " + status + " " + body)
 *         .provider("elevenlabs")
 *         .httpStatus(status)
 *         .build();
 *
 * throw ProviderExceptionBuilder.create("Groq chat returned malformed JSON")
 *         .provider("groq")
 *         .cause(jsonException)
 *         .metadata("bodyPreview", preview)
 *         .build();
 * </pre>
 */
public final class ProviderExceptionBuilder {

    private final String message;
    private String providerName;
    private Throwable cause;
    private int httpStatus = ProviderException.NO_STATUS;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ProviderExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static ProviderExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ProviderExceptionBuilder(message);
    }

    public ProviderExceptionBuilder provider(String providerName) {
        this.providerName = providerName;
        return this;
    }

    public ProviderExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public ProviderExceptionBuilder httpStatus(int httpStatus) {
        this.httpStatus = httpStatus;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public ProviderExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the ProviderException.
     *
     * <p>The final message format is:
     * <pre>
     * {message} ({key1}={val1}, {key2}={val2}, ...)
     * </pre>
     *
     * @return constructed ProviderException
     */
    public ProviderException build() {
        return new ProviderException(buildDetailedMessage(), providerName, httpStatus, cause);
    }

    private String buildDetailedMessage() {
        if (metadata.isEmpty()) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }
        return sb.append(")").toString();
    }
}
