package com.phillippitts.aibakeoff.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Timeouts applied to every request/response provider call.
 *
 * <p>The read timeout acts as the per-call deadline for chat-completion and REST speech
 * calls: a hung request fails after this long and releases its concurrency slot.
 */
@ConfigurationProperties(prefix = "bakeoff.http")
@Validated
public class HttpClientProperties {

    @Positive
    private int connectTimeoutMs = 10_000;

    @Positive
    private int readTimeoutMs = 60_000;

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getReadTimeoutMs() {
        return readTimeoutMs;
    }

    public void setReadTimeoutMs(int readTimeoutMs) {
        this.readTimeoutMs = readTimeoutMs;
    }
}
