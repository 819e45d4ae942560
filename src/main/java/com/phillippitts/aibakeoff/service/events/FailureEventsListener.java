package com.phillippitts.aibakeoff.service.events;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Logs provider failures as they happen, throttled per (provider, scenario) so a provider
 * that fails every call produces one WARN line per minute instead of one per input.
 * The full list of failures is printed with the final summary regardless.
 */
@Component
class FailureEventsListener {
    private static final Logger LOG = LogManager.getLogger(FailureEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final Clock clock;

    FailureEventsListener() {
        this(Clock.systemUTC());
    }

    FailureEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onProviderFailure(ProviderFailureEvent e) {
        if (shouldLog(e.provider() + '|' + e.scenario())) {
            LOG.warn("{} failed in {} [{}]: {}", e.provider(), e.scenario(), e.language(), e.message());
        } else {
            LOG.debug("{} failed in {} [{}]: {}", e.provider(), e.scenario(), e.language(), e.message());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
