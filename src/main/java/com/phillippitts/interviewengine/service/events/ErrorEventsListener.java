package com.phillippitts.interviewengine.service.events;

import com.phillippitts.interviewengine.service.orchestration.event.CapabilityFailureEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Logs capability failures, throttled per capability and reason to avoid log spam when a
 * downstream engine is down for every session at once.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onCapabilityFailure(CapabilityFailureEvent e) {
        String key = "capability-" + e.capability() + '-' + e.reason();
        if (shouldLog(key)) {
            LOG.warn("Capability failure: capability={}, reason={}, session={}: {}",
                    e.capability(), e.reason(), e.sessionId(), e.message());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
