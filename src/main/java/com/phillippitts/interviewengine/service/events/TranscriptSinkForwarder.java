package com.phillippitts.interviewengine.service.events;

import com.phillippitts.interviewengine.service.capability.TranscriptSink;
import com.phillippitts.interviewengine.service.orchestration.event.TranscriptEntryAppendedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Forwards committed transcript entries to the {@link TranscriptSink} on the event pool, so a
 * slow sink never delays a turn.
 */
@Component
public class TranscriptSinkForwarder {

    private static final Logger LOG = LogManager.getLogger(TranscriptSinkForwarder.class);

    private final TranscriptSink sink;

    public TranscriptSinkForwarder(TranscriptSink sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Async("eventExecutor")
    @EventListener
    public void onEntryAppended(TranscriptEntryAppendedEvent event) {
        try {
            sink.append(event.sessionId(), event.entry());
        } catch (RuntimeException e) {
            LOG.warn("Transcript sink rejected entry for session {}: {}", event.sessionId(), e.getMessage());
        }
    }
}
