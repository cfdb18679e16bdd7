package com.phillippitts.interviewengine.service.capability;

import com.phillippitts.interviewengine.domain.TranscriptEntry;
import com.phillippitts.interviewengine.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Default transcript sink: writes a truncated preview of each entry to the log.
 */
public class LoggingTranscriptSink implements TranscriptSink {

    private static final Logger LOG = LogManager.getLogger(LoggingTranscriptSink.class);
    private static final int PREVIEW_CHARS = 80;

    @Override
    public void append(String sessionId, TranscriptEntry entry) {
        LOG.info("Transcript [{}] {}: {}", sessionId, entry.speaker().role(),
                LogSanitizer.truncate(entry.text(), PREVIEW_CHARS));
    }
}
