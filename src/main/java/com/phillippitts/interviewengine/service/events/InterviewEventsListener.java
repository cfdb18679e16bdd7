package com.phillippitts.interviewengine.service.events;

import com.phillippitts.interviewengine.service.orchestration.event.InterestDetectedEvent;
import com.phillippitts.interviewengine.service.orchestration.event.InterviewCompletedEvent;
import com.phillippitts.interviewengine.service.orchestration.event.StageChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Logs interview progress: detected interests, stage changes and completion.
 */
@Component
class InterviewEventsListener {

    private static final Logger LOG = LogManager.getLogger(InterviewEventsListener.class);

    @EventListener
    void onInterestDetected(InterestDetectedEvent e) {
        LOG.info("Interest detected: session={}, interest={}", e.sessionId(), e.interest().name());
    }

    @EventListener
    void onStageChanged(StageChangedEvent e) {
        LOG.info("Stage changed: session={}, {} -> {}", e.sessionId(), e.from().wireName(), e.to().wireName());
    }

    @EventListener
    void onInterviewCompleted(InterviewCompletedEvent e) {
        LOG.info("Interview completed: session={}, threadRequested={}, threadId={}",
                e.sessionId(), e.threadRequested(), e.threadId());
    }
}
