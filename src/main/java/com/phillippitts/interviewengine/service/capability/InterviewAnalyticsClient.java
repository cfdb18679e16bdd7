package com.phillippitts.interviewengine.service.capability;

import com.phillippitts.interviewengine.domain.InterviewSummary;

/**
 * Downstream analytics collector. Submission is best-effort.
 */
public interface InterviewAnalyticsClient extends Capability {

    void submit(InterviewSummary summary);

    @Override
    default String getCapabilityName() {
        return ANALYTICS;
    }
}
