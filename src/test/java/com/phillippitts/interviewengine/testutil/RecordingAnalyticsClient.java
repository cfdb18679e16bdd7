package com.phillippitts.interviewengine.testutil;

import com.phillippitts.interviewengine.domain.InterviewSummary;
import com.phillippitts.interviewengine.exception.CapabilityException;
import com.phillippitts.interviewengine.service.capability.Capability;
import com.phillippitts.interviewengine.service.capability.InterviewAnalyticsClient;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test double for InterviewAnalyticsClient that records submitted summaries.
 */
public class RecordingAnalyticsClient implements InterviewAnalyticsClient {
    public final List<InterviewSummary> summaries = new CopyOnWriteArrayList<>();
    public boolean shouldFail;

    @Override
    public void submit(InterviewSummary summary) {
        if (shouldFail) {
            throw new CapabilityException("Analytics service unavailable", Capability.ANALYTICS, "unavailable");
        }
        summaries.add(summary);
    }
}
