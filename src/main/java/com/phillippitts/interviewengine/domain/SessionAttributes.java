package com.phillippitts.interviewengine.domain;

/**
 * Well-known keys of the per-session metadata map.
 */
public final class SessionAttributes {

    public static final String THREAD_ID = "threadId";
    public static final String THREAD_CREATED = "threadCreated";
    public static final String THREAD_CREATION_ATTEMPTED = "threadCreationAttempted";
    public static final String THREAD_CREATION_ERROR = "threadCreationError";
    public static final String THREAD_SUMMARY = "threadSummary";
    public static final String ANALYTICS_SUBMITTED = "analyticsSubmitted";
    public static final String ANALYTICS_ERROR = "analyticsError";
    public static final String LAST_ANALYSIS = "lastAnalysis";

    private SessionAttributes() {}
}
