package com.phillippitts.interviewengine.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * An interest detected during the interview.
 *
 * @param name       interest name exactly as marked by the assistant (trimmed, case preserved)
 * @param detectedAt when the marker was first seen
 * @param context    leading excerpt of the raw assistant response that carried the marker
 * @param confidence detection confidence between 0.0 and 1.0; marker hits are always 1.0
 */
public record InterestRecord(String name, Instant detectedAt, String context, double confidence) {

    /** Confidence assigned to explicit {@code [INTEREST: ...]} markers. */
    public static final double MARKER_CONFIDENCE = 1.0;

    public InterestRecord {
        Objects.requireNonNull(name, "Interest name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Interest name must not be blank");
        }
        Objects.requireNonNull(detectedAt, "detectedAt must not be null");
        context = context == null ? "" : context;
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                    "Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
    }

    public static InterestRecord fromMarker(String name, Instant detectedAt, String context) {
        return new InterestRecord(name, detectedAt, context, MARKER_CONFIDENCE);
    }
}
