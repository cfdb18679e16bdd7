/**
 * Domain model of an interview session.
 *
 * <p>Value types are immutable records validated in their compact constructors:
 * {@link com.phillippitts.interviewengine.domain.TranscriptEntry},
 * {@link com.phillippitts.interviewengine.domain.InterestRecord},
 * {@link com.phillippitts.interviewengine.domain.AudioSegment} and the views returned to callers
 * ({@link com.phillippitts.interviewengine.domain.InterviewStatus},
 * {@link com.phillippitts.interviewengine.domain.InterviewResult},
 * {@link com.phillippitts.interviewengine.domain.RelayCredential}).
 *
 * <p>The mutable session aggregate lives in {@code service.session}; it only ever hands out
 * snapshots built from these types.
 *
 * @since 1.0
 */
package com.phillippitts.interviewengine.domain;
