/**
 * Interview engine exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend
 * {@link com.phillippitts.interviewengine.exception.InterviewEngineException}:
 * <ul>
 *   <li>{@link com.phillippitts.interviewengine.exception.SessionNotFoundException} - unknown or
 *       already-ended session id</li>
 *   <li>{@link com.phillippitts.interviewengine.exception.CapabilityException} - an external
 *       capability failed, timed out, or is not configured</li>
 *   <li>{@link com.phillippitts.interviewengine.exception.InvalidAudioException} - malformed PCM
 *       input</li>
 *   <li>{@link com.phillippitts.interviewengine.exception.InterviewConfigurationException} - fatal
 *       misconfiguration detected at startup</li>
 *   <li>{@link com.phillippitts.interviewengine.exception.TurnCancelledException} - a turn was
 *       abandoned because its session is ending</li>
 * </ul>
 *
 * <p>HTTP status mapping lives in
 * {@code com.phillippitts.interviewengine.presentation.exception.GlobalExceptionHandler}.
 *
 * @since 1.0
 */
package com.phillippitts.interviewengine.exception;
