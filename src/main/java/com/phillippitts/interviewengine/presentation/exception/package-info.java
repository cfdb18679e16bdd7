/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.interviewengine.exception.SessionNotFoundException} → 404 Not Found</li>
 *   <li>{@link com.phillippitts.interviewengine.exception.InvalidAudioException} → 400 Bad Request</li>
 *   <li>request validation and {@code IllegalArgumentException} → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.interviewengine.exception.InterviewConfigurationException} → 503 Service Unavailable</li>
 *   <li>{@link com.phillippitts.interviewengine.exception.CapabilityException} → 503 Service Unavailable (retry)</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "SessionNotFoundException",
 *   "message": "Session not found",
 *   "details": "Session not found: 3f1c...",
 *   "timestamp": "2026-10-17T15:42:32.529Z"
 * }
 * </pre>
 *
 * @since 1.0
 */
package com.phillippitts.interviewengine.presentation.exception;
