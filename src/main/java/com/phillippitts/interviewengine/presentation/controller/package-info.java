/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Endpoints (all under {@code /api/interview}):
 * <ul>
 *   <li>{@code POST /start} - start a session</li>
 *   <li>{@code POST /{id}/turn} - submit one PCM16 audio turn, receive the spoken response</li>
 *   <li>{@code GET /{id}/status} - stage, interest count, turn count and duration</li>
 *   <li>{@code GET /{id}/results} - full transcript, interests and hand-off metadata</li>
 *   <li>{@code POST /{id}/end} - end the session and run the hand-off</li>
 *   <li>{@code GET /{id}/ice-servers} - TURN relay credential and ICE servers</li>
 * </ul>
 *
 * @see com.phillippitts.interviewengine.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.interviewengine.presentation.controller;
