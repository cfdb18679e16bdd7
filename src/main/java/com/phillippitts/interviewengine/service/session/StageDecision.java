package com.phillippitts.interviewengine.service.session;

import com.phillippitts.interviewengine.domain.Stage;

/**
 * Result of one evaluation of the stage policy.
 *
 * @param stage              stage after the turn (equal to or one step past the current stage)
 * @param shouldCreateThread sticky thread-creation flag after the turn
 */
public record StageDecision(Stage stage, boolean shouldCreateThread) {
}
