package com.phillippitts.interviewengine.service.session;

import com.phillippitts.interviewengine.config.properties.CapabilityTimeoutProperties;
import com.phillippitts.interviewengine.config.properties.InterviewProperties;
import com.phillippitts.interviewengine.domain.ConversationMessage;
import com.phillippitts.interviewengine.domain.InterestRecord;
import com.phillippitts.interviewengine.domain.SessionAttributes;
import com.phillippitts.interviewengine.domain.Speaker;
import com.phillippitts.interviewengine.domain.Stage;
import com.phillippitts.interviewengine.domain.TranscriptEntry;
import com.phillippitts.interviewengine.exception.CapabilityException;
import com.phillippitts.interviewengine.service.orchestration.InterviewMetricsPublisher;
import com.phillippitts.interviewengine.service.pipeline.CapabilityInvoker;
import com.phillippitts.interviewengine.testutil.EventCapturingPublisher;
import com.phillippitts.interviewengine.testutil.MutableClock;
import com.phillippitts.interviewengine.testutil.ScriptedTextGenerator;
import com.phillippitts.interviewengine.testutil.SyncExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionStateMachineTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private ScriptedTextGenerator llm;
    private InterviewProperties props;
    private SessionStateMachine stateMachine;

    @BeforeEach
    void setUp() {
        llm = new ScriptedTextGenerator("Hello there [INTEREST: chess]");
        props = new InterviewProperties();
        CapabilityInvoker invoker = new CapabilityInvoker(new SyncExecutor(), new EventCapturingPublisher(),
                InterviewMetricsPublisher.NOOP, new MutableClock(T0));
        stateMachine = new SessionStateMachine(llm, invoker, new CapabilityTimeoutProperties(), props);
    }

    private static InterviewSession session(String mode) {
        return new InterviewSession("s-1", "u-1", mode, "create_learning_thread", null, T0);
    }

    private static TurnDraft draft(String userText, String... interests) {
        TurnDraft draft = new TurnDraft();
        draft.stageUser(TranscriptEntry.user(userText, T0));
        draft.stageAssistant(TranscriptEntry.assistant("ok", T0));
        for (String name : interests) {
            draft.addInterests(List.of(InterestRecord.fromMarker(name, T0, "")));
        }
        return draft;
    }

    @Test
    void greetingMovesToExplorationOnceMoreThanTwoEntries() {
        assertThat(SessionStateMachine.nextStage(Stage.GREETING, 2, 0)).isEqualTo(Stage.GREETING);
        assertThat(SessionStateMachine.nextStage(Stage.GREETING, 3, 0)).isEqualTo(Stage.EXPLORATION);
    }

    @Test
    void deepDiveNeedsTwoInterestsAndMoreThanSixEntries() {
        assertThat(SessionStateMachine.nextStage(Stage.EXPLORATION, 7, 1)).isEqualTo(Stage.EXPLORATION);
        assertThat(SessionStateMachine.nextStage(Stage.EXPLORATION, 6, 2)).isEqualTo(Stage.EXPLORATION);
        assertThat(SessionStateMachine.nextStage(Stage.EXPLORATION, 7, 2)).isEqualTo(Stage.DEEP_DIVE);
    }

    @Test
    void laterStagesDependOnEntryCountOnly() {
        assertThat(SessionStateMachine.nextStage(Stage.DEEP_DIVE, 12, 5)).isEqualTo(Stage.DEEP_DIVE);
        assertThat(SessionStateMachine.nextStage(Stage.DEEP_DIVE, 13, 0)).isEqualTo(Stage.WRAP_UP);
        assertThat(SessionStateMachine.nextStage(Stage.WRAP_UP, 15, 0)).isEqualTo(Stage.WRAP_UP);
        assertThat(SessionStateMachine.nextStage(Stage.WRAP_UP, 16, 0)).isEqualTo(Stage.TERMINATED);
    }

    @Test
    void advancesAtMostOneStepPerEvaluation() {
        assertThat(SessionStateMachine.nextStage(Stage.GREETING, 100, 10)).isEqualTo(Stage.EXPLORATION);
        assertThat(SessionStateMachine.nextStage(Stage.TERMINATED, 100, 10)).isEqualTo(Stage.TERMINATED);
    }

    @Test
    void threadFlagRequiresThreadModeAndAnInterest() {
        assertThat(stateMachine.shouldCreateThread("thread", 0, false)).isFalse();
        assertThat(stateMachine.shouldCreateThread("thread", 1, false)).isTrue();
        assertThat(stateMachine.shouldCreateThread("explore", 3, false)).isFalse();
        assertThat(stateMachine.shouldCreateThread(null, 3, false)).isFalse();
        assertThat(stateMachine.shouldCreateThread("explore", 0, true)).isTrue();
    }

    private static TurnDraft userOnly(String userText) {
        TurnDraft draft = new TurnDraft();
        draft.stageUser(TranscriptEntry.user(userText, T0));
        return draft;
    }

    @Test
    void recomputeStageCountsCommittedEntriesPlusStagedUserEntry() {
        InterviewSession session = session("thread");
        session.commit(draft("hi"));

        assertThat(stateMachine.recomputeStage(session.snapshot(), userOnly("I like chess")))
                .isEqualTo(Stage.EXPLORATION);
        assertThat(stateMachine.recomputeStage(session("thread").snapshot(), userOnly("hi")))
                .isEqualTo(Stage.GREETING);
    }

    @Test
    void recomputeStageUsesInterestsKnownBeforeTheTurn() {
        InterviewSession session = session("thread");
        TurnDraft first = draft("a", "chess");
        first.decide(new StageDecision(Stage.EXPLORATION, true));
        session.commit(first);
        session.commit(draft("b"));
        session.commit(draft("c"));

        assertThat(stateMachine.recomputeStage(session.snapshot(), userOnly("d"))).isEqualTo(Stage.EXPLORATION);

        session.commit(draft("e", "music"));
        assertThat(stateMachine.recomputeStage(session.snapshot(), userOnly("f"))).isEqualTo(Stage.DEEP_DIVE);
    }

    @Test
    void recomputeStageDoesNotDoubleCountKnownInterests() {
        InterviewSession session = session("thread");
        TurnDraft first = draft("a", "chess");
        first.decide(new StageDecision(Stage.EXPLORATION, true));
        session.commit(first);
        session.commit(draft("b"));
        session.commit(draft("c"));
        TurnDraft repeat = userOnly("d");
        repeat.addInterests(List.of(InterestRecord.fromMarker("chess", T0, "")));

        assertThat(stateMachine.recomputeStage(session.snapshot(), repeat)).isEqualTo(Stage.EXPLORATION);
    }

    @Test
    void evaluateKeepsStageAndCountsInterestsFromTheResponse() {
        InterviewSession session = session("thread");

        StageDecision decision = stateMachine.evaluate(session.snapshot(), draft("I like chess", "chess"),
                Stage.GREETING);

        assertThat(decision.stage()).isEqualTo(Stage.GREETING);
        assertThat(decision.shouldCreateThread()).isTrue();
    }

    @Test
    void composeResponseSendsHistoryWithStagedUserEntry() {
        InterviewSession session = session("thread");
        session.commit(draft("hi"));
        SessionHandle handle = new SessionHandle(session);
        TurnDraft turn = userOnly("I like chess");

        String response = stateMachine.composeResponse(handle, session.snapshot(), turn, Stage.GREETING);

        assertThat(response).isEqualTo("Hello there [INTEREST: chess]");
        ScriptedTextGenerator.Call call = llm.calls.get(0);
        assertThat(call.history()).extracting(ConversationMessage::content).containsExactly("hi", "ok", "I like chess");
        assertThat(call.history().get(2).role()).isEqualTo(Speaker.USER);
        assertThat(call.instruction()).contains("Current stage: greeting");
    }

    @Test
    void composeResponseUsesTheGivenStageTemplate() {
        InterviewSession session = session("thread");
        session.commit(draft("I like chess", "chess"));
        TurnDraft turn = userOnly("and music");

        stateMachine.composeResponse(new SessionHandle(session), session.snapshot(), turn, Stage.EXPLORATION);

        assertThat(llm.calls.get(0).instruction())
                .contains("Current stage: exploration")
                .contains("They've mentioned: chess");
    }

    @Test
    void composeResponsePropagatesGeneratorFailure() {
        llm.shouldFail = true;
        InterviewSession session = session("thread");
        TurnDraft turn = new TurnDraft();
        turn.stageUser(TranscriptEntry.user("hi", T0));

        assertThatThrownBy(() -> stateMachine.composeResponse(new SessionHandle(session), session.snapshot(), turn,
                Stage.GREETING))
                .isInstanceOf(CapabilityException.class);
    }

    @Test
    void analysisIsSkippedWhenDisabled() {
        TurnDraft turn = draft("hi");

        stateMachine.analyzeInput(new SessionHandle(session("thread")), "hi", turn);

        assertThat(llm.calls).isEmpty();
        assertThat(turn.attributes()).isEmpty();
    }

    @Test
    void analysisIsStagedAsAttributeWhenEnabled() {
        props.getAnalysis().setEnabled(true);
        llm.cannedResponse = "  positive, engaged  ";
        TurnDraft turn = draft("hi");

        stateMachine.analyzeInput(new SessionHandle(session("thread")), "hi", turn);

        assertThat(turn.attributes()).containsEntry(SessionAttributes.LAST_ANALYSIS, "positive, engaged");
        assertThat(llm.calls.get(0).instruction()).isEqualTo(StagePrompts.ANALYSIS);
    }

    @Test
    void analysisFailureIsIgnored() {
        props.getAnalysis().setEnabled(true);
        llm.shouldFail = true;
        TurnDraft turn = draft("hi");

        stateMachine.analyzeInput(new SessionHandle(session("thread")), "hi", turn);

        assertThat(turn.attributes()).isEmpty();
    }

    @Test
    void threadSummaryUsesWholeTranscript() {
        InterviewSession session = session("thread");
        session.commit(draft("I like chess"));
        llm.cannedResponse = "Title: Chess\nDescription: Openings";

        assertThat(stateMachine.summarizeForThread(session.snapshot())).contains("Title: Chess\nDescription: Openings");
        assertThat(llm.calls.get(0).history()).hasSize(2);
        assertThat(llm.calls.get(0).instruction()).isEqualTo(StagePrompts.THREAD_SUMMARY);
    }

    @Test
    void threadSummaryIsEmptyWhenDisabledBlankOrFailing() {
        InterviewSession session = session("thread");

        props.getThread().setSummaryEnabled(false);
        assertThat(stateMachine.summarizeForThread(session.snapshot())).isEmpty();
        assertThat(llm.calls).isEmpty();

        props.getThread().setSummaryEnabled(true);
        llm.cannedResponse = "   ";
        assertThat(stateMachine.summarizeForThread(session.snapshot())).isEmpty();

        llm.shouldFail = true;
        assertThat(stateMachine.summarizeForThread(session.snapshot())).isEmpty();
    }
}
