package com.phillippitts.interviewengine.service.session;

import com.phillippitts.interviewengine.config.properties.CapabilityTimeoutProperties;
import com.phillippitts.interviewengine.config.properties.InterviewProperties;
import com.phillippitts.interviewengine.domain.ConversationMessage;
import com.phillippitts.interviewengine.domain.SessionAttributes;
import com.phillippitts.interviewengine.domain.Stage;
import com.phillippitts.interviewengine.domain.TranscriptEntry;
import com.phillippitts.interviewengine.exception.CapabilityException;
import com.phillippitts.interviewengine.service.capability.Capability;
import com.phillippitts.interviewengine.service.capability.TextGenerator;
import com.phillippitts.interviewengine.service.pipeline.CapabilityInvoker;
import com.phillippitts.interviewengine.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Interview policy: stage transitions, the thread-creation flag, and the text-generation calls
 * made on each turn (optional input analysis, response composition, thread summary).
 *
 * <p><b>Transitions</b> (evaluated once per turn before the response is composed, at most one
 * step):
 * <pre>
 * greeting    → exploration  when turns &gt; 2
 * exploration → deep_dive    when interests &ge; 2 and turns &gt; 6
 * deep_dive   → wrap_up      when turns &gt; 12
 * wrap_up     → terminated   when turns &gt; 15
 * </pre>
 * where {@code turns} counts the committed user and assistant entries plus the turn's staged user
 * entry, and {@code interests} counts the interests known before the turn. The response is
 * composed for the resulting stage.
 *
 * <p>{@code shouldCreateThread} becomes true once the mode is the thread mode and at least one
 * interest is known, counting the interests marked in the turn's own response; it is never
 * cleared.
 */
public class SessionStateMachine {

    private static final Logger LOG = LogManager.getLogger(SessionStateMachine.class);

    static final int EXPLORATION_AFTER_TURNS = 2;
    static final int DEEP_DIVE_AFTER_TURNS = 6;
    static final int DEEP_DIVE_MIN_INTERESTS = 2;
    static final int WRAP_UP_AFTER_TURNS = 12;
    static final int TERMINATE_AFTER_TURNS = 15;

    private final TextGenerator textGenerator;
    private final CapabilityInvoker invoker;
    private final CapabilityTimeoutProperties timeouts;
    private final InterviewProperties props;

    public SessionStateMachine(TextGenerator textGenerator,
                               CapabilityInvoker invoker,
                               CapabilityTimeoutProperties timeouts,
                               InterviewProperties props) {
        this.textGenerator = Objects.requireNonNull(textGenerator, "textGenerator");
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        this.timeouts = Objects.requireNonNull(timeouts, "timeouts");
        this.props = Objects.requireNonNull(props, "props");
    }

    /**
     * Pure transition function.
     *
     * @param current   stage before the turn
     * @param turns     committed transcript entries plus the staged user entry
     * @param interests distinct interests known before the response
     * @return next stage (the same stage, or exactly one step later)
     */
    public static Stage nextStage(Stage current, int turns, int interests) {
        switch (current) {
            case GREETING:
                return turns > EXPLORATION_AFTER_TURNS ? Stage.EXPLORATION : current;
            case EXPLORATION:
                return interests >= DEEP_DIVE_MIN_INTERESTS && turns > DEEP_DIVE_AFTER_TURNS
                        ? Stage.DEEP_DIVE : current;
            case DEEP_DIVE:
                return turns > WRAP_UP_AFTER_TURNS ? Stage.WRAP_UP : current;
            case WRAP_UP:
                return turns > TERMINATE_AFTER_TURNS ? Stage.TERMINATED : current;
            case TERMINATED:
            default:
                return current;
        }
    }

    /**
     * Sticky thread flag.
     */
    public boolean shouldCreateThread(String mode, int interests, boolean current) {
        return current || (props.getThreadMode().equals(mode) && interests >= 1);
    }

    /**
     * Stage for a turn whose user entry is staged, counted before the response exists.
     */
    public Stage recomputeStage(SessionSnapshot before, TurnDraft draft) {
        int turns = before.turnCount() + draft.entries().size();
        return nextStage(before.stage(), turns, distinctInterests(before, draft));
    }

    /**
     * Final decision for a staged turn: the stage chosen by {@link #recomputeStage} and the
     * thread flag, which also counts the interests marked in this turn's response.
     */
    public StageDecision evaluate(SessionSnapshot before, TurnDraft draft, Stage stage) {
        int interests = distinctInterests(before, draft);
        boolean thread = shouldCreateThread(before.mode(), interests, before.shouldCreateThread());
        return new StageDecision(stage, thread);
    }

    private static int distinctInterests(SessionSnapshot before, TurnDraft draft) {
        Set<String> names = new LinkedHashSet<>(before.interestNames());
        draft.newInterests().forEach(i -> names.add(i.name()));
        return names.size();
    }

    /**
     * Runs the optional analysis of the user's utterance. Failures are logged and ignored.
     */
    public void analyzeInput(SessionHandle handle, String utterance, TurnDraft draft) {
        if (!props.getAnalysis().isEnabled()) {
            return;
        }
        List<ConversationMessage> message =
                List.of(ConversationMessage.of(TranscriptEntry.user(utterance, draft.userEntry().timestamp())));
        try {
            String analysis = invoker.call(handle, Capability.LLM, timeouts.getLlmTimeout(),
                    () -> textGenerator.generate(message, StagePrompts.ANALYSIS));
            if (analysis != null && !analysis.isBlank()) {
                draft.putAttribute(SessionAttributes.LAST_ANALYSIS, analysis.trim());
            }
        } catch (CapabilityException e) {
            LOG.info("Input analysis skipped for session {}: {}", handle.sessionId(), e.getMessage());
        }
    }

    /**
     * Generates the raw assistant response for a staged turn using the template of
     * {@code stage}. The history sent is the committed transcript plus the staged user entry.
     *
     * @throws CapabilityException if text generation fails or times out
     */
    public String composeResponse(SessionHandle handle, SessionSnapshot before, TurnDraft draft, Stage stage) {
        List<TranscriptEntry> entries = new ArrayList<>(before.transcript());
        entries.addAll(draft.entries());
        List<ConversationMessage> history = entries.stream()
                .map(ConversationMessage::of)
                .collect(Collectors.toList());
        String instruction = StagePrompts.compose(stage, before.interestNames());
        String response = invoker.call(handle, Capability.LLM, timeouts.getLlmTimeout(),
                () -> textGenerator.generate(history, instruction));
        return response == null ? "" : response;
    }

    /**
     * Asks the text generator to summarize a finished interview for the learning thread.
     *
     * @return the summary, or empty when disabled or when generation fails
     */
    public Optional<String> summarizeForThread(SessionSnapshot snapshot) {
        if (!props.getThread().isSummaryEnabled()) {
            return Optional.empty();
        }
        List<ConversationMessage> history = snapshot.transcript().stream()
                .map(ConversationMessage::of)
                .collect(Collectors.toList());
        try {
            String summary = invoker.call(snapshot.sessionId(), Capability.LLM, timeouts.getLlmTimeout(),
                    () -> textGenerator.generate(history, StagePrompts.THREAD_SUMMARY));
            if (summary == null || summary.isBlank()) {
                return Optional.empty();
            }
            LOG.debug("Thread summary for session {}: \"{}\"", snapshot.sessionId(),
                    LogSanitizer.truncate(summary, 80));
            return Optional.of(summary.trim());
        } catch (CapabilityException e) {
            LOG.info("Thread summary skipped for session {}: {}", snapshot.sessionId(), e.getMessage());
            return Optional.empty();
        }
    }
}
