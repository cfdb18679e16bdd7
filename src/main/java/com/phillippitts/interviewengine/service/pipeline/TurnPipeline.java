package com.phillippitts.interviewengine.service.pipeline;

import com.phillippitts.interviewengine.config.properties.CapabilityTimeoutProperties;
import com.phillippitts.interviewengine.config.properties.InterviewProperties;
import com.phillippitts.interviewengine.domain.AudioSegment;
import com.phillippitts.interviewengine.domain.InterestRecord;
import com.phillippitts.interviewengine.domain.Stage;
import com.phillippitts.interviewengine.domain.TranscriptEntry;
import com.phillippitts.interviewengine.exception.CapabilityException;
import com.phillippitts.interviewengine.exception.InvalidAudioException;
import com.phillippitts.interviewengine.exception.TurnCancelledException;
import com.phillippitts.interviewengine.service.capability.Capability;
import com.phillippitts.interviewengine.service.capability.SpeechSynthesizer;
import com.phillippitts.interviewengine.service.capability.SpeechToText;
import com.phillippitts.interviewengine.service.interest.InterestTagger;
import com.phillippitts.interviewengine.service.orchestration.InterviewMetricsPublisher;
import com.phillippitts.interviewengine.service.orchestration.event.InterestDetectedEvent;
import com.phillippitts.interviewengine.service.orchestration.event.StageChangedEvent;
import com.phillippitts.interviewengine.service.orchestration.event.TranscriptEntryAppendedEvent;
import com.phillippitts.interviewengine.service.session.InterviewSession;
import com.phillippitts.interviewengine.service.session.SessionHandle;
import com.phillippitts.interviewengine.service.session.SessionSnapshot;
import com.phillippitts.interviewengine.service.session.SessionStateMachine;
import com.phillippitts.interviewengine.service.session.StageDecision;
import com.phillippitts.interviewengine.service.session.TurnDraft;
import com.phillippitts.interviewengine.service.taxonomy.TaxonomyMatch;
import com.phillippitts.interviewengine.service.taxonomy.TaxonomyMatcher;
import com.phillippitts.interviewengine.util.LogSanitizer;
import com.phillippitts.interviewengine.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.io.ByteArrayOutputStream;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Turns one audio segment into transcript entries, interest and concept updates, and one
 * audio response.
 *
 * <p>Steps: transcribe, stage the user entry, decide the turn's stage, compose a response in
 * that stage, extract new interests, match the taxonomy over all user utterances, strip markers,
 * stage the assistant entry and settle the thread flag, commit, then synthesize.
 *
 * <p>Everything before the commit works on a {@link TurnDraft}; the session changes in one
 * atomic {@link InterviewSession#commit(TurnDraft)}. Failure handling:
 * <ul>
 *   <li>transcription fails: nothing committed, silence</li>
 *   <li>response generation fails: only the user entry committed, silence</li>
 *   <li>synthesis fails: text already committed, silence</li>
 *   <li>session cancelled mid-turn: nothing committed, silence</li>
 * </ul>
 *
 * <p>The caller must hold the session's turn lock.
 */
public class TurnPipeline {

    private static final Logger LOG = LogManager.getLogger(TurnPipeline.class);

    static final int INTEREST_CONTEXT_CHARS = 200;
    private static final int LOG_PREVIEW_CHARS = 40;

    private final SpeechToText speechToText;
    private final SpeechSynthesizer speechSynthesizer;
    private final SessionStateMachine stateMachine;
    private final InterestTagger tagger;
    private final TaxonomyMatcher taxonomy;
    private final CapabilityInvoker invoker;
    private final CapabilityTimeoutProperties timeouts;
    private final InterviewProperties props;
    private final ApplicationEventPublisher publisher;
    private final InterviewMetricsPublisher metrics;
    private final Clock clock;

    public TurnPipeline(SpeechToText speechToText,
                        SpeechSynthesizer speechSynthesizer,
                        SessionStateMachine stateMachine,
                        InterestTagger tagger,
                        TaxonomyMatcher taxonomy,
                        CapabilityInvoker invoker,
                        CapabilityTimeoutProperties timeouts,
                        InterviewProperties props,
                        ApplicationEventPublisher publisher,
                        InterviewMetricsPublisher metrics,
                        Clock clock) {
        this.speechToText = Objects.requireNonNull(speechToText, "speechToText");
        this.speechSynthesizer = Objects.requireNonNull(speechSynthesizer, "speechSynthesizer");
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine");
        this.tagger = Objects.requireNonNull(tagger, "tagger");
        this.taxonomy = Objects.requireNonNull(taxonomy, "taxonomy");
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        this.timeouts = Objects.requireNonNull(timeouts, "timeouts");
        this.props = Objects.requireNonNull(props, "props");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = metrics == null ? InterviewMetricsPublisher.NOOP : metrics;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Processes one turn for the session behind {@code handle}.
     */
    public TurnOutcome process(SessionHandle handle, AudioSegment input) {
        Objects.requireNonNull(input, "input");
        long start = System.nanoTime();
        TurnOutcome outcome = run(handle, input);
        metrics.recordTurn(outcome.status().tag(), System.nanoTime() - start);
        LOG.debug("Turn {} for session {} in {} ms ({} -> {})", outcome.status(), handle.sessionId(),
                TimeUtils.elapsedMillis(start), outcome.stageBefore().wireName(), outcome.stageAfter().wireName());
        return outcome;
    }

    private TurnOutcome run(SessionHandle handle, AudioSegment input) {
        InterviewSession session = handle.session();
        SessionSnapshot before = session.snapshot();
        Stage stage = before.stage();

        if (stage.isTerminal()) {
            return TurnOutcome.unchanged(TurnOutcome.Status.CLOSED, silence(input), stage);
        }

        // 1. Transcribe
        String utterance;
        try {
            String text = invoker.call(handle, Capability.STT, timeouts.getSttTimeout(),
                    () -> speechToText.transcribe(input));
            utterance = text == null ? "" : text.trim();
        } catch (TurnCancelledException e) {
            return TurnOutcome.unchanged(TurnOutcome.Status.CANCELLED, silence(input), stage);
        } catch (CapabilityException e) {
            LOG.warn("Speech-to-text failed for session {}: {}", handle.sessionId(), e.getMessage());
            return TurnOutcome.unchanged(TurnOutcome.Status.DEGRADED, silence(input), stage);
        }
        if (utterance.length() < props.getTurn().getMinTranscriptChars()) {
            LOG.debug("Ignoring short transcript ({} chars) for session {}", utterance.length(), handle.sessionId());
            return TurnOutcome.unchanged(TurnOutcome.Status.SILENT_INPUT, AudioSegment.empty(input.sampleRate()),
                    stage);
        }

        // 2. Stage the user entry
        TurnDraft draft = new TurnDraft();
        draft.stageUser(TranscriptEntry.user(utterance, clock.instant()));

        // 3. Analyze, decide the stage for this turn, respond in that stage
        String raw;
        Stage next;
        try {
            stateMachine.analyzeInput(handle, utterance, draft);
            next = stateMachine.recomputeStage(before, draft);
            raw = stateMachine.composeResponse(handle, before, draft, next);
        } catch (TurnCancelledException e) {
            return TurnOutcome.unchanged(TurnOutcome.Status.CANCELLED, silence(input), stage);
        } catch (CapabilityException e) {
            LOG.warn("Response generation failed for session {}: {}", handle.sessionId(), e.getMessage());
            if (commitIfActive(handle, draft.userOnly()) == null) {
                return TurnOutcome.unchanged(TurnOutcome.Status.CANCELLED, silence(input), stage);
            }
            return TurnOutcome.unchanged(TurnOutcome.Status.DEGRADED, silence(input), stage);
        }

        // 4. Interests not seen before
        Instant now = clock.instant();
        String context = LogSanitizer.truncate(raw, INTEREST_CONTEXT_CHARS);
        List<InterestRecord> detected = new ArrayList<>();
        for (String name : tagger.extractNew(raw, before.interestNames())) {
            detected.add(InterestRecord.fromMarker(name, now, context));
        }
        draft.addInterests(detected);

        // 5. Taxonomy over every user utterance so far
        List<String> userUtterances = new ArrayList<>(before.userUtterances());
        userUtterances.add(utterance);
        TaxonomyMatch match = taxonomy.match(userUtterances);
        draft.addConcepts(match.keywords());

        // 6-7. Clean, stage the assistant entry, settle the thread flag, commit
        String cleaned = tagger.strip(raw);
        draft.stageAssistant(TranscriptEntry.assistant(cleaned, now));
        StageDecision decision = stateMachine.evaluate(before, draft, next);
        draft.decide(decision);

        List<InterestRecord> added = commitIfActive(handle, draft);
        if (added == null) {
            return TurnOutcome.unchanged(TurnOutcome.Status.CANCELLED, silence(input), stage);
        }
        metrics.recordInterestsDetected(added.size());
        if (decision.stage() != stage) {
            metrics.recordStageTransition(stage, decision.stage());
            publisher.publishEvent(new StageChangedEvent(handle.sessionId(), stage, decision.stage(), now));
        }
        LOG.debug("Session {} user=\"{}\" assistant=\"{}\"", handle.sessionId(),
                LogSanitizer.truncate(utterance, LOG_PREVIEW_CHARS), LogSanitizer.truncate(cleaned, LOG_PREVIEW_CHARS));

        // 8. Synthesize
        try {
            AudioSegment audio = synthesize(handle, cleaned, input.sampleRate());
            return new TurnOutcome(TurnOutcome.Status.COMPLETED, audio, stage, decision.stage(), added);
        } catch (TurnCancelledException e) {
            return new TurnOutcome(TurnOutcome.Status.CANCELLED, silence(input), stage, decision.stage(), added);
        } catch (CapabilityException e) {
            LOG.warn("Speech synthesis failed for session {}: {}", handle.sessionId(), e.getMessage());
            return new TurnOutcome(TurnOutcome.Status.DEGRADED, silence(input), stage, decision.stage(), added);
        }
    }

    private AudioSegment silence(AudioSegment input) {
        return AudioSegment.silence(input.sampleRate(), props.getTurn().getSilenceDuration());
    }

    /**
     * Commits the draft unless the session was cancelled, then publishes the per-entry and
     * per-interest events.
     *
     * @return the interests actually added, or null when the session was cancelled
     */
    private List<InterestRecord> commitIfActive(SessionHandle handle, TurnDraft draft) {
        if (handle.isCancelled()) {
            return null;
        }
        InterviewSession session = handle.session();
        List<InterestRecord> added = session.commit(draft);
        for (TranscriptEntry entry : draft.entries()) {
            publisher.publishEvent(new TranscriptEntryAppendedEvent(session.getId(), entry));
        }
        for (InterestRecord interest : added) {
            publisher.publishEvent(new InterestDetectedEvent(session.getId(), session.getUserId(), interest));
        }
        return added;
    }

    private AudioSegment synthesize(SessionHandle handle, String text, int fallbackRate) {
        if (text.isEmpty()) {
            return AudioSegment.empty(fallbackRate);
        }
        return invoker.call(handle, Capability.TTS, timeouts.getTtsTimeout(), () -> {
            try (Stream<AudioSegment> chunks = speechSynthesizer.synthesize(text)) {
                return concat(chunks, fallbackRate);
            }
        });
    }

    /**
     * Concatenates synthesized chunks. All chunks must share one sample rate; no chunks yields
     * an explicit empty segment.
     */
    static AudioSegment concat(Stream<AudioSegment> chunks, int fallbackRate) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        int rate = -1;
        Iterator<AudioSegment> it = chunks.iterator();
        while (it.hasNext()) {
            AudioSegment chunk = it.next();
            if (chunk == null) {
                continue;
            }
            if (rate == -1) {
                rate = chunk.sampleRate();
            } else if (rate != chunk.sampleRate()) {
                throw new InvalidAudioException("synthesized chunks mix sample rates " + rate
                        + " and " + chunk.sampleRate());
            }
            out.writeBytes(chunk.pcm());
        }
        return new AudioSegment(rate == -1 ? fallbackRate : rate, out.toByteArray());
    }
}
