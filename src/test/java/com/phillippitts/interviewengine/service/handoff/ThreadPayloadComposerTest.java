package com.phillippitts.interviewengine.service.handoff;

import com.phillippitts.interviewengine.domain.InterestRecord;
import com.phillippitts.interviewengine.domain.SessionAttributes;
import com.phillippitts.interviewengine.domain.ThreadPayload;
import com.phillippitts.interviewengine.domain.TranscriptEntry;
import com.phillippitts.interviewengine.service.session.InterviewSession;
import com.phillippitts.interviewengine.service.session.TurnDraft;
import com.phillippitts.interviewengine.service.taxonomy.TaxonomyMatcher;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPayloadComposerTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private final ThreadPayloadComposer composer = new ThreadPayloadComposer(new TaxonomyMatcher());

    private static InterviewSession sessionWith(String purpose, String userText, String assistantText,
                                                String... interests) {
        InterviewSession session = new InterviewSession("s-1", "u-1", "thread", purpose, "tok", T0);
        TurnDraft draft = new TurnDraft();
        if (userText != null) {
            draft.stageUser(TranscriptEntry.user(userText, T0));
        }
        draft.stageAssistant(TranscriptEntry.assistant(assistantText, T0));
        for (String name : interests) {
            draft.addInterests(List.of(InterestRecord.fromMarker(name, T0, "")));
        }
        session.commit(draft);
        return session;
    }

    @Test
    void shortFirstUtteranceIsUsedVerbatim() {
        assertThat(ThreadPayloadComposer.title("I like calculus")).isEqualTo("I like calculus");
    }

    @Test
    void longFirstUtteranceIsCutWithEllipsis() {
        String longText = "x".repeat(150);

        String title = ThreadPayloadComposer.title(longText);

        assertThat(title).hasSize(100).endsWith("...");
        assertThat(title).startsWith("x".repeat(97));
    }

    @Test
    void exactlyHundredCharactersIsKept() {
        String text = "y".repeat(100);

        assertThat(ThreadPayloadComposer.title(text)).isEqualTo(text);
    }

    @Test
    void missingUtteranceGivesDefaults() {
        ThreadPayload payload = composer.compose(sessionWith(null, null, "Hello!").snapshot());

        assertThat(payload.title()).isEqualTo("New Learning Thread");
        assertThat(payload.description()).isEqualTo("Learning exploration");
        assertThat(payload.metadata()).containsEntry("purpose", "create_learning_thread");
    }

    @Test
    void payloadCarriesInterestsTaxonomyAndMetadata() {
        InterviewSession session = sessionWith("study_group", "I really like calculus",
                "Let's talk about derivative rules", "calculus");

        ThreadPayload payload = composer.compose(session.snapshot());

        assertThat(payload.userId()).isEqualTo("u-1");
        assertThat(payload.title()).isEqualTo("I really like calculus");
        assertThat(payload.description()).isEqualTo("I really like calculus");
        assertThat(payload.interests()).containsExactly("calculus");
        assertThat(payload.subjects()).containsExactly("Mathematics");
        assertThat(payload.topics()).containsExactly("Calculus");
        assertThat(payload.concepts()).containsExactly("Derivatives", "Integrals", "Limits");
        assertThat(payload.status()).isEqualTo("active");
        assertThat(payload.metadata())
                .containsEntry("source", "interview")
                .containsEntry("sessionId", "s-1")
                .containsEntry("mode", "thread")
                .containsEntry("purpose", "study_group")
                .doesNotContainKey("summary");
    }

    @Test
    void generatedSummaryTravelsInMetadata() {
        InterviewSession session = sessionWith(null, "I like chess", "Cool");
        session.putAttribute(SessionAttributes.THREAD_SUMMARY, "Title: Chess");

        assertThat(composer.compose(session.snapshot()).metadata()).containsEntry("summary", "Title: Chess");
    }
}
