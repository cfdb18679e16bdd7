package com.phillippitts.interviewengine.service.handoff;

import com.phillippitts.interviewengine.domain.SessionAttributes;
import com.phillippitts.interviewengine.domain.ThreadPayload;
import com.phillippitts.interviewengine.service.session.SessionSnapshot;
import com.phillippitts.interviewengine.service.taxonomy.TaxonomyMatch;
import com.phillippitts.interviewengine.service.taxonomy.TaxonomyMatcher;
import com.phillippitts.interviewengine.util.LogSanitizer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the learning-thread request for a completed session.
 *
 * <p>Title and description come from the first user utterance; subjects, topics and concepts
 * come from the taxonomy over the whole transcript. A generated thread summary, when present,
 * travels in the metadata under {@code summary}.
 */
public class ThreadPayloadComposer {

    static final int MAX_TITLE_CHARS = 100;
    static final String DEFAULT_TITLE = "New Learning Thread";
    static final String DEFAULT_DESCRIPTION = "Learning exploration";
    static final String DEFAULT_PURPOSE = "create_learning_thread";
    static final String STATUS_ACTIVE = "active";
    static final String SOURCE = "interview";

    private final TaxonomyMatcher taxonomy;

    public ThreadPayloadComposer(TaxonomyMatcher taxonomy) {
        this.taxonomy = Objects.requireNonNull(taxonomy, "taxonomy");
    }

    /**
     * First utterance verbatim up to 100 characters, otherwise its first 97 characters plus
     * "...". Blank or missing utterances give the default title.
     */
    public static String title(String firstUtterance) {
        if (firstUtterance == null || firstUtterance.isBlank()) {
            return DEFAULT_TITLE;
        }
        return LogSanitizer.abbreviate(firstUtterance, MAX_TITLE_CHARS);
    }

    public ThreadPayload compose(SessionSnapshot snapshot) {
        String first = snapshot.firstUserUtterance().orElse(null);
        String description = (first == null || first.isBlank()) ? DEFAULT_DESCRIPTION : first;
        TaxonomyMatch match = taxonomy.match(snapshot.allUtterances());

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("source", SOURCE);
        metadata.put("sessionId", snapshot.sessionId());
        metadata.put("mode", snapshot.mode() == null ? "" : snapshot.mode());
        metadata.put("purpose", snapshot.purpose() == null || snapshot.purpose().isBlank()
                ? DEFAULT_PURPOSE : snapshot.purpose());
        String summary = snapshot.attribute(SessionAttributes.THREAD_SUMMARY);
        if (summary != null) {
            metadata.put("summary", summary);
        }

        return new ThreadPayload(
                snapshot.userId(),
                title(first),
                description,
                snapshot.interestNames(),
                new ArrayList<>(match.concepts()),
                new ArrayList<>(match.subjects()),
                new ArrayList<>(match.topics()),
                STATUS_ACTIVE,
                metadata);
    }
}
