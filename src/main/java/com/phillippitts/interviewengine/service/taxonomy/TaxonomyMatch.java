package com.phillippitts.interviewengine.service.taxonomy;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Labels matched by {@link TaxonomyMatcher}. Each set is deduplicated and keeps table order.
 *
 * @param subjects         matched subjects, or only the default subject when nothing matched
 * @param topics           matched topics, possibly empty
 * @param concepts         concept labels contributed by trigger keywords, possibly empty
 * @param defaultedSubject true when {@code subjects} holds only the default
 */
public record TaxonomyMatch(
        Set<String> subjects,
        Set<String> topics,
        Set<String> concepts,
        boolean defaultedSubject
) {

    public TaxonomyMatch {
        subjects = Collections.unmodifiableSet(new LinkedHashSet<>(subjects));
        topics = Collections.unmodifiableSet(new LinkedHashSet<>(topics));
        concepts = Collections.unmodifiableSet(new LinkedHashSet<>(concepts));
    }

    /**
     * Concepts, topics and matched subjects in one ordered set, the shape accumulated on the
     * session after each turn. The default subject is left out.
     */
    public Set<String> keywords() {
        Set<String> all = new LinkedHashSet<>(concepts);
        all.addAll(topics);
        if (!defaultedSubject) {
            all.addAll(subjects);
        }
        return Collections.unmodifiableSet(all);
    }
}
