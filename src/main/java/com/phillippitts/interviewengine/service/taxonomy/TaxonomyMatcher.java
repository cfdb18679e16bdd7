package com.phillippitts.interviewengine.service.taxonomy;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Keyword classifier mapping free text to subjects, topics and concepts.
 *
 * <p>Matching is a case-insensitive substring test against the lower-cased concatenation of
 * the input utterances. The tables are static and the matcher holds no state, so a single
 * instance is shared by every session.
 *
 * <p>When no subject keyword appears the subject set is exactly {@value #DEFAULT_SUBJECT}.
 * Topics and concepts have no default.
 */
public final class TaxonomyMatcher {

    public static final String DEFAULT_SUBJECT = "General Learning";

    private static final Map<String, List<String>> SUBJECT_KEYWORDS = new LinkedHashMap<>();
    private static final Map<String, List<String>> TOPIC_KEYWORDS = new LinkedHashMap<>();
    private static final Map<String, List<String>> CONCEPT_TRIGGERS = new LinkedHashMap<>();

    static {
        SUBJECT_KEYWORDS.put("Mathematics",
                List.of("math", "calculus", "algebra", "geometry", "statistics", "equation", "theorem"));
        SUBJECT_KEYWORDS.put("Physics",
                List.of("physics", "force", "energy", "motion", "quantum", "gravity", "momentum"));
        SUBJECT_KEYWORDS.put("Chemistry",
                List.of("chemistry", "chemical", "molecule", "reaction", "element", "compound", "atom"));
        SUBJECT_KEYWORDS.put("Biology",
                List.of("biology", "cell", "dna", "evolution", "organism", "ecology", "genetics"));
        SUBJECT_KEYWORDS.put("Computer Science",
                List.of("programming", "algorithm", "code", "software", "computer", "data structure"));
        SUBJECT_KEYWORDS.put("History",
                List.of("history", "historical", "civilization", "war", "revolution", "ancient", "modern"));
        SUBJECT_KEYWORDS.put("Literature",
                List.of("literature", "novel", "poetry", "writing", "author", "story", "narrative"));
        SUBJECT_KEYWORDS.put("Psychology",
                List.of("psychology", "behavior", "mind", "cognitive", "emotion", "personality"));
        SUBJECT_KEYWORDS.put("Economics",
                List.of("economics", "economy", "market", "finance", "trade", "supply", "demand"));
        SUBJECT_KEYWORDS.put("Art",
                List.of("art", "painting", "sculpture", "drawing", "artistic", "gallery", "museum"));

        TOPIC_KEYWORDS.put("Calculus", List.of("calculus", "derivative", "integral"));
        TOPIC_KEYWORDS.put("Mechanics", List.of("physics", "motion", "force"));
        TOPIC_KEYWORDS.put("Organic Chemistry", List.of("organic", "carbon", "compound"));
        TOPIC_KEYWORDS.put("Genetics", List.of("gene", "dna", "heredity"));
        TOPIC_KEYWORDS.put("Algorithms", List.of("algorithm", "sorting", "searching"));
        TOPIC_KEYWORDS.put("World History", List.of("history", "civilization", "culture"));
        TOPIC_KEYWORDS.put("Literary Analysis", List.of("literature", "theme", "character"));

        List<String> calculus = List.of("Derivatives", "Integrals", "Limits");
        CONCEPT_TRIGGERS.put("calculus", calculus);
        CONCEPT_TRIGGERS.put("derivative", calculus);
        CONCEPT_TRIGGERS.put("integral", calculus);
        CONCEPT_TRIGGERS.put("algebra", List.of("Equations", "Variables", "Functions"));
        CONCEPT_TRIGGERS.put("physics", List.of("Motion", "Forces", "Energy"));
        CONCEPT_TRIGGERS.put("chemistry", List.of("Reactions", "Bonds", "Elements"));
        CONCEPT_TRIGGERS.put("programming", List.of("Algorithms", "Data Structures", "Design Patterns"));
        CONCEPT_TRIGGERS.put("economics", List.of("Supply and Demand", "Market Theory", "Economic Models"));
    }

    /**
     * Classifies a single piece of text.
     */
    public TaxonomyMatch match(String text) {
        return match(text == null ? List.of() : List.of(text));
    }

    /**
     * Classifies the concatenation of several utterances.
     *
     * @param utterances texts to scan; null elements are skipped
     * @return matched labels, never null
     */
    public TaxonomyMatch match(Collection<String> utterances) {
        Objects.requireNonNull(utterances, "utterances must not be null");
        String haystack = normalize(utterances);

        Set<String> subjects = labelsFor(SUBJECT_KEYWORDS, haystack);
        boolean defaulted = subjects.isEmpty();
        if (defaulted) {
            subjects.add(DEFAULT_SUBJECT);
        }
        Set<String> topics = labelsFor(TOPIC_KEYWORDS, haystack);

        Set<String> concepts = new LinkedHashSet<>();
        for (Map.Entry<String, List<String>> trigger : CONCEPT_TRIGGERS.entrySet()) {
            if (haystack.contains(trigger.getKey())) {
                concepts.addAll(trigger.getValue());
            }
        }
        return new TaxonomyMatch(subjects, topics, concepts, defaulted);
    }

    private static Set<String> labelsFor(Map<String, List<String>> table, String haystack) {
        Set<String> labels = new LinkedHashSet<>();
        for (Map.Entry<String, List<String>> row : table.entrySet()) {
            for (String keyword : row.getValue()) {
                if (haystack.contains(keyword)) {
                    labels.add(row.getKey());
                    break;
                }
            }
        }
        return labels;
    }

    private static String normalize(Collection<String> utterances) {
        StringBuilder sb = new StringBuilder();
        for (String u : utterances) {
            if (u == null) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(u);
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }
}
