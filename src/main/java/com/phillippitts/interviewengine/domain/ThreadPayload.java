package com.phillippitts.interviewengine.domain;

import java.util.List;
import java.util.Map;

/**
 * Request body for the downstream learning-thread service.
 */
public record ThreadPayload(
        String userId,
        String title,
        String description,
        List<String> interests,
        List<String> concepts,
        List<String> subjects,
        List<String> topics,
        String status,
        Map<String, String> metadata
) {

    public ThreadPayload {
        interests = List.copyOf(interests);
        concepts = List.copyOf(concepts);
        subjects = List.copyOf(subjects);
        topics = List.copyOf(topics);
        metadata = Map.copyOf(metadata);
    }
}
