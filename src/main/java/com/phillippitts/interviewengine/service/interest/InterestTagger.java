package com.phillippitts.interviewengine.service.interest;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts and strips {@code [INTEREST: name]} markers in generated responses.
 *
 * <p>Markers are case-sensitive. Names are trimmed and compared exactly, so "Chess" and
 * "chess" are distinct interests. Stateless and thread-safe.
 */
public final class InterestTagger {

    private static final Pattern MARKER = Pattern.compile("\\[INTEREST:\\s*([^\\]]+)\\]");
    private static final Pattern MARKER_WHOLE = Pattern.compile("\\[INTEREST:[^\\]]+\\]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Returns the interest names marked in {@code response}, in order of first appearance,
     * without duplicates and without any name already in {@code known}.
     *
     * @param response generated response text; null yields an empty list
     * @param known    names already recorded on the session
     */
    public List<String> extractNew(String response, Collection<String> known) {
        if (response == null || response.isEmpty()) {
            return List.of();
        }
        Set<String> found = new LinkedHashSet<>();
        Matcher m = MARKER.matcher(response);
        while (m.find()) {
            String name = m.group(1).trim();
            if (!name.isEmpty()) {
                found.add(name);
            }
        }
        if (known != null) {
            found.removeAll(known);
        }
        return new ArrayList<>(found);
    }

    /**
     * Removes every marker including its brackets, collapses whitespace runs to one space,
     * and trims. The result is what gets spoken and stored as the assistant entry.
     */
    public String strip(String response) {
        if (response == null) {
            return "";
        }
        String withoutMarkers = MARKER_WHOLE.matcher(response).replaceAll("");
        return WHITESPACE.matcher(withoutMarkers).replaceAll(" ").trim();
    }
}
