package com.phillippitts.callqa.service.similarity;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Base class for regex-driven taggers, implementing the common null handling and lowercasing.
 *
 * <p>{@link #tag(String)} returns an empty set for null or blank input and otherwise hands the
 * lowercased text to {@link #doTag(String, Set)}. Subclasses only add matches to the sink.
 */
public abstract class AbstractPatternTagger implements TextTagger {

    @Override
    public final Set<String> tag(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        Set<String> sink = new LinkedHashSet<>();
        doTag(text.toLowerCase(Locale.ROOT), sink);
        return Collections.unmodifiableSet(sink);
    }

    /**
     * Collects tags from lowercased, non-blank text.
     *
     * @param lowerText lowercased input (never null or blank)
     * @param sink      ordered set receiving tags
     */
    protected abstract void doTag(String lowerText, Set<String> sink);

    /**
     * Builds a regex alternation of the given literal words, longest first so that
     * longer forms win over their prefixes.
     */
    protected static String alternation(Set<String> words) {
        return words.stream()
                .filter(w -> w != null && !w.isBlank())
                .map(w -> w.toLowerCase(Locale.ROOT).trim())
                .distinct()
                .sorted((a, b) -> a.length() != b.length() ? b.length() - a.length() : a.compareTo(b))
                .map(w -> Pattern.quote(w).replace(" ", "\\E\\s+\\Q"))
                .collect(Collectors.joining("|"));
    }
}
