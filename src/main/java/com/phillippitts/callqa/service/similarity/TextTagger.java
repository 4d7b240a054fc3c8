package com.phillippitts.callqa.service.similarity;

import java.util.Set;

/**
 * Capability interface for pulling normalized semantic tags out of free text.
 *
 * <p><b>Available Taggers:</b>
 * <ul>
 *   <li>{@link EntityTagger} - domain noun phrases and important nouns ({@code customer_name}, {@code name})</li>
 *   <li>{@link ActionObjectTagger} - normalized action/object pairs ({@code fail_name})</li>
 * </ul>
 *
 * <p><b>Contract:</b> implementations are deterministic, stateless and total. Null, blank or
 * unmatched text yields an empty set; no input raises an exception. Rule sets are bound at
 * construction time so vocabularies can be swapped per deployment without touching matching logic.
 */
public interface TextTagger {

    /**
     * Extracts tags from text.
     *
     * @param text free text (may be null)
     * @return immutable set of tags in first-match order (empty if nothing matched)
     */
    Set<String> tag(String text);
}
