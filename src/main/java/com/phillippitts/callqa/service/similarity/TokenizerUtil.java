package com.phillippitts.callqa.service.similarity;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Utility for turning free text into a normalized token set.
 *
 * <p>Tokenization rules:
 * <ul>
 *   <li>Lowercase</li>
 *   <li>Strip every non-alphanumeric, non-whitespace character ({@code customer's} → {@code customers},
 *       {@code flow_deviation} → {@code flowdeviation})</li>
 *   <li>Split on whitespace</li>
 *   <li>Drop tokens of length ≤ {@value #MAX_DROPPED_LENGTH} and stopwords</li>
 *   <li>Map each surviving token through the synonym table</li>
 * </ul>
 */
public final class TokenizerUtil {

    static final int MAX_DROPPED_LENGTH = 2;

    private TokenizerUtil() {
        // Prevent instantiation
    }

    /**
     * Tokenizes text into a normalized token set.
     *
     * @param text       input text (may be null or blank)
     * @param vocabulary stopwords and synonyms to apply
     * @return ordered set of canonical tokens (empty if no valid tokens)
     */
    public static Set<String> tokenize(String text, TokenVocabulary vocabulary) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        String cleaned = text.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9\\s]", "");
        Set<String> tokens = new LinkedHashSet<>();
        for (String part : cleaned.split("\\s+")) {
            if (part.length() <= MAX_DROPPED_LENGTH || vocabulary.stopwords().contains(part)) {
                continue;
            }
            tokens.add(vocabulary.synonyms().getOrDefault(part, part));
        }
        return tokens;
    }
}
