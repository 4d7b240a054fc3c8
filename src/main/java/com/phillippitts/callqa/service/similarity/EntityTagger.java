package com.phillippitts.callqa.service.similarity;

import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts domain-agnostic semantic entities from free text.
 *
 * <p>Two pattern families run against the lowercased text:
 * <ul>
 *   <li>qualifier + noun phrases, emitted underscore-joined ({@code "customer's name"} → {@code customer_name})</li>
 *   <li>single important nouns ({@code name}, {@code refund})</li>
 * </ul>
 * Phrase nouns are matched with a lookahead so overlapping phrases ({@code mandatory verification step})
 * all contribute.
 */
public final class EntityTagger extends AbstractPatternTagger {

    private final Pattern phrasePattern;
    private final Pattern nounPattern;

    public EntityTagger(EntityVocabulary vocabulary) {
        Objects.requireNonNull(vocabulary, "vocabulary");
        this.phrasePattern = compile("\\b(" + alternation(vocabulary.qualifiers()) + ")(?:['’]s)?\\s+(?=("
                + alternation(vocabulary.phraseNouns()) + ")\\b)", vocabulary.qualifiers(), vocabulary.phraseNouns());
        this.nounPattern = compile("\\b(" + alternation(vocabulary.importantNouns()) + ")\\b",
                vocabulary.importantNouns());
    }

    @Override
    protected void doTag(String lowerText, Set<String> sink) {
        if (phrasePattern != null) {
            Matcher m = phrasePattern.matcher(lowerText);
            while (m.find()) {
                sink.add(m.group(1) + "_" + m.group(2));
            }
        }
        if (nounPattern != null) {
            Matcher m = nounPattern.matcher(lowerText);
            while (m.find()) {
                sink.add(m.group(1));
            }
        }
    }

    @SafeVarargs
    private static Pattern compile(String regex, Set<String>... required) {
        for (Set<String> words : required) {
            if (words.isEmpty()) {
                return null;
            }
        }
        return Pattern.compile(regex);
    }
}
