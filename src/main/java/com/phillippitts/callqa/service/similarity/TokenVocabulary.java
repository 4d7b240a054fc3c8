package com.phillippitts.callqa.service.similarity;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Stopwords and many-to-one synonyms applied by {@link TokenizerUtil}.
 *
 * @param stopwords tokens dropped before comparison
 * @param synonyms  token → canonical token ({@code skipped} → {@code fail})
 */
public record TokenVocabulary(Set<String> stopwords, Map<String, String> synonyms) {

    public TokenVocabulary {
        stopwords = Set.copyOf(stopwords);
        synonyms = Map.copyOf(synonyms);
    }

    /**
     * Returns a copy extended with extra stopwords and synonyms (extras override built-ins).
     */
    public TokenVocabulary extend(Set<String> extraStopwords, Map<String, String> extraSynonyms) {
        Set<String> stops = new LinkedHashSet<>(stopwords);
        if (extraStopwords != null) {
            extraStopwords.forEach(s -> stops.add(s.toLowerCase(Locale.ROOT)));
        }
        Map<String, String> syn = new HashMap<>(synonyms);
        if (extraSynonyms != null) {
            extraSynonyms.forEach((k, v) -> syn.put(k.toLowerCase(Locale.ROOT), v.toLowerCase(Locale.ROOT)));
        }
        return new TokenVocabulary(stops, syn);
    }

    /**
     * Built-in vocabulary for contact-centre call audits.
     */
    public static TokenVocabulary defaults() {
        Set<String> stopwords = Set.of("the", "and", "but", "for", "with", "from", "was", "are", "were", "been",
                "being", "have", "has", "had", "does", "did", "will", "would", "could", "should", "this", "that",
                "these", "those", "not", "into", "about", "after", "before", "during", "while", "when", "then",
                "than", "there", "their", "they", "them", "his", "her", "him", "she", "you", "your", "our",
                "also", "very", "just", "any", "all", "some", "such", "which", "who", "whom", "what");

        Map<String, String> synonyms = new LinkedHashMap<>();
        map(synonyms, "fail", "skip", "skips", "skipped", "skipping", "miss", "misses", "missed", "missing",
                "omit", "omits", "omitted", "omitting", "bypass", "bypassed", "bypassing", "fails", "failed",
                "failing", "failure", "forgot", "forget", "forgets", "forgotten", "neglect", "neglected",
                "neglecting", "ignore", "ignored", "ignoring");
        map(synonyms, "collect", "collects", "collected", "collecting", "collection", "capture", "captures",
                "captured", "capturing", "gather", "gathered", "gathering", "obtain", "obtained", "obtaining");
        map(synonyms, "verify", "verifies", "verified", "verifying", "verification", "confirm", "confirms",
                "confirmed", "confirming", "confirmation", "validate", "validated", "validating", "validation");
        map(synonyms, "customer", "customers", "caller", "callers", "client", "clients");
        map(synonyms, "name", "names");
        map(synonyms, "rude", "impolite", "disrespectful", "dismissive", "curt");
        map(synonyms, "repeat", "repeated", "repeating", "repetition", "repetitive", "loop", "looping");
        map(synonyms, "greeting", "greet", "greeted", "greetings");
        map(synonyms, "escalate", "escalated", "escalating", "escalation");
        map(synonyms, "transfer", "transferred", "transferring");
        map(synonyms, "apologize", "apology", "apologized", "apologise", "apologised");
        map(synonyms, "empathy", "empathetic", "empathize", "empathise", "sympathy");
        return new TokenVocabulary(stopwords, synonyms);
    }

    private static void map(Map<String, String> synonyms, String canonical, String... variants) {
        for (String v : variants) {
            synonyms.put(v, canonical);
        }
    }
}
