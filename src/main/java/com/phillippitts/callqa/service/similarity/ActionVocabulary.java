package com.phillippitts.callqa.service.similarity;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Closed vocabulary for {@link ActionObjectTagger}.
 *
 * @param verbBuckets       surface verb → normalized action ({@code skipped} → {@code fail})
 * @param passThroughVerbs  verbs that start a pattern but keep their own surface form
 * @param captureVerbs      optional verbs between the action and the object ({@code collecting})
 * @param qualifiers        optional words before the object ({@code the}, {@code customer})
 * @param objects           object nouns that end a pattern
 */
public record ActionVocabulary(
        Map<String, String> verbBuckets,
        Set<String> passThroughVerbs,
        Set<String> captureVerbs,
        Set<String> qualifiers,
        Set<String> objects
) {

    public static final String FAIL = "fail";
    public static final String COLLECT = "collect";
    public static final String VERIFY = "verify";

    public ActionVocabulary {
        verbBuckets = Map.copyOf(verbBuckets);
        passThroughVerbs = Set.copyOf(passThroughVerbs);
        captureVerbs = Set.copyOf(captureVerbs);
        qualifiers = Set.copyOf(qualifiers);
        objects = Set.copyOf(objects);
    }

    /**
     * All verbs that may start a pattern (bucketed and pass-through).
     */
    public Set<String> actionVerbs() {
        Set<String> all = new LinkedHashSet<>(verbBuckets.keySet());
        all.addAll(passThroughVerbs);
        return all;
    }

    /**
     * Maps a matched verb to its bucket; unrecognized verbs pass through unchanged.
     */
    public String normalize(String verb) {
        String bucket = verbBuckets.get(verb);
        return bucket != null ? bucket : verb;
    }

    /**
     * Built-in vocabulary for contact-centre call audits.
     */
    public static ActionVocabulary defaults() {
        Map<String, String> buckets = new LinkedHashMap<>();
        bucket(buckets, FAIL, "fail", "fails", "failed", "failing", "skip", "skips", "skipped", "skipping",
                "miss", "misses", "missed", "omit", "omits", "omitted", "bypass", "bypassed", "forgot",
                "forget", "neglect", "neglected", "did not", "didn't", "never");
        bucket(buckets, COLLECT, "collect", "collects", "collected", "collecting", "capture", "captures",
                "captured", "capturing", "gather", "gathered", "gathering", "obtain", "obtained", "obtaining");
        bucket(buckets, VERIFY, "verify", "verifies", "verified", "verifying", "confirm", "confirms",
                "confirmed", "confirming", "validate", "validated", "validating");
        return new ActionVocabulary(
                buckets,
                Set.of("refused", "declined", "requested", "provided", "repeated", "asked"),
                Set.of("collect", "collecting", "capture", "capturing", "obtain", "obtaining", "get", "getting",
                        "ask for", "asking for", "request", "requesting", "verify", "verifying", "confirm",
                        "confirming", "gather", "gathering", "record", "recording", "take", "taking",
                        "provide", "providing", "give", "giving", "mention", "mentioning", "read", "reading",
                        "offer", "offering"),
                Set.of("the", "a", "an", "customer", "caller", "their", "his", "her", "full", "personal",
                        "account", "contact", "required", "mandatory", "correct", "valid", "security",
                        "billing", "delivery"),
                Set.of("name", "address", "phone", "number", "email", "identity", "account", "date", "birth",
                        "payment", "details", "detail", "information", "consent", "disclosure", "reason",
                        "order", "policy", "password", "pin", "greeting", "apology", "refund", "confirmation"));
    }

    private static void bucket(Map<String, String> buckets, String action, String... verbs) {
        for (String v : verbs) {
            buckets.put(v, action);
        }
    }
}
