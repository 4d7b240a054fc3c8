package com.phillippitts.callqa.service.similarity;

import java.util.Set;

/**
 * Closed vocabulary for {@link EntityTagger}.
 *
 * @param qualifiers     first words of two-word phrases ({@code customer}, {@code mandatory})
 * @param phraseNouns    second words of two-word phrases ({@code name}, {@code step})
 * @param importantNouns nouns that are tags on their own
 */
public record EntityVocabulary(Set<String> qualifiers, Set<String> phraseNouns, Set<String> importantNouns) {

    public EntityVocabulary {
        qualifiers = Set.copyOf(qualifiers);
        phraseNouns = Set.copyOf(phraseNouns);
        importantNouns = Set.copyOf(importantNouns);
    }

    /**
     * Built-in vocabulary for contact-centre call audits.
     */
    public static EntityVocabulary defaults() {
        return new EntityVocabulary(
                Set.of("customer", "caller", "account", "mandatory", "required", "security", "identity",
                        "personal", "contact", "payment", "billing", "order", "phone", "email",
                        "verification", "opening", "closing", "compliance"),
                Set.of("name", "number", "step", "steps", "question", "questions", "detail", "details",
                        "information", "info", "address", "check", "verification", "date", "policy",
                        "script", "greeting", "disclosure", "consent"),
                Set.of("name", "identity", "address", "account", "payment", "refund", "greeting", "script",
                        "policy", "complaint", "escalation", "verification", "empathy", "apology", "language",
                        "transfer", "hold", "password", "email", "phone", "disclosure", "consent", "order",
                        "cancellation", "billing"));
    }
}
