package com.phillippitts.callqa.service.similarity;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class EntityTaggerTest {

    private final EntityTagger tagger = new EntityTagger(EntityVocabulary.defaults());

    @Test
    void extractsQualifierNounPhraseAndNoun() {
        assertThat(tagger.tag("Skipped customer name capture"))
                .containsExactlyInAnyOrder("customer_name", "name");
    }

    @Test
    void handlesPossessiveQualifier() {
        assertThat(tagger.tag("Agent missed collecting the customer's name"))
                .containsExactlyInAnyOrder("customer_name", "name");
    }

    @Test
    void overlappingPhrasesAllContribute() {
        assertThat(tagger.tag("Agent skipped the mandatory verification step"))
                .contains("mandatory_verification", "verification_step", "verification");
    }

    @Test
    void returnsEmptyForTextWithoutEntities() {
        assertThat(tagger.tag("Agent was rude to the customer")).isEmpty();
        assertThat(tagger.tag("")).isEmpty();
        assertThat(tagger.tag(null)).isEmpty();
    }

    @Test
    void doesNotMatchInsideLongerWords() {
        assertThat(tagger.tag("renamed the file")).isEmpty();
    }

    @Test
    void customVocabularyWithoutPhrasesOnlyTagsNouns() {
        EntityTagger custom = new EntityTagger(new EntityVocabulary(Set.of(), Set.of(), Set.of("warranty")));

        assertThat(custom.tag("Customer asked about the Warranty terms")).containsExactly("warranty");
    }
}
