package com.phillippitts.callqa.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.Map;

@Validated
@ConfigurationProperties(prefix = "aggregation")
public class AggregationProperties {

    /** Minimum combined similarity (0..1) for a finding to join a cluster. */
    @Min(0)
    @Max(1)
    private final double similarityThreshold;

    /** Evidence snippets kept per cluster. */
    @Min(1)
    private final int evidenceSampleSize;

    private final Vocabulary vocabulary;

    @ConstructorBinding
    public AggregationProperties(Double similarityThreshold, Integer evidenceSampleSize, Vocabulary vocabulary) {
        double t = similarityThreshold == null ? 0.30 : similarityThreshold;
        if (t < 0.0 || t > 1.0) {
            throw new IllegalArgumentException("aggregation.similarity-threshold must be in [0,1]");
        }
        this.similarityThreshold = t;

        int n = evidenceSampleSize == null ? 3 : evidenceSampleSize;
        if (n < 1) {
            throw new IllegalArgumentException("aggregation.evidence-sample-size must be >= 1");
        }
        this.evidenceSampleSize = n;
        this.vocabulary = vocabulary == null ? new Vocabulary(null, null) : vocabulary;
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public int getEvidenceSampleSize() {
        return evidenceSampleSize;
    }

    public Vocabulary getVocabulary() {
        return vocabulary;
    }

    /**
     * Additions to the built-in token vocabulary.
     *
     * @param extraStopwords tokens to drop before comparison
     * @param extraSynonyms  token → canonical token
     */
    public record Vocabulary(List<String> extraStopwords, Map<String, String> extraSynonyms) {

        public Vocabulary {
            extraStopwords = extraStopwords == null ? List.of() : List.copyOf(extraStopwords);
            extraSynonyms = extraSynonyms == null ? Map.of() : Map.copyOf(extraSynonyms);
        }
    }
}
