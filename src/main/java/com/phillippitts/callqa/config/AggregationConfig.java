package com.phillippitts.callqa.config;

import com.phillippitts.callqa.config.properties.AggregationProperties;
import com.phillippitts.callqa.service.cluster.ClusterSummarizer;
import com.phillippitts.callqa.service.cluster.GreedyClusterer;
import com.phillippitts.callqa.service.similarity.SimilarityVocabulary;
import com.phillippitts.callqa.service.similarity.TextSimilarityScorer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashSet;

@Configuration
public class AggregationConfig {

    private static final Logger LOG = LogManager.getLogger(AggregationConfig.class);

    @Bean
    public SimilarityVocabulary similarityVocabulary(AggregationProperties props) {
        AggregationProperties.Vocabulary extra = props.getVocabulary();
        SimilarityVocabulary defaults = SimilarityVocabulary.defaults();
        if (extra.extraStopwords().isEmpty() && extra.extraSynonyms().isEmpty()) {
            return defaults;
        }
        LOG.info("Extending token vocabulary with {} stopwords and {} synonyms",
                extra.extraStopwords().size(), extra.extraSynonyms().size());
        return new SimilarityVocabulary(defaults.entities(), defaults.actions(),
                defaults.tokens().extend(new LinkedHashSet<>(extra.extraStopwords()), extra.extraSynonyms()));
    }

    @Bean
    public TextSimilarityScorer textSimilarityScorer(SimilarityVocabulary vocabulary) {
        return TextSimilarityScorer.create(vocabulary);
    }

    @Bean
    public GreedyClusterer greedyClusterer(AggregationProperties props) {
        return new GreedyClusterer(props.getSimilarityThreshold());
    }

    @Bean
    public ClusterSummarizer clusterSummarizer(AggregationProperties props) {
        return new ClusterSummarizer(props.getEvidenceSampleSize());
    }
}
