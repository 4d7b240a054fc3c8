package com.phillippitts.callqa.domain;

import com.phillippitts.callqa.service.cluster.ClusterSummarizer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.phillippitts.callqa.testutil.Findings.issue;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FindingClusterTest {

    private final FindingCluster cluster = new ClusterSummarizer().summarize(List.of(
            issue("a", "c1", "quality_issue", Severity.HIGH, 90, "x"),
            issue("b", "c2", "quality_issue", Severity.LOW, 60, "x"),
            issue("c", "c3", "quality_issue", Severity.LOW, 60, "x")));

    @Test
    void sampleMembersReturnsPrefix() {
        assertThat(cluster.sampleMembers(2)).extracting(Finding::id).containsExactly("a", "b");
        assertThat(cluster.sampleMembers(10)).hasSize(3);
        assertThat(cluster.sampleMembers(-1)).isEmpty();
    }

    @Test
    void impactWeighsOccurrencesBySeverity() {
        assertThat(cluster.occurrences()).isEqualTo(3);
        assertThat(cluster.impact()).isEqualTo(3 * Severity.HIGH.rank());
    }

    @Test
    void collectionsAreImmutable() {
        assertThatThrownBy(() -> cluster.members().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
