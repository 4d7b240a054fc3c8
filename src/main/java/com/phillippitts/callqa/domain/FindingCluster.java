package com.phillippitts.callqa.domain;

import java.util.List;
import java.util.Objects;

/**
 * Aggregate view of a group of findings judged to describe the same recurring pattern.
 *
 * @param id              cluster id, unique within one aggregation result
 * @param groupKey        stable grouping key (partition plus creation index)
 * @param representative  most frequent label across members (ties go to the first seen)
 * @param dimension       scenario dimension of the partition, empty for issue clusters
 * @param rootCauseType   scenario root cause of the partition, empty when absent
 * @param patternText     verbatim description or an "N patterns across M calls" summary
 * @param severity        worst member severity
 * @param avgConfidence   mean member confidence rounded half-up
 * @param occurrences     occurrence count used for ordering (calls or members, per profile)
 * @param uniqueCalls     number of distinct calls among members
 * @param affectedCallIds distinct call ids in first-occurrence order
 * @param members         member findings in input order
 * @param evidenceSnippets up to the configured number of distinct evidence snippets
 * @param sourceChecks    distinct custom check names among members
 * @param distinctLabels  number of distinct member labels merged into this cluster
 */
public record FindingCluster(
        String id,
        String groupKey,
        String representative,
        String dimension,
        String rootCauseType,
        String patternText,
        Severity severity,
        int avgConfidence,
        int occurrences,
        int uniqueCalls,
        List<String> affectedCallIds,
        List<Finding> members,
        List<String> evidenceSnippets,
        List<String> sourceChecks,
        int distinctLabels
) {

    public FindingCluster {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(severity, "severity");
        affectedCallIds = List.copyOf(affectedCallIds);
        members = List.copyOf(members);
        evidenceSnippets = List.copyOf(evidenceSnippets);
        sourceChecks = List.copyOf(sourceChecks);
    }

    public int size() {
        return members.size();
    }

    /**
     * Impact score used by scenario ordering: occurrences weighted by severity rank.
     */
    public int impact() {
        return occurrences * severity.rank();
    }

    /**
     * Returns the first {@code limit} members, for prompt builders that only need a handful of examples.
     *
     * @param limit maximum number of members to return (negative treated as 0)
     * @return immutable prefix of {@link #members()}
     */
    public List<Finding> sampleMembers(int limit) {
        int n = Math.max(0, Math.min(limit, members.size()));
        return members.subList(0, n);
    }
}
