package com.phillippitts.callqa.domain;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Immutable record of one detected issue or scenario instance, tied to a call and a transcript location.
 *
 * <p>Findings arrive already typed from the upstream detector. The compact constructor only applies
 * last-resort defaults: null text becomes {@code ""}, null line numbers become an empty list and a
 * null severity becomes {@link Severity#UNKNOWN} (logged at WARN). It never throws on content.
 *
 * @param id              opaque stable identifier
 * @param callId          identifier of the source transcript
 * @param type            free-form category label (issue type or custom check output type)
 * @param title           short title (scenarios); may be empty for issues
 * @param description     longer explanation / what-happened text
 * @param evidenceSnippet transcript excerpt supporting the finding
 * @param severity        severity, {@link Severity#UNKNOWN} when upstream sent an unexpected value
 * @param confidence      detector confidence, nominally 0-100
 * @param lineNumbers     transcript line indices (informational)
 * @param dimension       scenario dimension label, empty for issues
 * @param rootCauseType   optional scenario root-cause partition key, empty when absent
 * @param sourceCheckName display name of the custom check that produced this finding, empty when absent
 */
public record Finding(
        String id,
        String callId,
        String type,
        String title,
        String description,
        String evidenceSnippet,
        Severity severity,
        int confidence,
        List<Integer> lineNumbers,
        String dimension,
        String rootCauseType,
        String sourceCheckName
) {

    private static final Logger LOG = LogManager.getLogger(Finding.class);

    public Finding {
        id = orEmpty(id);
        callId = orEmpty(callId);
        type = orEmpty(type);
        title = orEmpty(title);
        description = orEmpty(description);
        evidenceSnippet = orEmpty(evidenceSnippet);
        if (severity == null) {
            LOG.warn("Finding {} (call {}) has no severity; treating as rank 0", id, callId);
            severity = Severity.UNKNOWN;
        }
        lineNumbers = lineNumbers == null
                ? List.of()
                : lineNumbers.stream().filter(Objects::nonNull).toList();
        dimension = orEmpty(dimension);
        rootCauseType = orEmpty(rootCauseType);
        sourceCheckName = orEmpty(sourceCheckName);
    }

    /**
     * Creates a standard detected-issue finding.
     */
    public static Finding issue(String id, String callId, String type, Severity severity, int confidence,
                                String explanation, String evidenceSnippet) {
        return builder(id, callId)
                .type(type)
                .severity(severity)
                .confidence(confidence)
                .description(explanation)
                .evidenceSnippet(evidenceSnippet)
                .build();
    }

    /**
     * Creates an open-ended scenario finding.
     */
    public static Finding scenario(String id, String callId, String dimension, String rootCauseType,
                                   String title, String whatHappened, Severity severity, int confidence) {
        return builder(id, callId)
                .dimension(dimension)
                .rootCauseType(rootCauseType)
                .title(title)
                .description(whatHappened)
                .severity(severity)
                .confidence(confidence)
                .build();
    }

    public static Builder builder(String id, String callId) {
        return new Builder(id, callId);
    }

    private static String orEmpty(String s) {
        return s == null ? "" : s;
    }

    /**
     * Fluent builder for findings with many optional fields.
     */
    public static final class Builder {
        private final String id;
        private final String callId;
        private String type;
        private String title;
        private String description;
        private String evidenceSnippet;
        private Severity severity = Severity.UNKNOWN;
        private int confidence;
        private List<Integer> lineNumbers = List.of();
        private String dimension;
        private String rootCauseType;
        private String sourceCheckName;

        private Builder(String id, String callId) {
            this.id = Objects.requireNonNull(id, "id");
            this.callId = Objects.requireNonNull(callId, "callId");
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder evidenceSnippet(String evidenceSnippet) {
            this.evidenceSnippet = evidenceSnippet;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder severity(String label) {
            this.severity = Severity.fromLabel(label);
            return this;
        }

        public Builder confidence(int confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder lineNumbers(List<Integer> lineNumbers) {
            this.lineNumbers = lineNumbers;
            return this;
        }

        public Builder dimension(String dimension) {
            this.dimension = dimension;
            return this;
        }

        public Builder rootCauseType(String rootCauseType) {
            this.rootCauseType = rootCauseType;
            return this;
        }

        public Builder sourceCheckName(String sourceCheckName) {
            this.sourceCheckName = sourceCheckName;
            return this;
        }

        public Finding build() {
            return new Finding(id, callId, type, title, description, evidenceSnippet, severity, confidence,
                    lineNumbers, dimension, rootCauseType, sourceCheckName);
        }
    }
}
