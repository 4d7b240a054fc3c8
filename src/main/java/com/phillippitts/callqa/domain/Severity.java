package com.phillippitts.callqa.domain;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;

/**
 * Severity of a finding, totally ordered by {@link #rank()}.
 *
 * <p>{@link #UNKNOWN} (rank 0) absorbs labels outside the closed set so that aggregation never fails
 * on bad upstream data. Parsing such a label logs a warning.
 */
public enum Severity {
    UNKNOWN(0),
    LOW(1),
    MEDIUM(2),
    HIGH(3),
    CRITICAL(4);

    private static final Logger LOG = LogManager.getLogger(Severity.class);

    private final int rank;

    Severity(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    /**
     * Lowercase wire label ({@code low}, {@code medium}, ...).
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a severity label case-insensitively.
     *
     * @param label label such as {@code "high"} (may be null)
     * @return matching severity, or {@link #UNKNOWN} for null, blank or unrecognized labels
     */
    public static Severity fromLabel(String label) {
        if (label == null || label.isBlank()) {
            LOG.warn("Missing severity label; treating as rank 0");
            return UNKNOWN;
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        for (Severity s : values()) {
            if (s != UNKNOWN && s.name().equals(normalized)) {
                return s;
            }
        }
        LOG.warn("Unrecognized severity label '{}'; treating as rank 0", label);
        return UNKNOWN;
    }

    /**
     * Returns the more severe of two severities (first wins on equal rank).
     */
    public static Severity max(Severity a, Severity b) {
        return b.rank > a.rank ? b : a;
    }
}
