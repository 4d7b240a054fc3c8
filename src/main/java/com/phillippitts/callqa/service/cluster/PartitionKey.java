package com.phillippitts.callqa.service.cluster;

import java.util.regex.Pattern;

/**
 * Hard pre-partition key for scenario aggregation: findings in different partitions are never
 * compared, whatever their textual similarity.
 *
 * <p>Normalization trims whitespace and strips a trailing single-letter tag such as {@code "(A)"}
 * from the dimension. Comparison is otherwise exact and case-sensitive. Missing values default to
 * {@value #DEFAULT_DIMENSION} / {@value #DEFAULT_ROOT_CAUSE}.
 *
 * @param dimension     normalized dimension
 * @param rootCauseType normalized root cause
 */
public record PartitionKey(String dimension, String rootCauseType) {

    public static final String DEFAULT_DIMENSION = "Uncategorized";
    public static final String DEFAULT_ROOT_CAUSE = "unknown";

    /** Single partition used by profiles that do not pre-partition. */
    public static final PartitionKey NONE = new PartitionKey("", "");

    private static final Pattern TRAILING_TAG = Pattern.compile("\\s*\\([A-Za-z]\\)\\s*$");

    /**
     * Builds a normalized key from raw scenario fields.
     */
    public static PartitionKey of(String dimension, String rootCauseType) {
        String dim = normalizeDimension(dimension);
        String root = rootCauseType == null || rootCauseType.isBlank() ? DEFAULT_ROOT_CAUSE : rootCauseType.trim();
        return new PartitionKey(dim.isEmpty() ? DEFAULT_DIMENSION : dim, root);
    }

    static String normalizeDimension(String dimension) {
        if (dimension == null) {
            return "";
        }
        return TRAILING_TAG.matcher(dimension.trim()).replaceFirst("").trim();
    }

    public boolean hasRootCause() {
        return !rootCauseType.isEmpty() && !DEFAULT_ROOT_CAUSE.equals(rootCauseType);
    }

    @Override
    public String toString() {
        return dimension + "||" + rootCauseType;
    }
}
