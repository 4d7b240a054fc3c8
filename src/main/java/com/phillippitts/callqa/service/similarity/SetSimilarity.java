package com.phillippitts.callqa.service.similarity;

import java.util.HashSet;
import java.util.Set;

/**
 * Set overlap measures shared by the entity, action and token signals.
 */
public final class SetSimilarity {

    private SetSimilarity() {
    }

    /**
     * Jaccard similarity |A ∩ B| / |A ∪ B|; 0.0 when either set is null or empty.
     */
    public static double jaccard(Set<String> a, Set<String> b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int intersection = intersectionSize(a, b);
        int union = a.size() + b.size() - intersection;
        return intersection / (double) union;
    }

    /**
     * Size of A ∩ B; 0 when either set is null.
     */
    public static int intersectionSize(Set<String> a, Set<String> b) {
        if (a == null || b == null) {
            return 0;
        }
        Set<String> smaller = a.size() <= b.size() ? a : b;
        Set<String> larger = smaller == a ? b : a;
        Set<String> shared = new HashSet<>(smaller);
        shared.retainAll(larger);
        return shared.size();
    }
}
