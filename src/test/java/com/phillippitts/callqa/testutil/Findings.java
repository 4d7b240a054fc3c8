package com.phillippitts.callqa.testutil;

import com.phillippitts.callqa.domain.Finding;
import com.phillippitts.callqa.domain.Severity;

/**
 * Small factories for test findings.
 */
public final class Findings {

    private Findings() {
    }

    public static Finding issue(String id, String callId, String type, String description) {
        return Finding.issue(id, callId, type, Severity.MEDIUM, 80, description, "");
    }

    public static Finding issue(String id, String callId, String type, Severity severity, int confidence,
                                String description) {
        return Finding.issue(id, callId, type, severity, confidence, description, "");
    }

    public static Finding scenario(String id, String callId, String dimension, String title, Severity severity) {
        return Finding.scenario(id, callId, dimension, null, title, title, severity, 75);
    }
}
