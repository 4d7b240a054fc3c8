package com.phillippitts.callqa.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SeverityTest {

    @Test
    void ranksAreTotallyOrdered() {
        assertThat(Severity.UNKNOWN.rank()).isZero();
        assertThat(Severity.LOW.rank()).isLessThan(Severity.MEDIUM.rank());
        assertThat(Severity.MEDIUM.rank()).isLessThan(Severity.HIGH.rank());
        assertThat(Severity.HIGH.rank()).isLessThan(Severity.CRITICAL.rank());
    }

    @Test
    void parsesLabelsCaseInsensitively() {
        assertThat(Severity.fromLabel("high")).isEqualTo(Severity.HIGH);
        assertThat(Severity.fromLabel(" Critical ")).isEqualTo(Severity.CRITICAL);
        assertThat(Severity.fromLabel("LOW")).isEqualTo(Severity.LOW);
    }

    @Test
    void unexpectedLabelsBecomeUnknown() {
        assertThat(Severity.fromLabel("urgent")).isEqualTo(Severity.UNKNOWN);
        assertThat(Severity.fromLabel("unknown")).isEqualTo(Severity.UNKNOWN);
        assertThat(Severity.fromLabel("")).isEqualTo(Severity.UNKNOWN);
        assertThat(Severity.fromLabel(null)).isEqualTo(Severity.UNKNOWN);
    }

    @Test
    void maxPicksHigherRankAndFirstOnTie() {
        assertThat(Severity.max(Severity.LOW, Severity.HIGH)).isEqualTo(Severity.HIGH);
        assertThat(Severity.max(Severity.CRITICAL, Severity.MEDIUM)).isEqualTo(Severity.CRITICAL);
        assertThat(Severity.max(Severity.MEDIUM, Severity.MEDIUM)).isSameAs(Severity.MEDIUM);
    }

    @Test
    void labelIsLowercaseName() {
        assertThat(Severity.MEDIUM.label()).isEqualTo("medium");
    }
}
