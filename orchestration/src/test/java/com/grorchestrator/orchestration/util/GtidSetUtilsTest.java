package com.grorchestrator.orchestration.util;

import com.grorchestrator.orchestration.exception.InvalidArgumentException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GtidSetUtilsTest {
    private static final String SOURCE_A = "3e11fa47-71ca-11e1-9e33-c80aa9429562";
    private static final String SOURCE_B = "8a94f357-aab4-11df-86ab-c80aa9429562";

    @Test
    void emptySetIsSubsetOfAnything() {
        assertThat(GtidSetUtils.isSubset("", SOURCE_A + ":1-5")).isTrue();
        assertThat(GtidSetUtils.isSubset(null, "")).isTrue();
    }

    @Test
    void subsetWithinSingleInterval() {
        assertThat(GtidSetUtils.isSubset(SOURCE_A + ":3-7", SOURCE_A + ":1-10")).isTrue();
        assertThat(GtidSetUtils.isSubset(SOURCE_A + ":3-11", SOURCE_A + ":1-10")).isFalse();
    }

    @Test
    void subsetSpanningAdjacentIntervals() {
        assertThat(GtidSetUtils.isSubset(SOURCE_A + ":2-8", SOURCE_A + ":6-10:1-5")).isTrue();
        assertThat(GtidSetUtils.isSubset(SOURCE_A + ":2-8", SOURCE_A + ":1-5:7-10")).isFalse();
    }

    @Test
    void extraSourceIsNotSubset() {
        assertThat(GtidSetUtils.isSubset(SOURCE_A + ":1-5," + SOURCE_B + ":1", SOURCE_A + ":1-100")).isFalse();
    }

    @Test
    void sourceIsCaseInsensitiveAndWhitespaceIsIgnored() {
        String superset = SOURCE_A.toUpperCase() + ":1-10,\n " + SOURCE_B + ":1-3";

        assertThat(GtidSetUtils.isSubset(SOURCE_B + ":2, " + SOURCE_A + ":4", superset)).isTrue();
    }

    @Test
    void taggedTransactionsAreSeparateSource() {
        assertThat(GtidSetUtils.isSubset(SOURCE_A + ":orders:1-2", SOURCE_A + ":1-10")).isFalse();
        assertThat(GtidSetUtils.isSubset(SOURCE_A + ":orders:1-2", SOURCE_A + ":1-10:orders:1-5")).isTrue();
    }

    @Test
    void countsTransactions() {
        assertThat(GtidSetUtils.countTransactions(SOURCE_A + ":1-5:11-18," + SOURCE_B + ":7")).isEqualTo(14);
        assertThat(GtidSetUtils.countTransactions("")).isZero();
    }

    @Test
    void malformedIntervalIsRejected() {
        assertThatThrownBy(() -> GtidSetUtils.countTransactions(SOURCE_A + ":1-x"))
                .isInstanceOf(InvalidArgumentException.class)
                .hasMessageContaining("1-x");
    }

    @Test
    void emptySegmentsAreSkipped() {
        assertThat(GtidSetUtils.countTransactions(SOURCE_A + "::1-5:")).isEqualTo(5);
        assertThat(GtidSetUtils.isSubset(SOURCE_A + "::2", SOURCE_A + ":1-5")).isTrue();
    }

    @Test
    void reversedIntervalIsRejected() {
        assertThatThrownBy(() -> GtidSetUtils.isSubset(SOURCE_A + ":9-3", SOURCE_A + ":1-10"))
                .isInstanceOf(InvalidArgumentException.class)
                .hasMessageContaining("9-3");
    }

    @Test
    void blockWithoutSourceIsRejected() {
        assertThatThrownBy(() -> GtidSetUtils.countTransactions(":1-5"))
                .isInstanceOf(InvalidArgumentException.class);
    }
}
