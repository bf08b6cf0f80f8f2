package com.example.resilience.circuitbreaker;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RollingWindowTest {

    private final RollingWindow window = new RollingWindow(10_000, 10);

    @Test
    void countsOutcomesInsideTheWindow() {
        window.recordFailure(500);
        window.recordSuccess(1_500);
        window.recordSuccess(1_700);

        RollingWindow.Counts counts = window.counts(1_999);

        assertThat(window.getBucketDuration()).isEqualTo(1_000);
        assertThat(counts.successes()).isEqualTo(2);
        assertThat(counts.failures()).isEqualTo(1);
        assertThat(counts.total()).isEqualTo(3);
        assertThat(counts.errorPercentage()).isCloseTo(33.33, org.assertj.core.data.Offset.offset(0.01));
    }

    @Test
    void oldBucketsExpire() {
        window.recordFailure(500);
        window.recordSuccess(1_500);

        RollingWindow.Counts counts = window.counts(10_600);

        assertThat(counts.failures()).isZero();
        assertThat(counts.successes()).isEqualTo(1);
    }

    @Test
    void reusedSlotStartsFromZero() {
        window.recordFailure(0);
        window.recordFailure(100);
        window.recordSuccess(10_000);

        RollingWindow.Counts counts = window.counts(10_000);

        assertThat(counts.failures()).isZero();
        assertThat(counts.successes()).isEqualTo(1);
    }

    @Test
    void clearDropsEverything() {
        window.recordFailure(100);
        window.recordSuccess(200);

        window.clear();

        assertThat(window.counts(300).total()).isZero();
        assertThat(window.counts(300).errorPercentage()).isZero();
    }
}
