package com.phillippitts.affectsignal.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void convertsNanosToMillis() {
        assertThat(TimeUtils.nanosToMillis(0)).isZero();
        assertThat(TimeUtils.nanosToMillis(999_999)).isZero();
        assertThat(TimeUtils.nanosToMillis(1_500_000)).isEqualTo(1);
    }

    @Test
    void elapsedIsNonNegative() {
        long start = System.nanoTime();

        assertThat(TimeUtils.elapsedMillis(start)).isGreaterThanOrEqualTo(0);
        assertThat(TimeUtils.elapsedMillis(start - 5 * TimeUtils.NANOS_PER_MILLI)).isGreaterThanOrEqualTo(5);
    }
}
