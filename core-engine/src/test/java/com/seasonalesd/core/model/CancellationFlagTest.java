package com.seasonalesd.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CancellationFlag}.
 */
class CancellationFlagTest {

    @Test
    @DisplayName("Should stay set once canceled")
    void shouldLatch() {
        CancellationFlag flag = new CancellationFlag();
        assertThat(flag.isCancellationRequested()).isFalse();

        flag.cancel();
        flag.cancel();

        assertThat(flag.isCancellationRequested()).isTrue();
    }

    @Test
    @DisplayName("Should never request cancellation through NONE")
    void shouldNeverCancelNone() {
        assertThat(CancellationToken.NONE.isCancellationRequested()).isFalse();
    }
}
