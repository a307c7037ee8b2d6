package com.hired.core.renderer.backend;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackendOutcomeTest {

    @Test
    void successRequiresBytes() {
        assertThatThrownBy(() -> BackendOutcome.success("x", null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void failureRequiresCause() {
        assertThatThrownBy(() -> BackendOutcome.failure("x", null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
