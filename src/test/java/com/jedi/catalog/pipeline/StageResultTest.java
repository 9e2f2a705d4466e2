package com.jedi.catalog.pipeline;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("StageResult Tests")
class StageResultTest {

    @Test
    @DisplayName("Computed result carries its value")
    void computed() {
        StageResult<String> result = StageResult.computed("fit");

        assertThat(result.isComputed()).isTrue();
        assertThat(result.getValue()).isEqualTo("fit");
        assertThat(result.toString()).isEqualTo("COMPUTED[fit]");
    }

    @Test
    @DisplayName("Skipped result carries a reason and no value")
    void skipped() {
        StageResult<String> result = StageResult.skipped("all irradiances are NaN");

        assertThat(result.isSkipped()).isTrue();
        assertThat(result.getReason()).isEqualTo("all irradiances are NaN");
        assertThatThrownBy(result::getValue).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    @DisplayName("Failed result carries the error")
    void failed() {
        IllegalStateException error = new IllegalStateException("diverged");
        StageResult<String> result = StageResult.failed(error);

        assertThat(result.isFailed()).isTrue();
        assertThat(result.getError()).isSameAs(error);
        assertThat(result.getReason()).isEqualTo("diverged");
        assertThat(result.isComputed()).isFalse();
        assertThat(result.isSkipped()).isFalse();
    }

    @Test
    @DisplayName("Null value or error is rejected")
    void nulls() {
        assertThatThrownBy(() -> StageResult.computed(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> StageResult.failed(null)).isInstanceOf(NullPointerException.class);
    }
}
