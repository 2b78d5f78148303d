package com.cardrewards.ingest.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("NormalizationException Unit Tests")
class NormalizationExceptionTest {

    @Test
    @DisplayName("Should store status code")
    void shouldStoreStatusCode() {
        NormalizationException ex = new NormalizationException("error", 503);
        assertThat(ex.getStatusCode()).isEqualTo(503);
    }

    @Test
    @DisplayName("Should default status code to zero when no response was received")
    void shouldDefaultStatusCodeToZero() {
        NormalizationException ex = new NormalizationException("timed out", new TimeoutException());
        assertThat(ex.getStatusCode()).isZero();
        assertThat(ex.getCause()).isInstanceOf(TimeoutException.class);
    }

    @Test
    @DisplayName("Should include message and status in toString")
    void shouldIncludeFieldsInToString() {
        NormalizationException ex = new NormalizationException("bad gateway", 502);
        assertThat(ex.toString()).contains("bad gateway").contains("502");
    }
}
