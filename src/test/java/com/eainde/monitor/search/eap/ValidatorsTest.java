package com.eainde.monitor.search.eap;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class ValidatorsTest {

    @ParameterizedTest
    @ValueSource(strings = {"a1b2c3d4e5f60718", "A1B2C3D4E5F60718"})
    void isSpanId_shouldAcceptSixteenHexDigits(String value) {
        assertThat(Validators.isSpanId(value)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "a1b2c3d4e5f6071", "a1b2c3d4e5f607189", "g1b2c3d4e5f60718"})
    void isSpanId_shouldRejectOtherStrings(String value) {
        assertThat(Validators.isSpanId(value)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"4a1e7d0c9b8f4e2aa3c1d5e6f7a8b9c0", "4a1e7d0c-9b8f-4e2a-a3c1-d5e6f7a8b9c0"})
    void isEventId_shouldAcceptPlainAndUuidForms(String value) {
        assertThat(Validators.isEventId(value)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"4a1e7d0c9b8f4e2aa3c1d5e6f7a8b9c", "not-an-event-id"})
    void isEventId_shouldRejectOtherStrings(String value) {
        assertThat(Validators.isEventId(value)).isFalse();
    }

    @Test
    void validators_shouldRejectNonStrings() {
        assertThat(Validators.isSpanId(1234567890123456L)).isFalse();
        assertThat(Validators.isEventId(null)).isFalse();
    }
}
