package com.palmid.palm.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PalmLogMaskingTest {

    @Test
    void shouldKeepOnlyLastFourCharacters() {
        assertThat(PalmLogMasking.maskIdentity("+1-555-1111")).isEqualTo("****1111");
        assertThat(PalmLogMasking.maskIdentity("1111")).isEqualTo("****");
        assertThat(PalmLogMasking.maskIdentity(null)).isEqualTo("null");
    }
}
