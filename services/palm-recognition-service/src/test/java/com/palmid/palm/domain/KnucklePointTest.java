package com.palmid.palm.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KnucklePointTest {

    @Test
    void shouldListKnucklesInLandmarkOrder() {
        assertThat(KnucklePoint.all()).extracting(KnucklePoint::getLandmarkIndex).containsExactly(0, 5, 9, 13, 17);
        assertThat(KnucklePoint.MIDDLE_KNUCKLE.getKey()).isEqualTo("middle_knuckle");
    }

    @Test
    void shouldNotAllowCallersToReplaceKnuckles() {
        assertThatThrownBy(() -> KnucklePoint.all().set(0, KnucklePoint.PINKY_KNUCKLE))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThat(KnucklePoint.all().get(0)).isEqualTo(KnucklePoint.WRIST);
    }
}
