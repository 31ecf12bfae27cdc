package com.palmid.palm.domain;

import com.palmid.palm.PalmFixtures;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HandLandmarksTest {

    @Test
    void shouldExposeKnucklesByFixedIndex() {
        HandLandmarks hand = PalmFixtures.referenceHand();

        assertThat(hand.get(KnucklePoint.WRIST).getIndex()).isZero();
        assertThat(hand.get(KnucklePoint.MIDDLE_KNUCKLE).getY()).isEqualTo(190.0);
        assertThat(hand.get(KnucklePoint.PINKY_KNUCKLE).getIndex()).isEqualTo(17);
        assertThat(hand.asList()).hasSize(HandLandmarks.LANDMARK_COUNT);
    }

    @Test
    void shouldRequireExactlyTwentyOneOrderedLandmarks() {
        List<Landmark> tooFew = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            tooFew.add(new Landmark(i, 1, 1, 0.9));
        }
        assertThatThrownBy(() -> HandLandmarks.of(tooFew)).isInstanceOf(IllegalArgumentException.class);

        List<Landmark> shuffled = new ArrayList<>(PalmFixtures.referenceHand().asList());
        shuffled.set(3, shuffled.get(4));
        assertThatThrownBy(() -> HandLandmarks.of(shuffled)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectConfidenceOutsideUnitInterval() {
        assertThatThrownBy(() -> new Landmark(0, 1, 1, 1.2)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Landmark(0, 1, 1, -0.1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Landmark(21, 1, 1, 0.5)).isInstanceOf(IllegalArgumentException.class);
    }
}
