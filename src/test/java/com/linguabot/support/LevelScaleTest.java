package com.linguabot.support;

import com.linguabot.config.TutorProperties;
import com.linguabot.model.Level;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LevelScaleTest {

    private final LevelScale scale = new LevelScale(new TutorProperties());

    @Test
    @DisplayName("levelOf should map scores onto the default thresholds")
    void testLevelOf() {
        assertThat(scale.levelOf(0)).isEqualTo(Level.NOVICE);
        assertThat(scale.levelOf(99)).isEqualTo(Level.NOVICE);
        assertThat(scale.levelOf(100)).isEqualTo(Level.ELEMENTARY);
        assertThat(scale.levelOf(650)).isEqualTo(Level.UPPER_INTERMEDIATE);
        assertThat(scale.levelOf(1500)).isEqualTo(Level.MASTER);
        assertThat(scale.levelOf(100_000)).isEqualTo(Level.MASTER);
    }

    @Test
    @DisplayName("levelOf should never go down when the score goes up")
    void testMonotonic() {
        var previous = Level.NOVICE;
        for (long score = 0; score <= 2000; score += 7) {
            var level = scale.levelOf(score);
            assertThat(level.ordinal()).isGreaterThanOrEqualTo(previous.ordinal());
            previous = level;
        }
    }

    @Test
    @DisplayName("nextThreshold should be empty at the top level")
    void testNextThreshold() {
        assertThat(scale.nextThreshold(Level.NOVICE)).contains(100L);
        assertThat(scale.nextThreshold(Level.MASTER)).isEmpty();
        assertThat(scale.thresholdOf(Level.ADVANCED)).isEqualTo(1000L);
    }

    @Test
    @DisplayName("The constructor should reject thresholds that are not strictly increasing from 0")
    void testInvalidThresholds() {
        assertThatThrownBy(() -> new LevelScale(withThresholds(List.of(0L, 100L))))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new LevelScale(withThresholds(List.of(10L, 100L, 300L, 600L, 1000L, 1500L))))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new LevelScale(withThresholds(List.of(0L, 100L, 100L, 600L, 1000L, 1500L))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("strictly increasing");
    }

    private static TutorProperties withThresholds(List<Long> thresholds) {
        var properties = new TutorProperties();
        properties.getRating().setLevelThresholds(new ArrayList<>(thresholds));
        return properties;
    }
}
