package com.linguabot.support;

import com.linguabot.config.TutorProperties;
import com.linguabot.model.Level;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Maps proficiency scores to {@link Level}s through fixed, non-overlapping thresholds.
 */
@Component
public class LevelScale {

    private final List<Long> thresholds;

    public LevelScale(TutorProperties properties) {
        var configured = properties.getRating().getLevelThresholds();
        validate(configured);
        this.thresholds = List.copyOf(configured);
    }

    public Level levelOf(long score) {
        Level[] levels = Level.values();
        for (int i = levels.length - 1; i > 0; i--) {
            if (score >= thresholds.get(i)) {
                return levels[i];
            }
        }
        return levels[0];
    }

    public long thresholdOf(Level level) {
        return thresholds.get(level.ordinal());
    }

    /**
     * The score at which the level after {@code level} starts, or empty at the top level.
     */
    public Optional<Long> nextThreshold(Level level) {
        int next = level.ordinal() + 1;
        return next < thresholds.size() ? Optional.of(thresholds.get(next)) : Optional.empty();
    }

    private static void validate(List<Long> thresholds) {
        if (thresholds == null || thresholds.size() != Level.values().length) {
            throw new IllegalStateException("app.tutor.rating.level-thresholds must list exactly "
                    + Level.values().length + " scores.");
        }
        if (thresholds.get(0) != 0L) {
            throw new IllegalStateException("The first level threshold must be 0.");
        }
        for (int i = 1; i < thresholds.size(); i++) {
            if (thresholds.get(i) <= thresholds.get(i - 1)) {
                throw new IllegalStateException("Level thresholds must be strictly increasing: " + thresholds);
            }
        }
    }
}
