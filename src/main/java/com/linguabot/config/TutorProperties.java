package com.linguabot.config;

import com.linguabot.model.DifficultyTier;
import com.linguabot.model.ExamType;
import com.linguabot.model.Level;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Tunable constants of the matching, assessment and rating engines, bound from {@code app.tutor.*}.
 * <p>
 * Every field carries a default, so a plain {@code new TutorProperties()} is a complete,
 * working configuration.
 * </p>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "app.tutor")
public class TutorProperties {

    private Matching matching = new Matching();
    private Assessment assessment = new Assessment();
    private Rating rating = new Rating();

    @Getter
    @Setter
    public static class Matching {
        private double overlapWeight = 0.6;
        private double tierWeight = 0.25;
        private double continuityWeight = 0.15;
        private double minScore = 0.4;
        private double minCoverage = 0.3;
        private int recentIntentCapacity = 5;
        private int maxNgram = 4;
    }

    @Getter
    @Setter
    public static class Assessment {
        private int defaultQuestionCount = 10;
        private int choicesPerQuestion = 4;
        private Map<ExamType, ExamRules> exams = defaultExams();

        /**
         * Percentages of BEGINNER, INTERMEDIATE and ADVANCED questions per learner level.
         */
        private Map<Level, List<Integer>> tierMix = defaultTierMix();

        public ExamRules rulesFor(ExamType examType) {
            return exams.getOrDefault(examType, new ExamRules());
        }

        private static Map<ExamType, ExamRules> defaultExams() {
            Map<ExamType, ExamRules> exams = new EnumMap<>(ExamType.class);
            for (ExamType type : ExamType.values()) {
                exams.put(type, new ExamRules());
            }
            return exams;
        }

        private static Map<Level, List<Integer>> defaultTierMix() {
            Map<Level, List<Integer>> mix = new EnumMap<>(Level.class);
            mix.put(Level.NOVICE, new ArrayList<>(List.of(70, 30, 0)));
            mix.put(Level.ELEMENTARY, new ArrayList<>(List.of(50, 40, 10)));
            mix.put(Level.INTERMEDIATE, new ArrayList<>(List.of(30, 50, 20)));
            mix.put(Level.UPPER_INTERMEDIATE, new ArrayList<>(List.of(20, 40, 40)));
            mix.put(Level.ADVANCED, new ArrayList<>(List.of(10, 30, 60)));
            mix.put(Level.MASTER, new ArrayList<>(List.of(0, 20, 80)));
            return mix;
        }
    }

    @Getter
    @Setter
    public static class ExamRules {
        private double passThreshold = 0.6;
        private Duration timeLimit = Duration.ofMinutes(30);
    }

    @Getter
    @Setter
    public static class Rating {
        private Map<DifficultyTier, Integer> pointsPerCorrect = defaultPoints();
        private int passBonus = 10;
        private int conversationTurnPoints = 1;
        private int dailyConversationCap = 20;

        /**
         * Minimum score of each {@link Level}, in level order, starting at 0.
         */
        private List<Long> levelThresholds = new ArrayList<>(List.of(0L, 100L, 300L, 600L, 1000L, 1500L));

        private static Map<DifficultyTier, Integer> defaultPoints() {
            Map<DifficultyTier, Integer> points = new EnumMap<>(DifficultyTier.class);
            points.put(DifficultyTier.BEGINNER, 2);
            points.put(DifficultyTier.INTERMEDIATE, 3);
            points.put(DifficultyTier.ADVANCED, 5);
            return points;
        }
    }
}
