package com.linguabot.service.impl;

import com.linguabot.config.TutorProperties;
import com.linguabot.corpus.VocabularyCorpus;
import com.linguabot.exception.InvalidStateException;
import com.linguabot.model.DifficultyTier;
import com.linguabot.model.ExamType;
import com.linguabot.model.Language;
import com.linguabot.model.Level;
import com.linguabot.model.PromptVariant;
import com.linguabot.model.ScoreReport;
import com.linguabot.model.TestInstance;
import com.linguabot.model.TestQuestion;
import com.linguabot.model.TestStatus;
import com.linguabot.model.VocabularyEntry;
import com.linguabot.service.api.AssessmentEngine;
import com.linguabot.service.api.CorpusService;
import com.linguabot.service.api.RatingEngine;
import com.linguabot.service.api.TutorStorage;
import com.linguabot.support.TextNormalizer;
import com.linguabot.support.UserLockRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.UUID;

/**
 * Default {@link AssessmentEngine}.
 * <p>
 * Questions are frozen into the instance at generation time. All state changes of an instance run
 * under its owner's user lock, and the instance is saved after every change.
 * </p>
 */
@Service
public class AssessmentEngineImpl implements AssessmentEngine {

    private static final Logger log = LoggerFactory.getLogger(AssessmentEngineImpl.class);

    private static final List<Integer> BEGINNER_ONLY = List.of(100, 0, 0);

    private final CorpusService corpusService;
    private final TutorStorage storage;
    private final RatingEngine ratingEngine;
    private final UserLockRegistry locks;
    private final TutorProperties.Assessment settings;
    private final Clock clock;
    private final Random random;

    @Autowired
    public AssessmentEngineImpl(CorpusService corpusService, TutorStorage storage, RatingEngine ratingEngine,
                                UserLockRegistry locks, TutorProperties properties, Clock clock) {
        this(corpusService, storage, ratingEngine, locks, properties, clock, new SecureRandom());
    }

    AssessmentEngineImpl(CorpusService corpusService, TutorStorage storage, RatingEngine ratingEngine,
                         UserLockRegistry locks, TutorProperties properties, Clock clock, Random random) {
        this.corpusService = corpusService;
        this.storage = storage;
        this.ratingEngine = ratingEngine;
        this.locks = locks;
        this.settings = properties.getAssessment();
        this.clock = clock;
        this.random = random;
    }

    @Override
    public TestInstance generate(String userId, ExamType examType, int questionCount) {
        if (questionCount < 1) {
            throw new IllegalArgumentException("A test needs at least one question, got " + questionCount);
        }
        return locks.callAs(userId, () -> {
            var level = ratingEngine.getRecord(userId).getLevel();
            var counts = tierCounts(level, questionCount);
            var corpus = corpusService.current().vocabulary();
            var language = examType.language();

            List<VocabularyEntry> picked = new ArrayList<>();
            Set<String> used = new HashSet<>();
            for (var tierCount : counts.entrySet()) {
                var sample = corpus.sampleByDifficulty(language, tierCount.getKey(), tierCount.getValue(), used, random);
                for (VocabularyEntry entry : sample) {
                    used.add(entry.id());
                    picked.add(entry);
                }
            }

            List<TestQuestion> questions = new ArrayList<>(picked.size());
            for (int i = 0; i < picked.size(); i++) {
                var variant = i % 2 == 0 ? PromptVariant.MEANING : PromptVariant.REVERSE;
                questions.add(question(picked.get(i), variant, corpus, language));
            }

            var instance = new TestInstance(UUID.randomUUID().toString(), userId, examType, questions);
            instance.begin(clock.instant(), settings.rulesFor(examType).getTimeLimit());
            storage.saveTestInstance(instance);
            log.info("Generated {} test {} for {} ({}): tiers {}", examType, instance.getTestId(), userId, level, counts);
            return instance;
        });
    }

    @Override
    public TestInstance submitAnswer(String testId, int questionIndex, int choiceIndex) {
        var instance = load(testId);
        return locks.callAs(instance.getUserId(), () -> {
            var current = load(testId);
            requireInProgress(current);
            if (questionIndex < 0 || questionIndex >= current.getQuestions().size()) {
                throw new IllegalArgumentException("Question " + (questionIndex + 1) + " does not exist; the test has "
                        + current.getQuestions().size() + " questions.");
            }
            var question = current.getQuestions().get(questionIndex);
            if (choiceIndex < 0 || choiceIndex >= question.choices().size()) {
                throw new IllegalArgumentException("Choice " + (choiceIndex + 1) + " does not exist; question "
                        + (questionIndex + 1) + " has " + question.choices().size() + " choices.");
            }
            current.recordAnswer(questionIndex, choiceIndex);
            storage.saveTestInstance(current);
            log.debug("Test {}: answer {} recorded for question {}", testId, choiceIndex, questionIndex);
            return current;
        });
    }

    @Override
    public ScoreReport finalize(String testId) {
        var instance = load(testId);
        return locks.callAs(instance.getUserId(), () -> {
            var current = load(testId);
            if (current.getStatus() == TestStatus.COMPLETED) {
                return current.getReport();
            }
            requireInProgress(current);

            Map<DifficultyTier, Integer> correctByTier = new EnumMap<>(DifficultyTier.class);
            for (DifficultyTier tier : DifficultyTier.values()) {
                correctByTier.put(tier, 0);
            }
            int correct = 0;
            for (int i = 0; i < current.getQuestions().size(); i++) {
                var question = current.getQuestions().get(i);
                var answer = current.getAnswers().get(i);
                if (answer != null && answer == question.correctAnswerIndex()) {
                    correct++;
                    correctByTier.merge(question.tier(), 1, Integer::sum);
                }
            }
            int total = current.getQuestions().size();
            boolean passed = (double) correct / total >= settings.rulesFor(current.getExamType()).getPassThreshold();

            var report = new ScoreReport(testId, current.getExamType(), correct, total, passed, 0, 0L,
                    correctByTier, clock.instant());
            var change = ratingEngine.recordTestResult(current.getUserId(), report);
            report = report.withRating(change.delta(), change.levelDelta());

            current.complete(report);
            storage.saveTestInstance(current);
            return report;
        });
    }

    @Override
    public Optional<TestInstance> findTest(String testId) {
        var found = storage.loadTestInstance(testId);
        if (found.isEmpty()) {
            return found;
        }
        return locks.callAs(found.get().getUserId(), () -> {
            var current = storage.loadTestInstance(testId);
            current.ifPresent(instance -> {
                if (instance.expireIfDue(clock.instant())) {
                    storage.saveTestInstance(instance);
                    log.info("Test {} of {} expired at {}", instance.getTestId(), instance.getUserId(),
                            instance.getExpiresAt());
                }
            });
            return current;
        });
    }

    /**
     * Splits {@code total} over the tiers by the level's percentages, using largest-remainder
     * rounding so the counts always add up. Ties in the remainder go to the harder tier.
     */
    Map<DifficultyTier, Integer> tierCounts(Level level, int total) {
        var percentages = settings.getTierMix().getOrDefault(level, BEGINNER_ONLY);
        var tiers = DifficultyTier.values();
        if (percentages.size() != tiers.length) {
            throw new IllegalStateException("Tier mix for " + level + " must list " + tiers.length + " percentages.");
        }
        int weightSum = percentages.stream().mapToInt(Integer::intValue).sum();
        if (weightSum <= 0) {
            throw new IllegalStateException("Tier mix for " + level + " has no positive weight.");
        }

        int[] counts = new int[tiers.length];
        long[] remainders = new long[tiers.length];
        int assigned = 0;
        for (int i = 0; i < tiers.length; i++) {
            long share = (long) percentages.get(i) * total;
            counts[i] = (int) (share / weightSum);
            remainders[i] = share % weightSum;
            assigned += counts[i];
        }
        while (assigned < total) {
            int best = -1;
            for (int i = tiers.length - 1; i >= 0; i--) {
                if (percentages.get(i) > 0 && (best < 0 || remainders[i] > remainders[best])) {
                    best = i;
                }
            }
            counts[best]++;
            remainders[best] = -1;
            assigned++;
        }

        Map<DifficultyTier, Integer> result = new LinkedHashMap<>();
        for (int i = 0; i < tiers.length; i++) {
            if (counts[i] > 0) {
                result.put(tiers[i], counts[i]);
            }
        }
        return result;
    }

    private TestQuestion question(VocabularyEntry entry, PromptVariant variant, VocabularyCorpus corpus,
                                  Language language) {
        String prompt;
        String answer;
        if (variant == PromptVariant.MEANING) {
            prompt = "What does \"%s\" mean?".formatted(entry.surfaceForm());
            answer = entry.translation();
        } else {
            prompt = "How do you say \"%s\" in %s?".formatted(entry.translation(), displayName(language));
            answer = entry.surfaceForm();
        }

        List<String> choices = new ArrayList<>();
        choices.add(answer);
        Set<String> seen = new HashSet<>();
        seen.add(TextNormalizer.normalizeKey(answer));
        for (VocabularyEntry other : distractorPool(entry, corpus, language)) {
            if (choices.size() >= settings.getChoicesPerQuestion()) {
                break;
            }
            var option = variant == PromptVariant.MEANING ? other.translation() : other.surfaceForm();
            if (seen.add(TextNormalizer.normalizeKey(option))) {
                choices.add(option);
            }
        }
        Collections.shuffle(choices, random);
        return new TestQuestion(entry.id(), variant, prompt, choices, choices.indexOf(answer), entry.difficultyTier());
    }

    /**
     * Same-tier entries first, then the rest of the language, each group shuffled.
     */
    private List<VocabularyEntry> distractorPool(VocabularyEntry entry, VocabularyCorpus corpus, Language language) {
        List<VocabularyEntry> sameTier = new ArrayList<>();
        List<VocabularyEntry> otherTiers = new ArrayList<>();
        for (VocabularyEntry candidate : corpus.entries(language)) {
            if (candidate.id().equals(entry.id())) {
                continue;
            }
            (candidate.difficultyTier() == entry.difficultyTier() ? sameTier : otherTiers).add(candidate);
        }
        Collections.shuffle(sameTier, random);
        Collections.shuffle(otherTiers, random);
        sameTier.addAll(otherTiers);
        return sameTier;
    }

    private void requireInProgress(TestInstance instance) {
        if (instance.expireIfDue(clock.instant())) {
            storage.saveTestInstance(instance);
            log.info("Test {} of {} expired at {}", instance.getTestId(), instance.getUserId(), instance.getExpiresAt());
        }
        switch (instance.getStatus()) {
            case IN_PROGRESS -> {
                // accepted
            }
            case EXPIRED -> throw new InvalidStateException("Test " + instance.getTestId() + " has expired.");
            case COMPLETED -> throw new InvalidStateException("Test " + instance.getTestId() + " is already finished.");
            case CREATED -> throw new InvalidStateException("Test " + instance.getTestId() + " has not been started.");
        }
    }

    private TestInstance load(String testId) {
        return storage.loadTestInstance(testId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown test '" + testId + "'."));
    }

    private static String displayName(Language language) {
        return language == Language.KOREAN ? "Korean" : "Japanese";
    }
}
