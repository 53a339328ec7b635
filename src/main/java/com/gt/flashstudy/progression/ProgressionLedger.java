package com.gt.flashstudy.progression;

import com.gt.flashstudy.exception.NotFoundException;
import com.gt.flashstudy.model.DailyProgress;
import com.gt.flashstudy.model.LearnerProgression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * The only writer of a learner's XP, level, lifetime totals, daily progress and streak.
 * <p>
 * Callers pass deltas, never absolute values. Every method expects to run inside the caller's transaction; the learner
 * row is locked before its level state is read so that concurrent sessions of the same learner cannot lose XP.
 */
@Component
public class ProgressionLedger {

    private static final Logger log = LoggerFactory.getLogger(ProgressionLedger.class);

    private final ProgressionDao progressionDao;
    private final DailyProgressDao dailyProgressDao;
    private final LevelCalculator levelCalculator;
    private final StreakCalculator streakCalculator;

    @Autowired
    public ProgressionLedger(ProgressionDao progressionDao,
                             DailyProgressDao dailyProgressDao,
                             LevelCalculator levelCalculator,
                             StreakCalculator streakCalculator) {
        this.progressionDao = progressionDao;
        this.dailyProgressDao = dailyProgressDao;
        this.levelCalculator = levelCalculator;
        this.streakCalculator = streakCalculator;
    }

    public LearnerProgression loadProgression(String learnerId) {
        LearnerProgression progression = progressionDao.loadProgression(learnerId);
        if (progression == null) {
            throw new NotFoundException("Learner " + learnerId + " not found");
        }
        return progression;
    }

    public LevelChange applyActivity(String learnerId, LocalDate day, ActivityDelta delta) {
        LearnerProgression progression = lockProgression(learnerId);
        LearnerProgression updated = delta.xp() >= 0
                ? levelCalculator.creditXp(progression, delta.xp())
                : levelCalculator.spendXp(progression, -delta.xp());

        if (!updated.equals(progression)) {
            progressionDao.saveLevelState(updated);
        }

        if (delta.answers() != 0 || delta.correctAnswers() != 0 || delta.timeSpentSeconds() != 0) {
            progressionDao.addLifetimeTotals(learnerId,
                    new LifetimeTotalsDelta(0, 0, 0, delta.timeSpentSeconds(), delta.answers(), delta.correctAnswers()));
        } else {
            progressionDao.touchLastActivity(learnerId);
        }

        addDailyProgress(new DailyProgress(learnerId, day, delta.correctAnswers(), 0, delta.timeSpentSeconds(), Math.max(0, delta.xp()), 0));

        return logLevelChange(progression, updated);
    }

    public LevelChange awardXp(String learnerId, LocalDate day, int xp) {
        LearnerProgression progression = lockProgression(learnerId);
        LearnerProgression updated = levelCalculator.creditXp(progression, xp);

        if (!updated.equals(progression)) {
            progressionDao.saveLevelState(updated);
            addDailyProgress(new DailyProgress(learnerId, day, 0, 0, 0, xp, 0));
        }

        return logLevelChange(progression, updated);
    }

    public void recordCompletion(String learnerId, LocalDate day, CompletionDelta delta) {
        progressionDao.addLifetimeTotals(learnerId, new LifetimeTotalsDelta(
                delta.cardsLearned(),
                delta.masteredChange(),
                1,
                delta.timeSpentSeconds(),
                delta.answers(),
                delta.correctAnswers()));

        addDailyProgress(new DailyProgress(learnerId, day, delta.correctAnswers(), delta.cardsLearned(), delta.timeSpentSeconds(), 0, 1));
    }

    public StreakResult refreshStreak(String learnerId, LocalDate today) {
        LearnerProgression progression = lockProgression(learnerId);

        StreakResult streakResult = streakCalculator.calculate(
                dailyProgressDao.loadActiveDates(learnerId),
                today,
                progression.streakShieldActive(),
                progression.streakShieldUsedDate(),
                progression.longestStreak());

        if (streakResult.shieldConsumed()) {
            log.info("Streak shield of learner {} used to bridge {}", learnerId, streakResult.shieldedDate());
        }

        progressionDao.saveStreak(progression.withStreak(
                streakResult.currentStreak(),
                streakResult.longestStreak(),
                progression.streakShieldActive() && !streakResult.shieldConsumed(),
                streakResult.shieldedDate()));

        return streakResult;
    }

    private void addDailyProgress(DailyProgress dailyProgress) {
        if (!dailyProgress.isEmpty()) {
            dailyProgressDao.addDailyProgress(dailyProgress);
        }
    }

    private LearnerProgression lockProgression(String learnerId) {
        LearnerProgression progression = progressionDao.loadProgressionForUpdate(learnerId);
        if (progression == null) {
            throw new NotFoundException("Learner " + learnerId + " not found");
        }
        return progression;
    }

    private static LevelChange logLevelChange(LearnerProgression before, LearnerProgression after) {
        LevelChange levelChange = new LevelChange(before.level(), after);
        if (levelChange.leveledUp()) {
            log.info("Learner {} reached level {} from level {}", after.learnerId(), after.level(), before.level());
        }
        return levelChange;
    }
}
