package com.gt.flashstudy.achievement;

import com.gt.flashstudy.model.Achievement;
import com.gt.flashstudy.model.LearnerProgression;
import com.gt.flashstudy.progression.ProgressionLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

@Component
public class AchievementService implements AchievementEvaluator {

    private static final Logger log = LoggerFactory.getLogger(AchievementService.class);

    private static final int MIN_CORRECT_FOR_SPEED = 10;
    private static final int NIGHT_WINDOW_START_HOUR = 20;
    private static final int NIGHT_WINDOW_HOURS = 5;
    private static final int DAY_WINDOW_HOURS = 4;

    private final AchievementDao achievementDao;
    private final AchievementCatalog achievementCatalog;
    private final ProgressionLedger progressionLedger;
    private final Clock clock;

    @Autowired
    public AchievementService(AchievementDao achievementDao,
                              AchievementCatalog achievementCatalog,
                              ProgressionLedger progressionLedger,
                              Clock clock) {
        this.achievementDao = achievementDao;
        this.achievementCatalog = achievementCatalog;
        this.progressionLedger = progressionLedger;
        this.clock = clock;
    }

    @Override
    public List<String> evaluate(String learnerId, SessionMetrics sessionMetrics) {
        Set<String> unlockedIds = achievementDao.loadUnlockedAchievementIds(learnerId);
        LearnerProgression progression = progressionLedger.loadProgression(learnerId);
        LearnerCounts learnerCounts = new LearnerCounts(learnerId);
        LocalDate today = LocalDate.now(clock);

        List<String> newlyUnlocked = new ArrayList<>();
        for (Achievement achievement : achievementCatalog.getAllAchievements()) {
            if (unlockedIds.contains(achievement.id())) {
                continue;
            }

            AchievementCondition condition = AchievementCondition.fromCode(achievement.conditionType());
            if (condition == null) {
                log.warn("Unknown achievement condition type {} on achievement {}", achievement.conditionType(), achievement.id());
                continue;
            }
            if (condition.isSessionScoped() && sessionMetrics == null) {
                continue;
            }

            if (isConditionMet(condition, achievement.conditionValue(), progression, learnerCounts, sessionMetrics)
                    && achievementDao.unlockAchievement(learnerId, achievement)) {
                log.info("Learner {} unlocked achievement {}", learnerId, achievement.id());
                newlyUnlocked.add(achievement.id());

                if (achievement.xpReward() > 0) {
                    progression = progressionLedger.awardXp(learnerId, today, achievement.xpReward()).progression();
                }
            }
        }

        return newlyUnlocked;
    }

    private static boolean isConditionMet(AchievementCondition condition,
                                          int value,
                                          LearnerProgression progression,
                                          LearnerCounts learnerCounts,
                                          SessionMetrics sessionMetrics) {
        switch (condition) {
            case DecksCompleted:
                return progression.totalDecksCompleted() >= value;
            case DecksCreated:
                return learnerCounts.ownedDecks() >= value;
            case StreakDays:
                return progression.currentStreak() >= value;
            case CardsMastered:
                return progression.totalCardsMastered() >= value;
            case CardsLearned:
                return progression.totalCardsLearned() >= value;
            case LevelReached:
                return progression.level() >= value;
            case TotalXp:
                return progression.totalXp() >= value;
            case TotalSessionsCompleted:
                return learnerCounts.completedSessions() >= value;
            case CardsMasteredSingleDeck:
                return learnerCounts.fullyMasteredDecks() >= value;
            case CardsPerMinute:
                return isFastEnough(sessionMetrics, value);
            case SessionTimeOfDay:
                return isWithinTimeWindow(sessionMetrics.completedAtHour(), value);
            case PerfectScoreMinCards:
                return sessionMetrics.score() == 100 && sessionMetrics.totalCards() >= value;
            case SingleSessionXp:
                return sessionMetrics.sessionXp() >= value;
            default:
                return false;
        }
    }

    // A handful of quick answers should not count, the rate only matters over a meaningful number of cards
    private static boolean isFastEnough(SessionMetrics sessionMetrics, int cardsPerMinute) {
        if (sessionMetrics.durationSeconds() <= 0 || sessionMetrics.correctCount() < Math.max(MIN_CORRECT_FOR_SPEED, cardsPerMinute)) {
            return false;
        }

        double minutes = sessionMetrics.durationSeconds() / 60.0;
        return sessionMetrics.correctCount() / minutes >= cardsPerMinute;
    }

    // The condition value is the window start as HHMM; late windows wrap past midnight
    private static boolean isWithinTimeWindow(int hour, int windowStart) {
        int startHour = windowStart / 100;
        if (startHour >= NIGHT_WINDOW_START_HOUR) {
            return hour >= startHour || hour < (startHour + NIGHT_WINDOW_HOURS) % 24;
        }
        return hour >= startHour && hour < startHour + DAY_WINDOW_HOURS;
    }

    // Counts that need their own query, loaded at most once per evaluation
    private class LearnerCounts {

        private final String learnerId;
        private Integer ownedDecks;
        private Integer completedSessions;
        private Integer fullyMasteredDecks;

        private LearnerCounts(String learnerId) {
            this.learnerId = learnerId;
        }

        private int ownedDecks() {
            if (ownedDecks == null) {
                ownedDecks = achievementDao.countOwnedDecks(learnerId);
            }
            return ownedDecks;
        }

        private int completedSessions() {
            if (completedSessions == null) {
                completedSessions = achievementDao.countCompletedSessions(learnerId);
            }
            return completedSessions;
        }

        private int fullyMasteredDecks() {
            if (fullyMasteredDecks == null) {
                fullyMasteredDecks = achievementDao.countFullyMasteredDecks(learnerId);
            }
            return fullyMasteredDecks;
        }
    }
}
