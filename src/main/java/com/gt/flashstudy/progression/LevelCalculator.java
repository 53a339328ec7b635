package com.gt.flashstudy.progression;

import com.gt.flashstudy.model.LearnerProgression;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Moves XP in and out of a learner's level state.
 * <p>
 * Earned XP fills the current level; every time it reaches the threshold the threshold is subtracted, the level goes
 * up and the next threshold grows by the configured factor, rounded down. Spent XP only drains the current level and
 * never takes a level away.
 */
@Component
public class LevelCalculator {

    // Guards the rounding of thresholds such as 120 * 1.2 that are not exact in binary
    private static final double THRESHOLD_EPSILON = 1e-9;

    private final int baseLevelXp;
    private final double levelGrowthFactor;

    @Autowired
    public LevelCalculator(@Value("${flashstudy.progression.baseLevelXp:100}") int baseLevelXp,
                           @Value("${flashstudy.progression.levelGrowthFactor:1.2}") double levelGrowthFactor) {
        this.baseLevelXp = Math.max(1, baseLevelXp);
        this.levelGrowthFactor = levelGrowthFactor;
    }

    public int getBaseLevelXp() {
        return baseLevelXp;
    }

    public LearnerProgression creditXp(LearnerProgression progression, int xp) {
        if (xp <= 0) {
            return progression;
        }

        int level = Math.max(1, progression.level());
        int nextLevelXp = progression.nextLevelXp() > 0 ? progression.nextLevelXp() : baseLevelXp;
        long currentXp = (long) progression.currentXp() + xp;

        while (currentXp >= nextLevelXp) {
            currentXp -= nextLevelXp;
            level++;
            nextLevelXp = nextThreshold(nextLevelXp);
        }

        return progression.withLevelState(level, (int) currentXp, nextLevelXp, progression.totalXp() + xp);
    }

    // Total XP gives up the whole amount, the current level only what it holds. Current XP can end up ahead of total XP.
    public LearnerProgression spendXp(LearnerProgression progression, int xp) {
        if (xp <= 0) {
            return progression;
        }

        return progression.withLevelState(
                progression.level(),
                Math.max(0, progression.currentXp() - xp),
                progression.nextLevelXp(),
                Math.max(0, progression.totalXp() - xp));
    }

    private int nextThreshold(int threshold) {
        return Math.max(threshold, (int) Math.floor(threshold * levelGrowthFactor + THRESHOLD_EPSILON));
    }
}
