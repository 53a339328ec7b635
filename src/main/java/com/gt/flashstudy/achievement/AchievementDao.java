package com.gt.flashstudy.achievement;

import com.gt.flashstudy.model.Achievement;

import java.util.List;
import java.util.Set;

public interface AchievementDao {

    List<Achievement> loadAchievements();

    Set<String> loadUnlockedAchievementIds(String learnerId);

    // Returns false when the learner already had the achievement
    boolean unlockAchievement(String learnerId, Achievement achievement);

    int countCompletedSessions(String learnerId);

    int countOwnedDecks(String learnerId);

    int countFullyMasteredDecks(String learnerId);
}
