package com.gt.flashstudy.progression;

import com.gt.flashstudy.model.LearnerProgression;

public interface ProgressionDao {

    LearnerProgression loadProgression(String learnerId);

    // Locks the learner row until the surrounding transaction ends
    LearnerProgression loadProgressionForUpdate(String learnerId);

    void saveLevelState(LearnerProgression progression);

    void addLifetimeTotals(String learnerId, LifetimeTotalsDelta delta);

    void saveStreak(LearnerProgression progression);

    void touchLastActivity(String learnerId);
}
