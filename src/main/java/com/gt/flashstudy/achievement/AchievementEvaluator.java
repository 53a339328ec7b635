package com.gt.flashstudy.achievement;

import java.util.List;

public interface AchievementEvaluator {

    /**
     * Unlocks every achievement whose condition the learner now meets.
     *
     * @param sessionMetrics figures of the session that triggered the check, {@code null} to check lifetime conditions only
     * @return ids of the achievements unlocked by this call, in catalog order
     */
    List<String> evaluate(String learnerId, SessionMetrics sessionMetrics);
}
