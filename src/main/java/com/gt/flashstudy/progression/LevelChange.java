package com.gt.flashstudy.progression;

import com.gt.flashstudy.model.LearnerProgression;

public record LevelChange(int oldLevel, LearnerProgression progression) {

    public boolean leveledUp() {
        return progression.level() > oldLevel;
    }
}
