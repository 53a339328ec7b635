package com.gt.flashstudy.progression;

import com.gt.flashstudy.model.DailyProgress;

import java.time.LocalDate;
import java.util.List;

public interface DailyProgressDao {

    // Adds the given counters to the learner's row for that day, creating it when missing
    void addDailyProgress(DailyProgress dailyProgress);

    List<LocalDate> loadActiveDates(String learnerId);
}
