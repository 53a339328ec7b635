package com.gt.flashstudy.progression;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Derives streaks from the set of days with recorded activity.
 * <p>
 * The current streak counts consecutive active days walking back from today. Today not being active yet does not
 * break the streak, counting then starts from yesterday. An active shield bridges one missed day, provided the day
 * before the gap is active. Once used, the bridged day is remembered and keeps counting as active in every later
 * calculation.
 */
@Component
public class StreakCalculator {

    public StreakResult calculate(Collection<LocalDate> activeDates,
                                  LocalDate today,
                                  boolean shieldActive,
                                  LocalDate shieldedDate,
                                  int storedLongestStreak) {
        Set<LocalDate> coveredDates = new HashSet<>(activeDates);
        if (shieldedDate != null) {
            coveredDates.add(shieldedDate);
        }

        LocalDate cursor = coveredDates.contains(today) ? today : today.minusDays(1);
        boolean shieldAvailable = shieldActive;
        boolean shieldConsumed = false;
        LocalDate bridgedDate = shieldedDate;
        int currentStreak = 0;

        while (true) {
            if (coveredDates.contains(cursor)) {
                currentStreak++;
            } else if (shieldAvailable && currentStreak > 0 && coveredDates.contains(cursor.minusDays(1))) {
                shieldAvailable = false;
                shieldConsumed = true;
                bridgedDate = cursor;
                coveredDates.add(cursor);
                currentStreak++;
            } else {
                break;
            }
            cursor = cursor.minusDays(1);
        }

        int longestStreak = Math.max(storedLongestStreak, Math.max(currentStreak, longestRun(coveredDates)));

        return new StreakResult(currentStreak, longestStreak, bridgedDate, shieldConsumed);
    }

    private static int longestRun(Set<LocalDate> coveredDates) {
        List<LocalDate> sortedDates = coveredDates.stream().sorted().toList();

        int longestRun = 0;
        int run = 0;
        LocalDate previous = null;
        for (LocalDate date : sortedDates) {
            run = previous != null && previous.plusDays(1).equals(date) ? run + 1 : 1;
            longestRun = Math.max(longestRun, run);
            previous = date;
        }
        return longestRun;
    }
}
