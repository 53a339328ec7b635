package com.gt.flashstudy.progression;

import java.time.LocalDate;

/**
 * @param shieldedDate the missed day bridged by the streak shield, {@code null} when the shield has never been used
 * @param shieldConsumed whether this calculation is the one that used up the shield
 */
public record StreakResult(int currentStreak, int longestStreak, LocalDate shieldedDate, boolean shieldConsumed) { }
