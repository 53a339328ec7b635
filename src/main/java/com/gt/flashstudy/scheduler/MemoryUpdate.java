package com.gt.flashstudy.scheduler;

import com.gt.flashstudy.model.CardStatus;

import java.time.LocalDate;

public record MemoryUpdate(CardStatus status, double easeFactor, int interval, int repetitions, LocalDate nextReviewDate) { }
