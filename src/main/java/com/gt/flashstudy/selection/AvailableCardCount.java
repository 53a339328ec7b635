package com.gt.flashstudy.selection;

public record AvailableCardCount(int totalCards, int masteredCount, int activeSessionCardCount, int availableCount) { }
