package com.gt.flashstudy.progression;

public record LifetimeTotalsDelta(int cardsLearned,
                                  int cardsMasteredChange,
                                  int decksCompleted,
                                  int timeSpentSeconds,
                                  int answers,
                                  int correctAnswers) { }
