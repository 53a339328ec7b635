package com.gt.flashstudy.studySession.model;

public record CardOutcome(String cardId, boolean wasCorrect) { }
