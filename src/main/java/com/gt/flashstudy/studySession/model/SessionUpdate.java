package com.gt.flashstudy.studySession.model;

import com.gt.flashstudy.model.AnswerOutcome;

import java.util.Map;

// Partial autosave payload, absent fields keep their stored values
public record SessionUpdate(Integer currentCardIndex,
                            Map<String, AnswerOutcome> answers,
                            Integer streak,
                            Integer sessionXp,
                            Integer durationSeconds) {
}
