package com.gt.flashstudy.studySession.model;

import com.gt.flashstudy.model.StudySession;

import java.util.List;

// learner is null for guest sessions
public record AutosaveResult(StudySession session,
                             ProgressionSnapshot learner,
                             boolean leveledUp,
                             List<String> newAchievements) { }
