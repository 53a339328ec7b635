package com.gt.flashstudy.achievement;

public enum AchievementCondition {
    DecksCompleted("decks_completed", false),
    DecksCreated("decks_created", false),
    StreakDays("streak_days", false),
    CardsMastered("cards_mastered", false),
    CardsLearned("cards_learned", false),
    LevelReached("level_reached", false),
    TotalXp("total_xp", false),
    TotalSessionsCompleted("total_sessions_completed", false),
    CardsMasteredSingleDeck("cards_mastered_single_deck", false),
    CardsPerMinute("cards_per_minute", true),
    SessionTimeOfDay("session_time_of_day", true),
    PerfectScoreMinCards("perfect_score_min_cards", true),
    SingleSessionXp("single_session_xp", true);

    private final String code;
    private final boolean sessionScoped;

    AchievementCondition(String code, boolean sessionScoped) {
        this.code = code;
        this.sessionScoped = sessionScoped;
    }

    public String getCode() {
        return code;
    }

    public boolean isSessionScoped() {
        return sessionScoped;
    }

    // Returns null for condition types this service does not know about
    public static AchievementCondition fromCode(String code) {
        for (AchievementCondition condition : values()) {
            if (condition.code.equals(code)) {
                return condition;
            }
        }
        return null;
    }
}
