package com.gt.flashstudy.progression.impl;

import com.gt.flashstudy.model.DailyProgress;
import com.gt.flashstudy.progression.DailyProgressDao;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.Date;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public class DailyProgressDaoPG implements DailyProgressDao {

    private static final String ADD_DAILY_PROGRESS_SQL =
            "INSERT INTO daily_progress (learner_id, progress_date, cards_studied, cards_learned, time_spent_seconds, xp_earned, sessions_completed) " +
                    "VALUES (:learnerId, :progressDate, :cardsStudied, :cardsLearned, :timeSpentSeconds, :xpEarned, :sessionsCompleted) " +
            "ON CONFLICT (learner_id, progress_date) DO UPDATE " +
                    "SET cards_studied = daily_progress.cards_studied + EXCLUDED.cards_studied, " +
                    "cards_learned = daily_progress.cards_learned + EXCLUDED.cards_learned, " +
                    "time_spent_seconds = daily_progress.time_spent_seconds + EXCLUDED.time_spent_seconds, " +
                    "xp_earned = daily_progress.xp_earned + EXCLUDED.xp_earned, " +
                    "sessions_completed = daily_progress.sessions_completed + EXCLUDED.sessions_completed";

    private static final String LOAD_ACTIVE_DATES_SQL =
            "SELECT progress_date FROM daily_progress " +
            "WHERE learner_id = :learnerId " +
                "AND (cards_studied > 0 OR cards_learned > 0 OR time_spent_seconds > 0 OR xp_earned > 0 OR sessions_completed > 0) " +
            "ORDER BY progress_date DESC";

    private final NamedParameterJdbcTemplate template;

    public DailyProgressDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public void addDailyProgress(DailyProgress dailyProgress) {
        template.update(ADD_DAILY_PROGRESS_SQL, Map.of(
                "learnerId", dailyProgress.learnerId(),
                "progressDate", Date.valueOf(dailyProgress.date()),
                "cardsStudied", dailyProgress.cardsStudied(),
                "cardsLearned", dailyProgress.cardsLearned(),
                "timeSpentSeconds", dailyProgress.timeSpentSeconds(),
                "xpEarned", dailyProgress.xpEarned(),
                "sessionsCompleted", dailyProgress.sessionsCompleted()));
    }

    @Override
    public List<LocalDate> loadActiveDates(String learnerId) {
        return template.query(LOAD_ACTIVE_DATES_SQL, Map.of("learnerId", learnerId),
                (rs, rowNum) -> rs.getDate("progress_date").toLocalDate());
    }
}
