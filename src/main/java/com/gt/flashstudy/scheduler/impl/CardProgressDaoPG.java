package com.gt.flashstudy.scheduler.impl;

import com.gt.flashstudy.model.CardProgress;
import com.gt.flashstudy.model.CardStatus;
import com.gt.flashstudy.scheduler.CardProgressDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;

public class CardProgressDaoPG implements CardProgressDao {

    private static final Logger log = LoggerFactory.getLogger(CardProgressDaoPG.class);

    private static final String LOAD_CARD_PROGRESS_SQL =
            "SELECT learner_id, card_id, status, ease_factor, interval_days, repetitions, next_review_date, times_seen, times_correct, times_incorrect, last_reviewed_at " +
            "FROM card_progress " +
            "WHERE learner_id = :learnerId AND card_id IN (:cardIds)";

    private static final String SAVE_CARD_PROGRESS_SQL =
            "INSERT INTO card_progress " +
                    "(learner_id, card_id, status, ease_factor, interval_days, repetitions, next_review_date, times_seen, times_correct, times_incorrect, last_reviewed_at) " +
                    "VALUES (:learnerId, :cardId, :status, :easeFactor, :intervalDays, :repetitions, :nextReviewDate, :timesSeen, :timesCorrect, :timesIncorrect, :lastReviewedAt) " +
            "ON CONFLICT (learner_id, card_id) DO UPDATE " +
                    "SET status = :status, ease_factor = :easeFactor, interval_days = :intervalDays, repetitions = :repetitions, " +
                    "next_review_date = :nextReviewDate, times_seen = :timesSeen, times_correct = :timesCorrect, times_incorrect = :timesIncorrect, " +
                    "last_reviewed_at = :lastReviewedAt, updated_at = NOW()";

    private final NamedParameterJdbcTemplate template;

    public CardProgressDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public List<CardProgress> loadCardProgress(String learnerId, Collection<String> cardIds) {
        if (cardIds.isEmpty()) {
            return List.of();
        }

        return template.query(LOAD_CARD_PROGRESS_SQL, Map.of("learnerId", learnerId, "cardIds", cardIds),
                CardProgressDaoPG::getCardProgressFromResultSet);
    }

    @Override
    public void saveCardProgressBatch(List<CardProgress> cardProgress) {
        SqlParameterSource paramsArray[] = new SqlParameterSource[cardProgress.size()];

        for (int index = 0; index < cardProgress.size(); index++) {
            CardProgress progress = cardProgress.get(index);

            MapSqlParameterSource params = new MapSqlParameterSource();
            params.addValue("learnerId", progress.learnerId());
            params.addValue("cardId", progress.cardId());
            params.addValue("status", progress.status().getCode());
            params.addValue("easeFactor", BigDecimal.valueOf(progress.easeFactor()).setScale(2, RoundingMode.HALF_UP));
            params.addValue("intervalDays", progress.interval());
            params.addValue("repetitions", progress.repetitions());
            params.addValue("nextReviewDate", progress.nextReviewDate() == null ? null : Date.valueOf(progress.nextReviewDate()));
            params.addValue("timesSeen", progress.timesSeen());
            params.addValue("timesCorrect", progress.timesCorrect());
            params.addValue("timesIncorrect", progress.timesIncorrect());
            params.addValue("lastReviewedAt", progress.lastReviewedAt() == null ? null : Timestamp.from(progress.lastReviewedAt()));
            paramsArray[index] = params;
        }

        template.batchUpdate(SAVE_CARD_PROGRESS_SQL, paramsArray);
    }

    private static CardProgress getCardProgressFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        return new CardProgress(
                rs.getString("learner_id"),
                rs.getString("card_id"),
                CardStatus.fromCode(rs.getString("status")),
                rs.getDouble("ease_factor"),
                rs.getInt("interval_days"),
                rs.getInt("repetitions"),
                toLocalDate(rs.getDate("next_review_date")),
                rs.getInt("times_seen"),
                rs.getInt("times_correct"),
                rs.getInt("times_incorrect"),
                toInstant(rs.getTimestamp("last_reviewed_at")));
    }

    private static LocalDate toLocalDate(Date date) {
        return date == null ? null : date.toLocalDate();
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
