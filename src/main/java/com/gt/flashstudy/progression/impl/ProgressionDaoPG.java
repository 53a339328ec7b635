package com.gt.flashstudy.progression.impl;

import com.gt.flashstudy.exception.DaoException;
import com.gt.flashstudy.model.LearnerProgression;
import com.gt.flashstudy.progression.LifetimeTotalsDelta;
import com.gt.flashstudy.progression.ProgressionDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

public class ProgressionDaoPG implements ProgressionDao {

    private static final Logger log = LoggerFactory.getLogger(ProgressionDaoPG.class);

    private static final String PROGRESSION_COLUMNS =
            "id, level, current_xp, next_level_xp, total_xp, current_streak, longest_streak, streak_shield_active, streak_shield_used_date, " +
            "total_cards_learned, total_cards_mastered, total_decks_completed, total_time_spent_seconds, total_answers, total_correct_answers ";

    private static final String LOAD_PROGRESSION_SQL =
            "SELECT " + PROGRESSION_COLUMNS +
            "FROM learners " +
            "WHERE id = :learnerId";

    private static final String LOAD_PROGRESSION_FOR_UPDATE_SQL = LOAD_PROGRESSION_SQL + " FOR UPDATE";

    private static final String SAVE_LEVEL_STATE_SQL =
            "UPDATE learners " +
            "SET level = :level, current_xp = :currentXp, next_level_xp = :nextLevelXp, total_xp = :totalXp, updated_at = NOW() " +
            "WHERE id = :learnerId";

    private static final String ADD_LIFETIME_TOTALS_SQL =
            "UPDATE learners " +
            "SET total_cards_learned = total_cards_learned + :cardsLearned, " +
                "total_cards_mastered = GREATEST(0, total_cards_mastered + :cardsMasteredChange), " +
                "total_decks_completed = total_decks_completed + :decksCompleted, " +
                "total_time_spent_seconds = total_time_spent_seconds + :timeSpentSeconds, " +
                "total_answers = total_answers + :answers, " +
                "total_correct_answers = total_correct_answers + :correctAnswers, " +
                "last_activity_at = NOW(), updated_at = NOW() " +
            "WHERE id = :learnerId";

    private static final String SAVE_STREAK_SQL =
            "UPDATE learners " +
            "SET current_streak = :currentStreak, longest_streak = :longestStreak, streak_shield_active = :streakShieldActive, " +
                "streak_shield_used_date = :streakShieldUsedDate, updated_at = NOW() " +
            "WHERE id = :learnerId";

    private static final String TOUCH_LAST_ACTIVITY_SQL =
            "UPDATE learners SET last_activity_at = NOW() WHERE id = :learnerId";

    private final NamedParameterJdbcTemplate template;

    public ProgressionDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public LearnerProgression loadProgression(String learnerId) {
        return querySingleProgression(LOAD_PROGRESSION_SQL, learnerId);
    }

    @Override
    public LearnerProgression loadProgressionForUpdate(String learnerId) {
        return querySingleProgression(LOAD_PROGRESSION_FOR_UPDATE_SQL, learnerId);
    }

    @Override
    public void saveLevelState(LearnerProgression progression) {
        template.update(SAVE_LEVEL_STATE_SQL, Map.of(
                "learnerId", progression.learnerId(),
                "level", progression.level(),
                "currentXp", progression.currentXp(),
                "nextLevelXp", progression.nextLevelXp(),
                "totalXp", progression.totalXp()));
    }

    @Override
    public void addLifetimeTotals(String learnerId, LifetimeTotalsDelta delta) {
        template.update(ADD_LIFETIME_TOTALS_SQL, Map.of(
                "learnerId", learnerId,
                "cardsLearned", delta.cardsLearned(),
                "cardsMasteredChange", delta.cardsMasteredChange(),
                "decksCompleted", delta.decksCompleted(),
                "timeSpentSeconds", delta.timeSpentSeconds(),
                "answers", delta.answers(),
                "correctAnswers", delta.correctAnswers()));
    }

    @Override
    public void saveStreak(LearnerProgression progression) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("learnerId", progression.learnerId());
        params.addValue("currentStreak", progression.currentStreak());
        params.addValue("longestStreak", progression.longestStreak());
        params.addValue("streakShieldActive", progression.streakShieldActive());
        params.addValue("streakShieldUsedDate", progression.streakShieldUsedDate() == null ? null : Date.valueOf(progression.streakShieldUsedDate()));

        template.update(SAVE_STREAK_SQL, params);
    }

    @Override
    public void touchLastActivity(String learnerId) {
        template.update(TOUCH_LAST_ACTIVITY_SQL, Map.of("learnerId", learnerId));
    }

    private LearnerProgression querySingleProgression(String sql, String learnerId) {
        List<LearnerProgression> progressions = template.query(sql, Map.of("learnerId", learnerId), ProgressionDaoPG::getProgressionFromResultSet);

        if (progressions.isEmpty()) {
            return null;
        }
        if (progressions.size() > 1) {
            throw new DaoException("Expected 1 learner with id " + learnerId + ", but found " + progressions.size());
        }
        return progressions.get(0);
    }

    private static LearnerProgression getProgressionFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        Date shieldUsedDate = rs.getDate("streak_shield_used_date");

        return new LearnerProgression(
                rs.getString("id"),
                rs.getInt("level"),
                rs.getInt("current_xp"),
                rs.getInt("next_level_xp"),
                rs.getLong("total_xp"),
                rs.getInt("current_streak"),
                rs.getInt("longest_streak"),
                rs.getBoolean("streak_shield_active"),
                shieldUsedDate == null ? null : shieldUsedDate.toLocalDate(),
                rs.getInt("total_cards_learned"),
                rs.getInt("total_cards_mastered"),
                rs.getInt("total_decks_completed"),
                rs.getLong("total_time_spent_seconds"),
                rs.getInt("total_answers"),
                rs.getInt("total_correct_answers"));
    }
}
