package com.gt.flashstudy.achievement.impl;

import com.gt.flashstudy.achievement.AchievementDao;
import com.gt.flashstudy.model.Achievement;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class AchievementDaoPG implements AchievementDao {

    private static final String LOAD_ACHIEVEMENTS_SQL =
            "SELECT id, title, description, icon, tier, xp_reward, condition_type, condition_value " +
            "FROM achievements " +
            "ORDER BY condition_type, condition_value, id";

    private static final String LOAD_UNLOCKED_ACHIEVEMENT_IDS_SQL =
            "SELECT achievement_id FROM learner_achievements WHERE learner_id = :learnerId";

    private static final String UNLOCK_ACHIEVEMENT_SQL =
            "INSERT INTO learner_achievements (learner_id, achievement_id, xp_awarded) " +
            "VALUES (:learnerId, :achievementId, :xpAwarded) " +
            "ON CONFLICT (learner_id, achievement_id) DO NOTHING";

    private static final String COUNT_COMPLETED_SESSIONS_SQL =
            "SELECT COUNT(*) FROM study_sessions WHERE learner_id = :learnerId AND status = 'completed'";

    private static final String COUNT_OWNED_DECKS_SQL =
            "SELECT COUNT(*) FROM decks WHERE owner_id = :learnerId AND deleted_at IS NULL";

    private static final String COUNT_FULLY_MASTERED_DECKS_SQL =
            "SELECT COUNT(*) FROM (" +
                "SELECT d.id " +
                "FROM decks d " +
                "JOIN cards c ON c.deck_id = d.id AND c.deleted_at IS NULL " +
                "LEFT JOIN card_progress cp ON cp.card_id = c.id AND cp.learner_id = :learnerId " +
                "WHERE d.deleted_at IS NULL " +
                "GROUP BY d.id " +
                "HAVING COUNT(c.id) > 0 AND COUNT(c.id) = COUNT(CASE WHEN cp.status = 'mastered' THEN 1 END)" +
            ") mastered_decks";

    private final NamedParameterJdbcTemplate template;

    public AchievementDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public List<Achievement> loadAchievements() {
        return template.query(LOAD_ACHIEVEMENTS_SQL, (rs, rowNum) -> new Achievement(
                rs.getString("id"),
                rs.getString("title"),
                rs.getString("description"),
                rs.getString("icon"),
                rs.getString("tier"),
                rs.getInt("xp_reward"),
                rs.getString("condition_type"),
                rs.getInt("condition_value")));
    }

    @Override
    public Set<String> loadUnlockedAchievementIds(String learnerId) {
        return new HashSet<>(template.queryForList(LOAD_UNLOCKED_ACHIEVEMENT_IDS_SQL, Map.of("learnerId", learnerId), String.class));
    }

    @Override
    public boolean unlockAchievement(String learnerId, Achievement achievement) {
        return template.update(UNLOCK_ACHIEVEMENT_SQL, Map.of(
                "learnerId", learnerId,
                "achievementId", achievement.id(),
                "xpAwarded", achievement.xpReward())) > 0;
    }

    @Override
    public int countCompletedSessions(String learnerId) {
        return count(COUNT_COMPLETED_SESSIONS_SQL, learnerId);
    }

    @Override
    public int countOwnedDecks(String learnerId) {
        return count(COUNT_OWNED_DECKS_SQL, learnerId);
    }

    @Override
    public int countFullyMasteredDecks(String learnerId) {
        return count(COUNT_FULLY_MASTERED_DECKS_SQL, learnerId);
    }

    private int count(String sql, String learnerId) {
        Integer count = template.queryForObject(sql, Map.of("learnerId", learnerId), Integer.class);
        return count == null ? 0 : count;
    }
}
