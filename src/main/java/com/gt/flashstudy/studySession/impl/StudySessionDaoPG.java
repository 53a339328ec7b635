package com.gt.flashstudy.studySession.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gt.flashstudy.exception.DaoException;
import com.gt.flashstudy.exception.MappingException;
import com.gt.flashstudy.model.AnswerOutcome;
import com.gt.flashstudy.model.SelectionMethod;
import com.gt.flashstudy.model.SessionStatus;
import com.gt.flashstudy.model.StudySession;
import com.gt.flashstudy.studySession.StudySessionDao;
import org.postgresql.util.PGobject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class StudySessionDaoPG implements StudySessionDao {

    private static final Logger log = LoggerFactory.getLogger(StudySessionDaoPG.class);

    private static final TypeReference<LinkedHashMap<String, AnswerOutcome>> ANSWERS_TYPE = new TypeReference<>() { };

    private static final String SESSION_COLUMNS =
            "id, learner_id, guest_token, deck_id, title, selection_method, selected_card_ids, total_cards, current_card_index, answers, " +
            "streak, session_xp, status, started_at, completed_at, last_activity_at, duration_seconds, score, correct_count, " +
            "incorrect_count, skipped_count, starting_level ";

    private static final String CREATE_SESSION_SQL =
            "INSERT INTO study_sessions " +
                    "(id, learner_id, guest_token, is_guest, deck_id, title, selection_method, selected_card_ids, total_cards, current_card_index, " +
                    "answers, streak, session_xp, status, started_at, last_activity_at, duration_seconds, starting_level) " +
            "VALUES (:id, :learnerId, :guestToken, :isGuest, :deckId, :title, :selectionMethod, :selectedCardIds, :totalCards, :currentCardIndex, " +
                    ":answers, :streak, :sessionXp, :status, :startedAt, :lastActivityAt, :durationSeconds, :startingLevel)";

    private static final String LOAD_SESSION_SQL =
            "SELECT " + SESSION_COLUMNS +
            "FROM study_sessions " +
            "WHERE id = :sessionId";

    private static final String LOAD_SESSION_FOR_UPDATE_SQL = LOAD_SESSION_SQL + " FOR UPDATE";

    private static final String SAVE_SESSION_PROGRESS_SQL =
            "UPDATE study_sessions " +
            "SET current_card_index = :currentCardIndex, answers = :answers, streak = :streak, session_xp = :sessionXp, " +
                "duration_seconds = :durationSeconds, last_activity_at = :lastActivityAt " +
            "WHERE id = :sessionId";

    private static final String SAVE_SESSION_COMPLETION_SQL =
            "UPDATE study_sessions " +
            "SET status = :status, completed_at = :completedAt, last_activity_at = :lastActivityAt, duration_seconds = :durationSeconds, " +
                "score = :score, correct_count = :correctCount, incorrect_count = :incorrectCount, skipped_count = :skippedCount " +
            "WHERE id = :sessionId";

    private static final String SAVE_SESSION_ABANDONMENT_SQL =
            "UPDATE study_sessions " +
            "SET status = :status, last_activity_at = :lastActivityAt " +
            "WHERE id = :sessionId";

    private static final String LOAD_LEARNER_SESSIONS_SQL =
            "SELECT " + SESSION_COLUMNS +
            "FROM study_sessions " +
            "WHERE learner_id = :learnerId AND (:status = '' OR status = :status) AND (:deckId = '' OR deck_id = :deckId) " +
            "ORDER BY last_activity_at DESC " +
            "LIMIT :limit OFFSET :offset";

    private static final String LOAD_ACTIVE_SESSION_CARD_IDS_SQL =
            "SELECT DISTINCT UNNEST(selected_card_ids) AS card_id " +
            "FROM study_sessions " +
            "WHERE learner_id = :learnerId AND status = 'active'";

    private static final String PURGE_INACTIVE_GUEST_SESSIONS_SQL =
            "DELETE FROM study_sessions WHERE is_guest IS TRUE AND learner_id IS NULL AND last_activity_at < :cutoff";

    private final NamedParameterJdbcTemplate template;
    private final ObjectMapper objectMapper;

    public StudySessionDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate, ObjectMapper objectMapper) {
        this.template = namedParameterJdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void createSession(StudySession studySession) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("id", studySession.id());
        params.addValue("learnerId", studySession.learnerId());
        params.addValue("guestToken", studySession.guestToken());
        params.addValue("isGuest", studySession.isGuest());
        params.addValue("deckId", studySession.deckId());
        params.addValue("title", studySession.title());
        params.addValue("selectionMethod", studySession.selectionMethod().getCode());
        params.addValue("selectedCardIds", studySession.selectedCardIds().toArray(new String[0]));
        params.addValue("totalCards", studySession.totalCards());
        params.addValue("currentCardIndex", studySession.currentCardIndex());
        params.addValue("answers", toJsonb(studySession.answers()));
        params.addValue("streak", studySession.streak());
        params.addValue("sessionXp", studySession.sessionXp());
        params.addValue("status", studySession.status().getCode());
        params.addValue("startedAt", Timestamp.from(studySession.startedAt()));
        params.addValue("lastActivityAt", Timestamp.from(studySession.lastActivityAt()));
        params.addValue("durationSeconds", studySession.durationSeconds());
        params.addValue("startingLevel", studySession.startingLevel());

        template.update(CREATE_SESSION_SQL, params);
    }

    @Override
    public StudySession loadSession(String sessionId) {
        return querySingleSession(LOAD_SESSION_SQL, sessionId);
    }

    @Override
    public StudySession loadSessionForUpdate(String sessionId) {
        return querySingleSession(LOAD_SESSION_FOR_UPDATE_SQL, sessionId);
    }

    @Override
    public void saveSessionProgress(StudySession studySession) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("sessionId", studySession.id());
        params.addValue("currentCardIndex", studySession.currentCardIndex());
        params.addValue("answers", toJsonb(studySession.answers()));
        params.addValue("streak", studySession.streak());
        params.addValue("sessionXp", studySession.sessionXp());
        params.addValue("durationSeconds", studySession.durationSeconds());
        params.addValue("lastActivityAt", Timestamp.from(studySession.lastActivityAt()));

        template.update(SAVE_SESSION_PROGRESS_SQL, params);
    }

    @Override
    public void saveSessionCompletion(StudySession studySession) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("sessionId", studySession.id());
        params.addValue("status", studySession.status().getCode());
        params.addValue("completedAt", Timestamp.from(studySession.completedAt()));
        params.addValue("lastActivityAt", Timestamp.from(studySession.lastActivityAt()));
        params.addValue("durationSeconds", studySession.durationSeconds());
        params.addValue("score", studySession.score());
        params.addValue("correctCount", studySession.correctCount());
        params.addValue("incorrectCount", studySession.incorrectCount());
        params.addValue("skippedCount", studySession.skippedCount());

        template.update(SAVE_SESSION_COMPLETION_SQL, params);
    }

    @Override
    public void saveSessionAbandonment(StudySession studySession) {
        template.update(SAVE_SESSION_ABANDONMENT_SQL, Map.of(
                "sessionId", studySession.id(),
                "status", studySession.status().getCode(),
                "lastActivityAt", Timestamp.from(studySession.lastActivityAt())));
    }

    @Override
    public List<StudySession> loadLearnerSessions(String learnerId, SessionStatus status, String deckId, int limit, int offset) {
        return template.query(LOAD_LEARNER_SESSIONS_SQL, Map.of(
                        "learnerId", learnerId,
                        "status", status == null ? "" : status.getCode(),   // blank when not filtering
                        "deckId", deckId == null ? "" : deckId,
                        "limit", limit,
                        "offset", offset),
                sessionRowMapper());
    }

    @Override
    public Set<String> loadActiveSessionCardIds(String learnerId) {
        return new HashSet<>(template.queryForList(LOAD_ACTIVE_SESSION_CARD_IDS_SQL, Map.of("learnerId", learnerId), String.class));
    }

    @Override
    public int purgeInactiveGuestSessions(Instant cutoff) {
        return template.update(PURGE_INACTIVE_GUEST_SESSIONS_SQL, Map.of("cutoff", Timestamp.from(cutoff)));
    }

    private StudySession querySingleSession(String sql, String sessionId) {
        List<StudySession> sessions = template.query(sql, Map.of("sessionId", sessionId), sessionRowMapper());

        if (sessions.isEmpty()) {
            return null;
        }
        if (sessions.size() > 1) {
            throw new DaoException("Expected 1 study session with id " + sessionId + ", but found " + sessions.size());
        }
        return sessions.get(0);
    }

    private RowMapper<StudySession> sessionRowMapper() {
        return (rs, rowNum) -> new StudySession(
                rs.getString("id"),
                rs.getString("learner_id"),
                rs.getString("guest_token"),
                rs.getString("deck_id"),
                rs.getString("title"),
                SelectionMethod.fromCode(rs.getString("selection_method")),
                toStringList(rs.getArray("selected_card_ids")),
                rs.getInt("total_cards"),
                rs.getInt("current_card_index"),
                fromJson(rs.getString("answers")),
                rs.getInt("streak"),
                rs.getInt("session_xp"),
                SessionStatus.fromCode(rs.getString("status")),
                toInstant(rs.getTimestamp("started_at")),
                toInstant(rs.getTimestamp("completed_at")),
                toInstant(rs.getTimestamp("last_activity_at")),
                rs.getInt("duration_seconds"),
                rs.getObject("score", Integer.class),
                rs.getObject("correct_count", Integer.class),
                rs.getObject("incorrect_count", Integer.class),
                rs.getObject("skipped_count", Integer.class),
                rs.getObject("starting_level", Integer.class));
    }

    private PGobject toJsonb(Map<String, AnswerOutcome> answers) {
        try {
            PGobject jsonb = new PGobject();
            jsonb.setType("jsonb");
            jsonb.setValue(objectMapper.writeValueAsString(answers));
            return jsonb;
        } catch (JsonProcessingException | SQLException ex) {
            throw new MappingException("Unable to convert session answers to JSON", ex);
        }
    }

    private Map<String, AnswerOutcome> fromJson(String answersJson) {
        if (answersJson == null || answersJson.isBlank()) {
            return new LinkedHashMap<>();
        }

        try {
            return objectMapper.readValue(answersJson, ANSWERS_TYPE);
        } catch (JsonProcessingException ex) {
            log.error("Stored session answers could not be parsed: {}", answersJson);
            throw new MappingException("Unable to read session answers", ex);
        }
    }

    private static List<String> toStringList(Array sqlArray) throws SQLException {
        if (sqlArray == null) {
            return List.of();
        }
        return Arrays.asList((String[]) sqlArray.getArray());
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
