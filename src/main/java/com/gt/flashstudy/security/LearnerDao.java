package com.gt.flashstudy.security;

import com.gt.flashstudy.exception.DaoException;
import com.gt.flashstudy.model.Learner;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class LearnerDao {

    private static final String GET_LEARNER_SQL = "SELECT id, username, password_hash, locked, enabled " +
            "FROM learners " +
            "WHERE username = :username";

    private final NamedParameterJdbcTemplate template;

    @Autowired
    public LearnerDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    public Learner getLearner(String username) {
        List<Learner> queriedLearners = template.query(GET_LEARNER_SQL, Map.of("username", username), (rs, rowNum) ->
                new Learner(
                        rs.getString("id"),
                        rs.getString("username"),
                        rs.getString("password_hash"),
                        rs.getBoolean("locked"),
                        rs.getBoolean("enabled"))
        );

        if (queriedLearners.isEmpty()) {
            return null;
        }
        if (queriedLearners.size() > 1) {
            throw new DaoException("Expected 1 learner, but found 2 or more.");
        }
        return queriedLearners.get(0);
    }
}
