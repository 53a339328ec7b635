package com.gt.flashstudy.deck.impl;

import com.gt.flashstudy.deck.DeckCardDao;
import com.gt.flashstudy.model.Card;
import com.gt.flashstudy.model.CardType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;

public class DeckCardDaoPG implements DeckCardDao {

    private static final Logger log = LoggerFactory.getLogger(DeckCardDaoPG.class);

    private static final String DECK_EXISTS_SQL =
            "SELECT EXISTS (SELECT 1 FROM decks WHERE id = :deckId AND deleted_at IS NULL)";

    private static final String LOAD_ACTIVE_DECK_CARDS_SQL =
            "SELECT id, deck_id, front, back, context, hint, card_type, options, correct_option_indices, position, deleted_at " +
            "FROM cards " +
            "WHERE deck_id = :deckId AND deleted_at IS NULL " +
            "ORDER BY position, created_at";

    private static final String LOAD_CARDS_SQL =
            "SELECT id, deck_id, front, back, context, hint, card_type, options, correct_option_indices, position, deleted_at " +
            "FROM cards " +
            "WHERE id IN (:cardIds)";

    private final NamedParameterJdbcTemplate template;

    public DeckCardDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public boolean deckExists(String deckId) {
        Boolean exists = template.queryForObject(DECK_EXISTS_SQL, Map.of("deckId", deckId), Boolean.class);
        return exists != null && exists;
    }

    @Override
    public List<Card> loadActiveDeckCards(String deckId) {
        return template.query(LOAD_ACTIVE_DECK_CARDS_SQL, Map.of("deckId", deckId), DeckCardDaoPG::getCardFromResultSet);
    }

    @Override
    public List<Card> loadCards(Collection<String> cardIds) {
        if (cardIds.isEmpty()) {
            return List.of();
        }
        return template.query(LOAD_CARDS_SQL, Map.of("cardIds", cardIds), DeckCardDaoPG::getCardFromResultSet);
    }

    private static Card getCardFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        return new Card(
                rs.getString("id"),
                rs.getString("deck_id"),
                rs.getString("front"),
                rs.getString("back"),
                rs.getString("context"),
                rs.getString("hint"),
                CardType.fromCode(rs.getString("card_type")),
                toList(rs.getArray("options"), String.class),
                toList(rs.getArray("correct_option_indices"), Integer.class),
                rs.getInt("position"),
                toInstant(rs.getTimestamp("deleted_at")));
    }

    private static <T> List<T> toList(Array sqlArray, Class<T> elementType) throws SQLException {
        if (sqlArray == null) {
            return List.of();
        }
        return Arrays.stream((Object[]) sqlArray.getArray()).map(elementType::cast).toList();
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
