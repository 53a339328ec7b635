package com.gt.flashstudy.deck;

import com.gt.flashstudy.model.Card;

import java.util.Collection;
import java.util.List;

// Read-only view of the deck and card store owned by the deck management service
public interface DeckCardDao {

    boolean deckExists(String deckId);

    List<Card> loadActiveDeckCards(String deckId);

    // Includes soft-deleted cards so that sessions created before the deletion can still be resumed
    List<Card> loadCards(Collection<String> cardIds);
}
