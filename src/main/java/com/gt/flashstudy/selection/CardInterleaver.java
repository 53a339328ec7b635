package com.gt.flashstudy.selection;

import com.gt.flashstudy.model.Card;
import com.gt.flashstudy.model.CardType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// Spreads card types round-robin across the working set, keeping the relative order inside each type.
// Types take turns in the order they first appear.
@Component
public class CardInterleaver {

    public List<Card> interleave(List<Card> cards) {
        Map<CardType, List<Card>> cardsByType = new LinkedHashMap<>();
        for (Card card : cards) {
            cardsByType.computeIfAbsent(card.type(), type -> new ArrayList<>()).add(card);
        }

        if (cardsByType.size() < 2) {
            return new ArrayList<>(cards);
        }

        List<Card> interleaved = new ArrayList<>(cards.size());
        for (int round = 0; interleaved.size() < cards.size(); round++) {
            for (List<Card> typeCards : cardsByType.values()) {
                if (round < typeCards.size()) {
                    interleaved.add(typeCards.get(round));
                }
            }
        }

        return interleaved;
    }
}
