package com.gt.flashstudy.studySession.model;

import com.gt.flashstudy.model.SelectionMethod;

import java.util.List;

/**
 * @param excludeMasteredCards      defaults to {@code true} when absent
 * @param excludeActiveSessionCards defaults to {@code false} when absent
 */
public record NewSessionRequest(String deckId,
                                SelectionMethod selectionMethod,
                                Integer cardCount,
                                List<String> selectedCardIds,
                                Boolean excludeMasteredCards,
                                Boolean excludeActiveSessionCards,
                                String title) {

    public boolean shouldExcludeMastered() {
        return excludeMasteredCards == null || excludeMasteredCards;
    }

    public boolean shouldExcludeActiveSessionCards() {
        return excludeActiveSessionCards != null && excludeActiveSessionCards;
    }
}
