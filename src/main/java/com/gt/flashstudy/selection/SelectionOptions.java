package com.gt.flashstudy.selection;

import java.util.List;
import java.util.Set;

/**
 * @param cardCount        maximum size of the working set, {@code null} or non-positive for no limit
 * @param explicitCardIds  cards picked by hand for {@code manual} selection
 * @param excludeMastered  leave out cards whose progress is already mastered
 * @param excludedCardIds  cards already live in another of the learner's active sessions
 */
public record SelectionOptions(Integer cardCount,
                               List<String> explicitCardIds,
                               boolean excludeMastered,
                               Set<String> excludedCardIds) {

    public static SelectionOptions forGuest(Integer cardCount, List<String> explicitCardIds) {
        return new SelectionOptions(cardCount, explicitCardIds, false, Set.of());
    }
}
