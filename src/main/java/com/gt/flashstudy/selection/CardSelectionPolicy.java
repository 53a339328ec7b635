package com.gt.flashstudy.selection;

import com.gt.flashstudy.exception.NoCardsException;
import com.gt.flashstudy.model.Card;
import com.gt.flashstudy.model.CardProgress;
import com.gt.flashstudy.model.CardStatus;
import com.gt.flashstudy.model.SelectionMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Chooses the working set of a new study session from the live cards of a deck.
 * <p>
 * Exclusions are applied first and then the selection method picks and orders what remains:
 * <ul>
 *     <li>{@code all} keeps every eligible card in deck order</li>
 *     <li>{@code random} shuffles the eligible cards and keeps the first {@code cardCount}</li>
 *     <li>{@code manual} keeps the eligible cards that were picked by hand, in deck order</li>
 *     <li>{@code smart} puts due cards first (most overdue first), then never reviewed cards, then the rest by
 *     next review date, and keeps the first {@code cardCount}</li>
 * </ul>
 */
@Component
public class CardSelectionPolicy {

    private static final Logger log = LoggerFactory.getLogger(CardSelectionPolicy.class);

    private final Random random;

    @Autowired
    public CardSelectionPolicy() {
        this(new SecureRandom());
    }

    CardSelectionPolicy(Random random) {
        this.random = random;
    }

    public SelectionResult select(String deckId,
                                  List<Card> deckCards,
                                  Map<String, CardProgress> cardProgress,
                                  SelectionMethod selectionMethod,
                                  SelectionOptions options,
                                  LocalDate today) {
        if (deckCards.isEmpty()) {
            throw NoCardsException.emptyDeck(deckId);
        }

        List<Card> eligibleCards = new ArrayList<>();
        int masteredCount = 0;
        for (Card card : deckCards) {
            if (options.excludeMastered() && isMastered(cardProgress.get(card.id()))) {
                masteredCount++;
            } else if (!options.excludedCardIds().contains(card.id())) {
                eligibleCards.add(card);
            }
        }

        List<Card> selectedCards;
        switch (selectionMethod) {
            case All:
                selectedCards = eligibleCards;
                break;
            case Random:
                selectedCards = truncate(shuffle(eligibleCards), options.cardCount());
                break;
            case Manual:
                selectedCards = pickExplicit(eligibleCards, options.explicitCardIds());
                break;
            case Smart:
                selectedCards = truncate(orderByReviewUrgency(eligibleCards, cardProgress, today), options.cardCount());
                break;
            default:
                throw new IllegalArgumentException("Unhandled selection method " + selectionMethod);
        }

        if (selectedCards.isEmpty()) {
            throw NoCardsException.noneAvailable(deckId);
        }

        log.debug("Selected {} of {} available cards from deck {} using {} selection", selectedCards.size(), eligibleCards.size(),
                deckId, selectionMethod.getCode());

        return new SelectionResult(selectedCards, eligibleCards.size(), masteredCount);
    }

    public AvailableCardCount countAvailable(List<Card> deckCards,
                                             Map<String, CardProgress> cardProgress,
                                             boolean excludeMastered,
                                             Set<String> activeSessionCardIds) {
        int masteredCount = 0;
        int activeSessionCardCount = 0;
        int availableCount = 0;

        for (Card card : deckCards) {
            boolean mastered = isMastered(cardProgress.get(card.id()));
            boolean inActiveSession = activeSessionCardIds.contains(card.id());

            if (mastered) {
                masteredCount++;
            }
            if (inActiveSession) {
                activeSessionCardCount++;
            }
            if (!(excludeMastered && mastered) && !inActiveSession) {
                availableCount++;
            }
        }

        return new AvailableCardCount(deckCards.size(), masteredCount, activeSessionCardCount, availableCount);
    }

    private List<Card> shuffle(List<Card> cards) {
        List<Card> shuffled = new ArrayList<>(cards);
        Collections.shuffle(shuffled, random);
        return shuffled;
    }

    private static List<Card> pickExplicit(List<Card> eligibleCards, List<String> explicitCardIds) {
        if (explicitCardIds == null || explicitCardIds.isEmpty()) {
            return List.of();
        }

        Set<String> pickedIds = new HashSet<>(explicitCardIds);
        return eligibleCards.stream().filter(card -> pickedIds.contains(card.id())).toList();
    }

    private static List<Card> orderByReviewUrgency(List<Card> eligibleCards, Map<String, CardProgress> cardProgress, LocalDate today) {
        List<Card> dueCards = new ArrayList<>();
        List<Card> newCards = new ArrayList<>();
        List<Card> upcomingCards = new ArrayList<>();

        for (Card card : eligibleCards) {
            LocalDate nextReviewDate = nextReviewDate(cardProgress.get(card.id()));
            if (nextReviewDate == null) {
                newCards.add(card);
            } else if (!nextReviewDate.isAfter(today)) {
                dueCards.add(card);
            } else {
                upcomingCards.add(card);
            }
        }

        // List.sort is stable, so cards due on the same day keep their deck order
        Comparator<Card> byNextReviewDate = Comparator.comparing(card -> nextReviewDate(cardProgress.get(card.id())));
        dueCards.sort(byNextReviewDate);
        upcomingCards.sort(byNextReviewDate);

        List<Card> ordered = new ArrayList<>(eligibleCards.size());
        ordered.addAll(dueCards);
        ordered.addAll(newCards);
        ordered.addAll(upcomingCards);
        return ordered;
    }

    private static List<Card> truncate(List<Card> cards, Integer cardCount) {
        if (cardCount == null || cardCount <= 0 || cardCount >= cards.size()) {
            return cards;
        }
        return cards.subList(0, cardCount);
    }

    private static LocalDate nextReviewDate(CardProgress cardProgress) {
        return cardProgress == null ? null : cardProgress.nextReviewDate();
    }

    private static boolean isMastered(CardProgress cardProgress) {
        return cardProgress != null && cardProgress.status() == CardStatus.Mastered;
    }
}
