package com.gt.flashstudy.selection;

import com.gt.flashstudy.exception.ErrorKind;
import com.gt.flashstudy.exception.NoCardsException;
import com.gt.flashstudy.model.Card;
import com.gt.flashstudy.model.CardProgress;
import com.gt.flashstudy.model.CardStatus;
import com.gt.flashstudy.model.SelectionMethod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static com.gt.flashstudy.util.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(SpringExtension.class)
public class CardSelectionPolicyTests {

    private static final LocalDate TODAY = LocalDate.of(2024, 3, 10);

    private CardSelectionPolicy policy;

    @BeforeEach
    public void setup() {
        policy = new CardSelectionPolicy(new Random(42));
    }

    @Test
    public void testSelectAllKeepsDeckOrder() {
        List<Card> cards = standardCards(5);

        SelectionResult result = policy.select(TEST_DECK_ID, cards, Map.of(), SelectionMethod.All,
                new SelectionOptions(2, null, true, Set.of()), TODAY);

        assertEquals(cards, result.selectedCards());
        assertEquals(5, result.availableCount());
        assertEquals(0, result.masteredCount());
    }

    @Test
    public void testSelectRandomTruncatesToCardCount() {
        List<Card> cards = standardCards(10);

        SelectionResult result = policy.select(TEST_DECK_ID, cards, Map.of(), SelectionMethod.Random,
                new SelectionOptions(4, null, true, Set.of()), TODAY);

        assertEquals(4, result.selectedCards().size());
        assertEquals(4, new HashSet<>(result.selectedCards()).size());
        assertTrue(cards.containsAll(result.selectedCards()));
        assertEquals(10, result.availableCount());
    }

    @Test
    public void testSelectRandomWithoutCardCountKeepsEverything() {
        List<Card> cards = standardCards(6);

        SelectionResult result = policy.select(TEST_DECK_ID, cards, Map.of(), SelectionMethod.Random,
                new SelectionOptions(null, null, true, Set.of()), TODAY);

        assertEquals(new HashSet<>(cards), new HashSet<>(result.selectedCards()));
    }

    @Test
    public void testSelectManualKeepsDeckOrder() {
        List<Card> cards = standardCards(5);

        SelectionResult result = policy.select(TEST_DECK_ID, cards, Map.of(), SelectionMethod.Manual,
                new SelectionOptions(null, List.of("c4", "c2", "missing"), true, Set.of()), TODAY);

        assertEquals(List.of(cards.get(1), cards.get(3)), result.selectedCards());
    }

    @Test
    public void testSelectManualWithNoIds() {
        NoCardsException ex = assertThrows(NoCardsException.class, () -> policy.select(TEST_DECK_ID, standardCards(3), Map.of(),
                SelectionMethod.Manual, new SelectionOptions(null, List.of(), true, Set.of()), TODAY));

        assertEquals(ErrorKind.NoCardsAvailable, ex.getKind());
    }

    @Test
    public void testSelectSmartOrdersByUrgency() {
        List<Card> cards = standardCards(6);
        Map<String, CardProgress> progress = Map.of(
                "c1", progress("c1", CardStatus.Learning, 6, 2, TODAY.plusDays(3)),
                "c2", progress("c2", CardStatus.Learning, 1, 1, TODAY),
                "c4", progress("c4", CardStatus.Learning, 6, 2, TODAY.minusDays(4)),
                "c5", progress("c5", CardStatus.Learning, 6, 2, TODAY.plusDays(1)));

        SelectionResult result = policy.select(TEST_DECK_ID, cards, progress, SelectionMethod.Smart,
                new SelectionOptions(null, null, true, Set.of()), TODAY);

        assertEquals(List.of("c4", "c2", "c3", "c6", "c5", "c1"), result.selectedCards().stream().map(Card::id).toList());

        result = policy.select(TEST_DECK_ID, cards, progress, SelectionMethod.Smart,
                new SelectionOptions(3, null, true, Set.of()), TODAY);

        assertEquals(List.of("c4", "c2", "c3"), result.selectedCards().stream().map(Card::id).toList());
    }

    @Test
    public void testExcludeMasteredCards() {
        List<Card> cards = standardCards(4);
        Map<String, CardProgress> progress = Map.of(
                "c1", progress("c1", CardStatus.Mastered, 40, 7, TODAY.plusDays(30)),
                "c3", progress("c3", CardStatus.Mastered, 40, 7, TODAY.plusDays(30)));

        SelectionResult excluded = policy.select(TEST_DECK_ID, cards, progress, SelectionMethod.All,
                new SelectionOptions(null, null, true, Set.of()), TODAY);

        assertEquals(List.of("c2", "c4"), excluded.selectedCards().stream().map(Card::id).toList());
        assertEquals(2, excluded.availableCount());
        assertEquals(2, excluded.masteredCount());

        SelectionResult included = policy.select(TEST_DECK_ID, cards, progress, SelectionMethod.All,
                new SelectionOptions(null, null, false, Set.of()), TODAY);

        assertEquals(4, included.selectedCards().size());
        assertEquals(0, included.masteredCount());
    }

    @Test
    public void testExcludeActiveSessionCards() {
        List<Card> cards = standardCards(4);

        SelectionResult result = policy.select(TEST_DECK_ID, cards, Map.of(), SelectionMethod.All,
                new SelectionOptions(null, null, true, Set.of("c1", "c2")), TODAY);

        assertEquals(List.of("c3", "c4"), result.selectedCards().stream().map(Card::id).toList());
        assertEquals(2, result.availableCount());
    }

    @Test
    public void testEmptyDeck() {
        NoCardsException ex = assertThrows(NoCardsException.class, () -> policy.select(TEST_DECK_ID, List.of(), Map.of(),
                SelectionMethod.All, new SelectionOptions(null, null, true, Set.of()), TODAY));

        assertEquals(ErrorKind.NoCardsInDeck, ex.getKind());
    }

    @Test
    public void testEverythingExcluded() {
        List<Card> cards = standardCards(2);
        Map<String, CardProgress> progress = Map.of("c1", progress("c1", CardStatus.Mastered, 40, 7, TODAY.plusDays(30)));

        NoCardsException ex = assertThrows(NoCardsException.class, () -> policy.select(TEST_DECK_ID, cards, progress,
                SelectionMethod.Random, new SelectionOptions(5, null, true, Set.of("c2")), TODAY));

        assertEquals(ErrorKind.NoCardsAvailable, ex.getKind());
    }

    @Test
    public void testCountAvailable() {
        List<Card> cards = standardCards(5);
        Map<String, CardProgress> progress = Map.of(
                "c1", progress("c1", CardStatus.Mastered, 40, 7, TODAY.plusDays(30)),
                "c2", progress("c2", CardStatus.Learning, 1, 1, TODAY));

        AvailableCardCount count = policy.countAvailable(cards, progress, true, Set.of("c1", "c3"));

        assertEquals(5, count.totalCards());
        assertEquals(1, count.masteredCount());
        assertEquals(2, count.activeSessionCardCount());
        assertEquals(3, count.availableCount());

        count = policy.countAvailable(cards, progress, false, Set.of());
        assertEquals(5, count.availableCount());
    }
}
