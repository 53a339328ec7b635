package com.gt.flashstudy.selection;

import com.gt.flashstudy.model.Card;
import com.gt.flashstudy.model.CardType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.util.HashSet;
import java.util.List;

import static com.gt.flashstudy.util.TestUtils.card;
import static com.gt.flashstudy.util.TestUtils.standardCards;
import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(SpringExtension.class)
public class CardInterleaverTests {

    private final CardInterleaver interleaver = new CardInterleaver();

    @Test
    public void testSingleTypeUnchanged() {
        List<Card> cards = standardCards(4);

        assertEquals(cards, interleaver.interleave(cards));
    }

    @Test
    public void testEmptyList() {
        assertTrue(interleaver.interleave(List.of()).isEmpty());
    }

    @Test
    public void testAlternatesTypes() {
        List<Card> cards = List.of(
                card("s1", CardType.Standard, 1),
                card("s2", CardType.Standard, 2),
                card("s3", CardType.Standard, 3),
                card("q1", CardType.Quiz, 4),
                card("q2", CardType.Quiz, 5),
                card("t1", CardType.TypeAnswer, 6));

        List<Card> interleaved = interleaver.interleave(cards);

        assertEquals(List.of("s1", "q1", "t1", "s2", "q2", "s3"), interleaved.stream().map(Card::id).toList());
    }

    @Test
    public void testResultIsPermutation() {
        List<Card> cards = List.of(
                card("q1", CardType.Quiz, 1),
                card("s1", CardType.Standard, 2),
                card("q2", CardType.Quiz, 3),
                card("q3", CardType.Quiz, 4),
                card("s2", CardType.Standard, 5));

        List<Card> interleaved = interleaver.interleave(cards);

        assertEquals(cards.size(), interleaved.size());
        assertEquals(new HashSet<>(cards), new HashSet<>(interleaved));
        assertEquals(List.of("q1", "s1", "q2", "s2", "q3"), interleaved.stream().map(Card::id).toList());
    }
}
