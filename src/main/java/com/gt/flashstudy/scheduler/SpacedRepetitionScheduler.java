package com.gt.flashstudy.scheduler;

import com.gt.flashstudy.model.CardProgress;
import com.gt.flashstudy.model.CardStatus;
import com.gt.flashstudy.model.CardType;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;

/**
 * SM-2 scheduling of a single card.
 * <p>
 * A successful answer (quality 3 or more) grows the interval 1, 6, then interval times the prior ease factor. A failed
 * answer restarts the card at a one day interval. The ease factor moves by the classic SM-2 adjustment and never
 * drops below the configured floor. A card counts as mastered once a successful answer leaves it with both enough
 * repetitions and a long enough interval; any other answered card is learning.
 */
@Component
public class SpacedRepetitionScheduler {

    public static final int MIN_QUALITY = 0;
    public static final int MAX_QUALITY = 5;
    public static final int PASSING_QUALITY = 3;

    private final double minimumEaseFactor;
    private final int masteredIntervalDays;
    private final int masteredMinRepetitions;
    private final int correctQuality;
    private final int incorrectQuality;

    @Autowired
    public SpacedRepetitionScheduler(@Value("${flashstudy.scheduler.minimumEaseFactor:1.3}") double minimumEaseFactor,
                                     @Value("${flashstudy.scheduler.masteredIntervalDays:21}") int masteredIntervalDays,
                                     @Value("${flashstudy.scheduler.masteredMinRepetitions:6}") int masteredMinRepetitions,
                                     @Value("${flashstudy.scheduler.correctQuality:4}") int correctQuality,
                                     @Value("${flashstudy.scheduler.incorrectQuality:2}") int incorrectQuality) {
        this.minimumEaseFactor = minimumEaseFactor;
        this.masteredIntervalDays = masteredIntervalDays;
        this.masteredMinRepetitions = masteredMinRepetitions;
        this.correctQuality = clampQuality(correctQuality);
        this.incorrectQuality = clampQuality(incorrectQuality);
    }

    public MemoryUpdate update(MemoryState prior, int quality, LocalDate today) {
        int q = clampQuality(quality);
        boolean successful = q >= PASSING_QUALITY;

        int interval;
        int repetitions;
        if (successful) {
            if (prior.repetitions() == 0) {
                interval = 1;
            } else if (prior.repetitions() == 1) {
                interval = 6;
            } else {
                interval = (int) Math.round(prior.interval() * prior.easeFactor());
            }
            repetitions = prior.repetitions() + 1;
        } else {
            interval = 1;
            repetitions = 0;
        }

        int missedBy = MAX_QUALITY - q;
        double easeFactor = prior.easeFactor() + (0.1 - missedBy * (0.08 + missedBy * 0.02));
        easeFactor = Math.max(minimumEaseFactor, Math.round(easeFactor * 100) / 100.0);

        CardStatus status = successful && repetitions >= masteredMinRepetitions && interval >= masteredIntervalDays
                ? CardStatus.Mastered
                : CardStatus.Learning;

        return new MemoryUpdate(status, easeFactor, interval, repetitions, today.plusDays(interval));
    }

    // Binary answers only carry right or wrong, so every card type maps onto the same two grades
    public int qualityFor(CardType cardType, boolean wasCorrect) {
        switch (cardType) {
            case Standard:
            case Quiz:
            case TypeAnswer:
                return wasCorrect ? correctQuality : incorrectQuality;
            default:
                throw new IllegalArgumentException("Unhandled card type " + cardType);
        }
    }

    public CardProgress applyAnswer(CardProgress prior, CardType cardType, boolean wasCorrect, LocalDate today, Instant answeredAt) {
        MemoryUpdate memoryUpdate = update(MemoryState.of(prior), qualityFor(cardType, wasCorrect), today);

        return new CardProgress(
                prior.learnerId(),
                prior.cardId(),
                memoryUpdate.status(),
                memoryUpdate.easeFactor(),
                memoryUpdate.interval(),
                memoryUpdate.repetitions(),
                memoryUpdate.nextReviewDate(),
                prior.timesSeen() + 1,
                prior.timesCorrect() + (wasCorrect ? 1 : 0),
                prior.timesIncorrect() + (wasCorrect ? 0 : 1),
                answeredAt);
    }

    private static int clampQuality(int quality) {
        return Math.max(MIN_QUALITY, Math.min(MAX_QUALITY, quality));
    }
}
