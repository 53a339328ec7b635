package com.gt.flashstudy.scheduler;

import com.gt.flashstudy.model.CardProgress;

public record MemoryState(double easeFactor, int interval, int repetitions) {

    public static MemoryState of(CardProgress cardProgress) {
        return new MemoryState(cardProgress.easeFactor(), cardProgress.interval(), cardProgress.repetitions());
    }
}
