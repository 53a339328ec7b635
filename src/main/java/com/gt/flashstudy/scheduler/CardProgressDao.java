package com.gt.flashstudy.scheduler;

import com.gt.flashstudy.model.CardProgress;

import java.util.Collection;
import java.util.List;

public interface CardProgressDao {

    List<CardProgress> loadCardProgress(String learnerId, Collection<String> cardIds);

    void saveCardProgressBatch(List<CardProgress> cardProgress);
}
