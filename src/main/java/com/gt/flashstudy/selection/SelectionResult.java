package com.gt.flashstudy.selection;

import com.gt.flashstudy.model.Card;

import java.util.List;

public record SelectionResult(List<Card> selectedCards, int availableCount, int masteredCount) { }
