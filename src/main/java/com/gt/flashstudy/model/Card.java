package com.gt.flashstudy.model;

import java.time.Instant;
import java.util.List;

public record Card(String id,
                   String deckId,
                   String front,
                   String back,
                   String context,
                   String hint,
                   CardType type,
                   List<String> options,
                   List<Integer> correctOptionIndices,
                   int position,
                   Instant deletedAt) { }
