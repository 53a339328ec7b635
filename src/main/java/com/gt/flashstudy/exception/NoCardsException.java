package com.gt.flashstudy.exception;

// Thrown when a deck exists but selection leaves nothing to study
public class NoCardsException extends StudyEngineException {

    private NoCardsException(ErrorKind kind, String msg) {
        super(kind, msg);
    }

    public static NoCardsException emptyDeck(String deckId) {
        return new NoCardsException(ErrorKind.NoCardsInDeck, "Deck " + deckId + " has no cards");
    }

    public static NoCardsException noneAvailable(String deckId) {
        return new NoCardsException(ErrorKind.NoCardsAvailable, "No cards of deck " + deckId + " are available for a new session");
    }
}
