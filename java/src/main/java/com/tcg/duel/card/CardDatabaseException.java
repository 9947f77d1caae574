package com.tcg.duel.card;

/**
 * Exception thrown while loading or querying the card catalog.
 */
public class CardDatabaseException extends Exception {
    public CardDatabaseException(String message) {
        super(message);
    }

    public CardDatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
