package com.tcg.duel.match;

/**
 * Base exception for submissions the session refuses before the rules engine sees them.
 */
public class MatchException extends Exception {
    public MatchException(String message) {
        super(message);
    }

    public MatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
