package com.tcg.duel.match;

/**
 * The caller acted on an outdated snapshot.
 */
public class StaleVersionException extends MatchException {
    private final long expected;
    private final long actual;

    public StaleVersionException(long expected, long actual) {
        super("Stale version: expected " + expected + " but session is at " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public long getExpected() {
        return expected;
    }

    public long getActual() {
        return actual;
    }
}
