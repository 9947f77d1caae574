package com.tcg.duel.game;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Phases of a turn, in order. The turn passes to the other seat after {@link #END}.
 */
public enum Phase {
    DRAW("draw"),
    STANDBY("standby"),
    MAIN("main"),
    COMBAT("combat"),
    MAIN2("main2"),
    BREAKDOWN_CHECK("breakdown_check"),
    END("end");

    private final String jsonValue;

    Phase(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    /**
     * The phase that follows this one within a turn; {@code END} has none.
     */
    public Phase next() {
        return switch (this) {
            case DRAW -> STANDBY;
            case STANDBY -> MAIN;
            case MAIN -> COMBAT;
            case COMBAT -> MAIN2;
            case MAIN2 -> BREAKDOWN_CHECK;
            case BREAKDOWN_CHECK -> END;
            case END -> throw new IllegalStateException("end phase has no successor within the turn");
        };
    }

    public boolean isMainPhase() {
        return this == MAIN || this == MAIN2;
    }
}
