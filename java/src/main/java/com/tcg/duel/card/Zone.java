package com.tcg.duel.card;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Places a card instance can be in.
 */
public enum Zone {
    HAND("hand"),
    BOARD("board"),
    SPELL_TRAP_ZONE("spell_trap_zone"),
    FIELD("field"),
    GRAVEYARD("graveyard"),
    BANISHED("banished"),
    DECK("deck");

    private final String jsonValue;

    Zone(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
