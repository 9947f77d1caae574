package com.tcg.duel.card;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which player an action applies to, relative to the activating player.
 */
public enum Recipient {
    SELF("self"),
    OPPONENT("opponent"),
    BOTH("both");

    private final String jsonValue;

    Recipient(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
