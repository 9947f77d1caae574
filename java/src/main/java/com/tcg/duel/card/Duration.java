package com.tcg.duel.card;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifetime of a stat boost.
 */
public enum Duration {
    TURN("turn"),
    PERMANENT("permanent");

    private final String jsonValue;

    Duration(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
