package com.tcg.duel.card;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TrapType {
    NORMAL("normal"),
    CONTINUOUS("continuous"),
    COUNTER("counter");

    private final String jsonValue;

    TrapType(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
