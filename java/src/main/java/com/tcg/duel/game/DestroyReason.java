package com.tcg.duel.game;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DestroyReason {
    BATTLE("battle"),
    EFFECT("effect"),
    BREAKDOWN("breakdown");

    private final String jsonValue;

    DestroyReason(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
