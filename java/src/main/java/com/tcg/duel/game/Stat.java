package com.tcg.duel.game;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Stat {
    ATTACK("attack"),
    DEFENSE("defense");

    private final String jsonValue;

    Stat(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
