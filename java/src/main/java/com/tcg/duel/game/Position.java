package com.tcg.duel.game;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Position {
    ATTACK("attack"),
    DEFENSE("defense");

    private final String jsonValue;

    Position(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    public Position flip() {
        return this == ATTACK ? DEFENSE : ATTACK;
    }
}
