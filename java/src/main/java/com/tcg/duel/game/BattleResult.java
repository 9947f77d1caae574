package com.tcg.duel.game;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of a battle from the attacker's point of view.
 */
public enum BattleResult {
    WIN("win"),
    LOSE("lose"),
    DRAW("draw");

    private final String jsonValue;

    BattleResult(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
