package com.tcg.duel.game;

import com.fasterxml.jackson.annotation.JsonValue;

public enum WinReason {
    LP_ZERO("lp_zero"),
    DECK_OUT("deck_out"),
    BREAKDOWN("breakdown"),
    SURRENDER("surrender");

    private final String jsonValue;

    WinReason(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
