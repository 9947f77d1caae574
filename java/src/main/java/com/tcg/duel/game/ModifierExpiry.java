package com.tcg.duel.game;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * When a temporary modifier stops applying.
 */
public enum ModifierExpiry {
    END_OF_TURN("end_of_turn"),
    END_OF_NEXT_TURN("end_of_next_turn"),
    PERMANENT("permanent");

    private final String jsonValue;

    ModifierExpiry(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    /**
     * Turn number at whose start the modifier is removed, or null if it never expires.
     */
    public Integer expiresOnTurn(int currentTurn) {
        return switch (this) {
            case END_OF_TURN -> currentTurn + 1;
            case END_OF_NEXT_TURN -> currentTurn + 2;
            case PERMANENT -> null;
        };
    }
}
