package com.tcg.duel.card;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Top-level card categories.
 */
public enum CardType {
    MONSTER("monster"),
    SPELL("spell"),
    TRAP("trap");

    private final String jsonValue;

    CardType(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    public static CardType fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Card type cannot be null");
        }
        return switch (value.toLowerCase()) {
            case "monster" -> MONSTER;
            case "spell" -> SPELL;
            case "trap" -> TRAP;
            default -> throw new IllegalArgumentException("Unknown card type: " + value);
        };
    }
}
