package com.tcg.duel.card;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Spell sub-types. Decides where an activated spell ends up once its chain link resolves.
 */
public enum SpellType {
    NORMAL("normal"),
    CONTINUOUS("continuous"),
    EQUIP("equip"),
    FIELD("field"),
    QUICK_PLAY("quick-play");

    private final String jsonValue;

    SpellType(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    /**
     * Whether the card stays on the field after its activation resolves.
     */
    public boolean staysOnField() {
        return this == CONTINUOUS || this == EQUIP || this == FIELD;
    }
}
