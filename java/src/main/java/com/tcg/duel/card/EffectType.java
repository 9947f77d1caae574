package com.tcg.duel.card;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * When an effect may be used.
 * <ul>
 *   <li>{@code ON_SUMMON} - fires automatically when the monster is summoned</li>
 *   <li>{@code IGNITION} - activated by its controller in a main phase</li>
 *   <li>{@code TRIGGER} - reacts to an event; carried as data only</li>
 *   <li>{@code QUICK} - may respond inside an open chain</li>
 *   <li>{@code CONTINUOUS} - applies while the card is face-up; carried as data only</li>
 * </ul>
 */
public enum EffectType {
    ON_SUMMON("on_summon"),
    IGNITION("ignition"),
    TRIGGER("trigger"),
    QUICK("quick"),
    CONTINUOUS("continuous");

    private final String jsonValue;

    EffectType(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
