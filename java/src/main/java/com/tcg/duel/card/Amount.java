package com.tcg.duel.card;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.Map;

/**
 * Quantity carried by stat, damage and heal actions.
 * <p>
 * JSON forms: a plain number for {@link Literal}, {@code {"graveyard_count": "self"}}
 * for {@link GraveyardCount} and the string {@code "mirror"} for {@link Mirror}.
 */
@JsonDeserialize(using = AmountDeserializer.class)
public sealed interface Amount permits Amount.Literal, Amount.GraveyardCount, Amount.Mirror {

    static Amount of(int value) {
        return new Literal(value);
    }

    /**
     * A fixed number.
     */
    record Literal(int value) implements Amount {
        @JsonValue
        public int value() {
            return value;
        }
    }

    /**
     * Number of cards in the graveyard(s) named by {@code scope}, relative to the activating player.
     * Read when the action executes, not when the effect is compiled.
     */
    record GraveyardCount(Recipient scope) implements Amount {
        @JsonValue
        public Map<String, Recipient> toJson() {
            return Map.of(AmountDeserializer.GRAVEYARD_COUNT, scope);
        }
    }

    /**
     * Mirrors a quantity from the triggering event. No event carries one yet, so it resolves to 0.
     */
    record Mirror() implements Amount {
        @JsonValue
        public String toJson() {
            return AmountDeserializer.MIRROR;
        }
    }
}
