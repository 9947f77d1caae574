package com.tcg.duel.game;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tcg.duel.card.EffectAction;

/**
 * A change to the activation cost of one seat's cards, recorded until it expires.
 */
public record CostModifier(
    @JsonProperty("seat") Seat seat,
    @JsonProperty("card_type") EffectAction.CostCardType cardType,
    @JsonProperty("operation") EffectAction.CostOperation operation,
    @JsonProperty("amount") int amount,
    @JsonProperty("source") String source,
    @JsonProperty("expires_on_turn") int expiresOnTurn
) {
    /**
     * Applies this modifier to a base cost. Costs never drop below zero.
     */
    public int apply(int baseCost) {
        int cost = switch (operation) {
            case INCREASE -> baseCost + amount;
            case DECREASE -> baseCost - amount;
            case SET -> amount;
        };
        return Math.max(0, cost);
    }
}
