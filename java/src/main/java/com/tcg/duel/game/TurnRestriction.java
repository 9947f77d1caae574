package com.tcg.duel.game;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tcg.duel.card.EffectAction;

public record TurnRestriction(
    @JsonProperty("seat") Seat seat,
    @JsonProperty("restriction") EffectAction.Restriction restriction,
    @JsonProperty("source") String source,
    @JsonProperty("expires_on_turn") int expiresOnTurn
) {
}
