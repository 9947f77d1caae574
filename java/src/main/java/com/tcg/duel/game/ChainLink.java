package com.tcg.duel.game;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One activation waiting on the chain.
 */
public record ChainLink(
    @JsonProperty("card_id") String cardId,
    @JsonProperty("definition_id") String definitionId,
    @JsonProperty("effect_index") int effectIndex,
    @JsonProperty("activating_player") Seat activatingPlayer,
    @JsonProperty("targets") List<String> targets
) {
    public ChainLink {
        targets = targets != null ? List.copyOf(targets) : List.of();
    }
}
