package com.tcg.duel.game;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Cards from the top of a seat's own deck that the seat was allowed to look at.
 * Cleared at the start of the next turn.
 */
public record TopDeckView(
    @JsonProperty("seat") Seat seat,
    @JsonProperty("card_ids") List<String> cardIds,
    @JsonProperty("source_card_id") String sourceCardId,
    @JsonProperty("viewed_on_turn") int viewedOnTurn
) {
    public TopDeckView {
        cardIds = List.copyOf(cardIds);
    }
}
