package com.tcg.duel.game;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A stat change applied to a board card, kept so it can be reversed when it expires.
 *
 * @param expiresOnTurn turn at whose start the modifier is reversed, null for permanent
 */
public record TemporaryModifier(
    @JsonProperty("card_id") String cardId,
    @JsonProperty("stat") Stat stat,
    @JsonProperty("amount") int amount,
    @JsonProperty("source") String source,
    @JsonProperty("expires_on_turn") Integer expiresOnTurn
) {
    public boolean expiresBy(int turn) {
        return expiresOnTurn != null && expiresOnTurn <= turn;
    }
}
