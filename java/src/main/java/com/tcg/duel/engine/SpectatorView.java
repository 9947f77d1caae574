package com.tcg.duel.engine;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tcg.duel.game.ChainLink;
import com.tcg.duel.game.GameState;
import com.tcg.duel.game.Phase;
import com.tcg.duel.game.Seat;
import com.tcg.duel.game.WinReason;

import java.util.List;
import java.util.Map;

/**
 * Seat-agnostic projection: both sides are redacted the way an opponent sees them.
 */
public record SpectatorView(
    @JsonProperty("host") PlayerView.SideView host,
    @JsonProperty("away") PlayerView.SideView away,
    @JsonProperty("current_turn_player") Seat currentTurnPlayer,
    @JsonProperty("current_priority_player") Seat currentPriorityPlayer,
    @JsonProperty("turn_number") int turnNumber,
    @JsonProperty("current_phase") Phase currentPhase,
    @JsonProperty("current_chain") List<ChainLink> currentChain,
    @JsonProperty("card_definitions") Map<String, String> cardDefinitions,
    @JsonProperty("game_over") boolean gameOver,
    @JsonProperty("winner") Seat winner,
    @JsonProperty("win_reason") WinReason winReason
) {
    public static SpectatorView of(GameState state) {
        return new SpectatorView(
                PlayerView.SideView.redacted(state.host()),
                PlayerView.SideView.redacted(state.away()),
                state.currentTurnPlayer(),
                state.currentPriorityPlayer(),
                state.turnNumber(),
                state.currentPhase(),
                state.currentChain(),
                PlayerView.visibleDefinitions(state, null),
                state.gameOver(),
                state.winner(),
                state.winReason());
    }
}
