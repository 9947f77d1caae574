package com.tcg.duel.simulation;

import com.tcg.duel.game.Seat;
import com.tcg.duel.game.WinReason;

/**
 * Result of a single simulated duel.
 */
public record DuelResult(
    /**
     * Winning seat, null if the duel hit the turn limit.
     */
    Seat winner,

    /**
     * How the duel was won, null if unfinished.
     */
    WinReason reason,

    /**
     * Turn number when the simulation stopped.
     */
    int turns,

    /**
     * Commands applied over the whole duel.
     */
    int commands
) {
    public boolean isFinished() {
        return winner != null;
    }
}
