package com.tcg.duel.match;

import com.tcg.duel.game.Seat;

public class DuelFinishedException extends MatchException {
    public DuelFinishedException(Seat winner) {
        super("Duel is over, winner: " + winner);
    }
}
