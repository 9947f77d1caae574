package com.tcg.duel.effect;

import com.tcg.duel.game.Event;
import com.tcg.duel.game.GameState;

import java.util.List;

/**
 * Applies events to a state without running any follow-up checks.
 */
@FunctionalInterface
public interface EventFolder {
    GameState fold(GameState state, List<Event> events);
}
