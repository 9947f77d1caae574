package com.tcg.duel.rules;

import com.tcg.duel.card.EffectAction;
import com.tcg.duel.card.Zone;
import com.tcg.duel.game.Event;
import com.tcg.duel.game.GameState;
import com.tcg.duel.game.Phase;
import com.tcg.duel.game.Seat;
import com.tcg.duel.game.TemporaryModifier;
import com.tcg.duel.game.WinReason;
import com.tcg.duel.game.zones.PlayerZones;

import java.util.ArrayList;
import java.util.List;

/**
 * Manages turn structure: phase advancement, the draw step and the end-of-turn hand limit.
 */
public final class TurnManager {

    private TurnManager() {
        // Utility class - prevent instantiation
    }

    /**
     * Advance to the next phase. From the end phase this closes the turn and starts the
     * opponent's, expiring every modifier that lasts until the end of this turn.
     *
     * @param state The current game state
     * @param seat  The seat asking to advance; must be the turn player
     */
    public static List<Event> advancePhase(GameState state, Seat seat) {
        if (seat != state.currentTurnPlayer()) {
            return List.of();
        }
        Phase from = state.currentPhase();
        List<Event> events = new ArrayList<>();

        if (from == Phase.END) {
            int nextTurn = state.turnNumber() + 1;
            events.add(new Event.TurnEnded(seat));
            for (TemporaryModifier modifier : state.temporaryModifiers()) {
                if (modifier.expiresBy(nextTurn)) {
                    events.add(new Event.ModifierExpired(modifier.cardId(), modifier.stat(), modifier.amount(),
                            modifier.source()));
                }
            }
            events.add(new Event.TurnStarted(seat.opponent(), nextTurn));
            return events;
        }

        Phase to = from.next();
        if (to == Phase.COMBAT && state.hasRestriction(seat, EffectAction.Restriction.DISABLE_BATTLE_PHASE)) {
            to = to.next();
        }
        events.add(new Event.PhaseChanged(from, to));

        // Leaving the draw phase draws for the turn player
        if (from == Phase.DRAW && !state.hasRestriction(seat, EffectAction.Restriction.DISABLE_DRAW_PHASE)) {
            events.addAll(drawCard(state, seat));
        }
        return events;
    }

    /**
     * Draw the top card, or lose the duel when the deck is empty.
     */
    public static List<Event> drawCard(GameState state, Seat seat) {
        List<String> deck = state.player(seat).deck();
        if (deck.isEmpty()) {
            return List.of(new Event.DeckOut(seat), new Event.GameEnded(seat.opponent(), WinReason.DECK_OUT));
        }
        return List.of(new Event.CardDrawn(seat, deck.get(0)));
    }

    /**
     * End phase: the turn player discards down to the maximum hand size, last cards first out.
     *
     * @param state The current game state
     */
    public static List<Event> handSizeDiscards(GameState state) {
        Seat seat = state.currentTurnPlayer();
        PlayerZones zones = state.player(seat);
        int excess = zones.hand().size() - state.config().maxHandSize();
        if (excess <= 0) {
            return List.of();
        }
        List<Event> events = new ArrayList<>(excess);
        List<String> hand = zones.hand();
        for (int i = hand.size() - excess; i < hand.size(); i++) {
            events.add(new Event.CardSentToGraveyard(hand.get(i), Zone.HAND, seat));
        }
        return events;
    }
}
