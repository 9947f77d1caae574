package com.tcg.duel.rules;

import com.tcg.duel.card.Zone;
import com.tcg.duel.game.DestroyReason;
import com.tcg.duel.game.Event;
import com.tcg.duel.game.GameState;
import com.tcg.duel.game.Seat;
import com.tcg.duel.game.zones.BoardCard;

import java.util.ArrayList;
import java.util.List;

/**
 * Vice counters and breakdowns. A monster carrying at least the breakdown threshold in vice
 * counters is destroyed, and its owner's opponent is credited with a breakdown.
 */
public final class ViceRules {

    private ViceRules() {
        // Utility class - prevent instantiation
    }

    /**
     * Break down every monster at or over the threshold, host board first, each board in order.
     */
    public static List<Event> checkBreakdowns(GameState state) {
        int threshold = state.config().breakdownThreshold();
        List<Event> events = new ArrayList<>();
        for (Seat seat : Seat.values()) {
            for (BoardCard card : state.player(seat).board()) {
                if (card.viceCounters() >= threshold) {
                    events.add(new Event.BreakdownTriggered(seat, card.cardId()));
                    events.add(new Event.CardDestroyed(card.cardId(), DestroyReason.BREAKDOWN));
                    events.add(new Event.CardSentToGraveyard(card.cardId(), Zone.BOARD, seat));
                }
            }
        }
        return events;
    }

    /**
     * Whether a batch moved any vice counter.
     */
    public static boolean changesVice(List<Event> batch) {
        return batch.stream().anyMatch(e -> e.kind() == Event.Kind.VICE_COUNTER_ADDED
                || e.kind() == Event.Kind.VICE_COUNTER_REMOVED);
    }
}
