package com.tcg.duel.effect;

import com.tcg.duel.card.CardDefinition;
import com.tcg.duel.card.EffectAction;
import com.tcg.duel.card.EffectDefinition;
import com.tcg.duel.card.EffectType;
import com.tcg.duel.game.Event;
import com.tcg.duel.game.GameState;
import com.tcg.duel.game.Seat;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Runs whole effects: every action of one effect, in order.
 */
public final class EffectInterpreter {

    private EffectInterpreter() {
        // Utility class - prevent instantiation
    }

    /**
     * Execute effect {@code effectIndex} of a card. Each action observes the state left by the
     * actions before it, so "draw 1, then discard 1" discards the freshly drawn card.
     *
     * @param folder applies one action's events before the next action runs
     * @return the concatenated events, empty if the index is out of range
     */
    public static List<Event> executeEffect(GameState state, CardDefinition card, int effectIndex,
                                            Seat seat, String sourceCardId, List<String> targets,
                                            EventFolder folder) {
        if (card == null || effectIndex < 0 || effectIndex >= card.getEffects().size()) {
            return List.of();
        }
        EffectDefinition effect = card.getEffects().get(effectIndex);

        List<Event> events = new ArrayList<>();
        GameState current = state;
        for (EffectAction action : effect.actions()) {
            List<Event> actionEvents = Operations.executeAction(current, action, seat, sourceCardId, targets);
            if (actionEvents.isEmpty()) {
                continue;
            }
            events.addAll(actionEvents);
            current = folder.fold(current, actionEvents);
        }
        return events;
    }

    /**
     * Index of the card's first effect of the given type.
     */
    public static OptionalInt findEffect(CardDefinition card, EffectType type) {
        List<EffectDefinition> effects = card.getEffects();
        for (int i = 0; i < effects.size(); i++) {
            if (effects.get(i).type() == type) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }
}
