package com.tcg.duel.rules;

import com.tcg.duel.card.CardDefinition;
import com.tcg.duel.card.EffectDefinition;
import com.tcg.duel.card.EffectType;
import com.tcg.duel.card.Zone;
import com.tcg.duel.effect.EffectInterpreter;
import com.tcg.duel.engine.Evolver;
import com.tcg.duel.game.ChainLink;
import com.tcg.duel.game.Command;
import com.tcg.duel.game.Event;
import com.tcg.duel.game.GameState;
import com.tcg.duel.game.Seat;
import com.tcg.duel.game.zones.BoardCard;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Chain building and resolution.
 * <p>
 * Links resolve one at a time, last in first out. The top link resolves once both seats have
 * passed in succession; priority then goes to the opponent of whoever activated the new top link.
 */
public final class ChainRules {

    private ChainRules() {
        // Utility class - prevent instantiation
    }

    // ==================== IGNITION ====================

    /**
     * Activate an ignition effect of a face-up monster, opening a new chain.
     */
    public static List<Event> activateEffect(GameState state, Seat seat, Command.ActivateEffect command) {
        if (!state.currentPhase().isMainPhase()) {
            return List.of();
        }
        Optional<List<String>> targets = monsterEffectTargets(state, seat, command.cardId(), command.effectIndex(),
                EffectType.IGNITION, command.targets());
        if (targets.isEmpty()) {
            return List.of();
        }
        return List.of(
                new Event.EffectActivated(seat, command.cardId(), command.effectIndex()),
                new Event.ChainStarted(),
                new Event.ChainLinkAdded(seat, command.cardId(), command.effectIndex(), targets.get()));
    }

    // ==================== RESPONSES ====================

    /**
     * Pass priority or add a link. Only the seat holding priority may call this.
     */
    public static List<Event> respond(GameState state, Seat seat, Command.ChainResponse command) {
        if (!state.isChainOpen() || state.currentPriorityPlayer() != seat) {
            return List.of();
        }
        if (command.pass()) {
            return pass(state, seat);
        }
        if (command.cardId() == null) {
            return List.of();
        }
        if (state.player(seat).findSpellTrap(command.cardId()).isPresent()) {
            return SpellTrapRules.respondWithSetCard(state, seat, command.cardId(), command.effectIndex(),
                    command.targets());
        }
        Optional<List<String>> targets = monsterEffectTargets(state, seat, command.cardId(), command.effectIndex(),
                EffectType.QUICK, command.targets());
        if (targets.isEmpty()) {
            return List.of();
        }
        return List.of(
                new Event.EffectActivated(seat, command.cardId(), command.effectIndex()),
                new Event.ChainLinkAdded(seat, command.cardId(), command.effectIndex(), targets.get()));
    }

    private static Optional<List<String>> monsterEffectTargets(GameState state, Seat seat, String cardId,
                                                               int effectIndex, EffectType type,
                                                               List<String> selected) {
        Optional<BoardCard> monster = state.player(seat).findBoardCard(cardId);
        if (monster.isEmpty() || monster.get().faceDown()) {
            return Optional.empty();
        }
        CardDefinition card = state.definitionOf(cardId);
        Optional<EffectDefinition> effect = EffectRules.effectAt(card, effectIndex);
        if (effect.isEmpty() || effect.get().type() != type || !EffectRules.isUsageAvailable(state, cardId, effectIndex)) {
            return Optional.empty();
        }
        return EffectRules.activationTargets(state, seat, effect.get(), selected);
    }

    // ==================== RESOLUTION ====================

    /**
     * The second consecutive pass resolves the top link. Its effect sees the chain before the pop,
     * so a negate lands on the nearest live link below. A normal spell or trap is sent to the
     * graveyard after its link resolves, and so is any spell or trap whose link was negated.
     */
    static List<Event> pass(GameState state, Seat seat) {
        List<Event> events = new ArrayList<>();
        events.add(new Event.ChainPassed(seat));
        Seat passer = state.currentChainPasser();
        if (passer == null || passer == seat) {
            return events;
        }

        List<ChainLink> chain = state.currentChain();
        int index = chain.size() - 1;
        ChainLink link = chain.get(index);
        boolean negated = state.negatedLinks().contains(index);
        events.add(new Event.ChainLinkResolved(index, link.cardId(), negated));

        CardDefinition card = state.definitionOf(link.cardId());
        if (!negated && card != null) {
            events.addAll(EffectInterpreter.executeEffect(state, card, link.effectIndex(), link.activatingPlayer(),
                    link.cardId(), link.targets(), Evolver::fold));
        }

        GameState resolved = Evolver.fold(state, events);
        if (card != null && !card.isMonster() && (negated || !card.staysOnField())) {
            resolved.ownerOf(link.cardId()).ifPresent(owner -> {
                Optional<Zone> zone = resolved.player(owner).locate(link.cardId());
                if (zone.isPresent() && (zone.get() == Zone.SPELL_TRAP_ZONE || zone.get() == Zone.FIELD)) {
                    events.add(new Event.CardSentToGraveyard(link.cardId(), zone.get(), owner));
                }
            });
        }
        if (index == 0) {
            events.add(new Event.ChainResolved());
        }
        return events;
    }
}
