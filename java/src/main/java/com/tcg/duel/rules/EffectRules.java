package com.tcg.duel.rules;

import com.tcg.duel.card.CardDefinition;
import com.tcg.duel.card.CardType;
import com.tcg.duel.card.EffectAction;
import com.tcg.duel.card.EffectDefinition;
import com.tcg.duel.card.EffectType;
import com.tcg.duel.card.TargetFilter;
import com.tcg.duel.card.Zone;
import com.tcg.duel.effect.EffectInterpreter;
import com.tcg.duel.engine.Evolver;
import com.tcg.duel.game.Event;
import com.tcg.duel.game.GameState;
import com.tcg.duel.game.Seat;
import com.tcg.duel.game.zones.BoardCard;
import com.tcg.duel.game.zones.PlayerZones;
import com.tcg.duel.game.zones.SpellTrapCard;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Effect legality shared by activations, chain responses and summon triggers:
 * target candidates, target validation, once-per-turn tracking.
 */
public final class EffectRules {

    private EffectRules() {
        // Utility class - prevent instantiation
    }

    // ==================== ONCE PER TURN ====================

    /**
     * Soft once-per-turn is tracked per card copy.
     */
    public static String optKey(String cardId, int effectIndex) {
        return cardId + "#" + effectIndex;
    }

    /**
     * Hard once-per-turn is tracked per card name, across copies.
     */
    public static String hoptKey(String definitionId, EffectDefinition effect) {
        return definitionId + "#" + effect.id();
    }

    public static boolean isUsageAvailable(GameState state, String cardId, int effectIndex) {
        CardDefinition card = state.definitionOf(cardId);
        Optional<EffectDefinition> effect = effectAt(card, effectIndex);
        if (effect.isEmpty()) {
            return false;
        }
        if (effect.get().oncePerTurn() && state.optUsedThisTurn().contains(optKey(cardId, effectIndex))) {
            return false;
        }
        return !effect.get().hardOncePerTurn()
                || !state.hoptUsedEffects().contains(hoptKey(card.getId(), effect.get()));
    }

    public static Optional<EffectDefinition> effectAt(CardDefinition card, int effectIndex) {
        if (card == null || effectIndex < 0 || effectIndex >= card.getEffects().size()) {
            return Optional.empty();
        }
        return Optional.of(card.getEffects().get(effectIndex));
    }

    // ==================== TARGETS ====================

    /**
     * Cards an effect could select for {@code seat}. Face-down monsters are never candidates;
     * set spells and traps are.
     */
    public static List<String> candidates(GameState state, Seat seat, TargetFilter filter) {
        if (filter == null) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (Seat owner : owners(filter.owner(), seat)) {
            PlayerZones zones = state.player(owner);
            Zone zone = filter.effectiveZone();
            if (zone == Zone.BOARD) {
                collectField(state, zones, filter.cardType(), result);
            } else {
                List<String> pile = switch (zone) {
                    case HAND -> zones.hand();
                    case GRAVEYARD -> zones.graveyard();
                    case BANISHED -> zones.banished();
                    default -> List.of();
                };
                for (String cardId : pile) {
                    if (matchesType(state, cardId, filter.cardType())) {
                        result.add(cardId);
                    }
                }
            }
        }
        return result;
    }

    private static void collectField(GameState state, PlayerZones zones, CardType type, List<String> out) {
        if (type == null || type == CardType.MONSTER) {
            for (BoardCard card : zones.board()) {
                if (card.isFaceUp()) {
                    out.add(card.cardId());
                }
            }
        }
        if (type != CardType.MONSTER) {
            for (SpellTrapCard card : zones.spellTrapZone()) {
                if (matchesType(state, card.cardId(), type)) {
                    out.add(card.cardId());
                }
            }
            if (zones.fieldSpell() != null && matchesType(state, zones.fieldSpell().cardId(), type)) {
                out.add(zones.fieldSpell().cardId());
            }
        }
    }

    private static boolean matchesType(GameState state, String cardId, CardType type) {
        if (type == null) {
            return true;
        }
        CardDefinition definition = state.definitionOf(cardId);
        return definition != null && definition.getType() == type;
    }

    private static List<Seat> owners(TargetFilter.Owner owner, Seat seat) {
        return switch (owner) {
            case SELF -> List.of(seat);
            case OPPONENT -> List.of(seat.opponent());
            case ANY -> List.of(Seat.HOST, Seat.AWAY);
        };
    }

    public static boolean hasValidTargets(GameState state, Seat seat, EffectDefinition effect) {
        int required = effect.requiredTargets();
        return required == 0 || candidates(state, seat, effect.targetFilter()).size() >= required;
    }

    /**
     * Every selected target must be a distinct candidate, and no more may be chosen than the effect takes.
     */
    public static boolean validateSelectedTargets(GameState state, Seat seat, EffectDefinition effect,
                                                  List<String> targets) {
        int required = effect.requiredTargets();
        Set<String> distinct = new LinkedHashSet<>(targets);
        if (distinct.size() != targets.size() || targets.size() > required) {
            return false;
        }
        return candidates(state, seat, effect.targetFilter()).containsAll(targets);
    }

    /**
     * Targets to record on the chain link. An effect that needs targets but was given none
     * takes the first candidates in board order.
     *
     * @return the targets, or empty when the selection is illegal
     */
    public static Optional<List<String>> activationTargets(GameState state, Seat seat, EffectDefinition effect,
                                                           List<String> selected) {
        int required = effect.requiredTargets();
        if (required == 0) {
            for (String target : selected) {
                if (state.ownerOf(target).isEmpty()) {
                    return Optional.empty();
                }
            }
            return Optional.of(List.copyOf(selected));
        }
        if (selected.isEmpty()) {
            List<String> candidates = candidates(state, seat, effect.targetFilter());
            if (candidates.size() < required) {
                return Optional.empty();
            }
            return Optional.of(List.copyOf(candidates.subList(0, required)));
        }
        if (!validateSelectedTargets(state, seat, effect, selected)) {
            return Optional.empty();
        }
        return Optional.of(List.copyOf(selected));
    }

    // ==================== SUMMON TRIGGERS ====================

    /**
     * On-summon effects of monsters summoned in {@code batch}, resolved on the spot.
     */
    public static List<Event> detectSummonTriggers(GameState state, List<Event> batch) {
        List<Event> events = new ArrayList<>();
        GameState current = state;
        for (Event event : batch) {
            String cardId;
            Seat seat;
            if (event instanceof Event.MonsterSummoned summoned) {
                cardId = summoned.cardId();
                seat = summoned.seat();
            } else if (event instanceof Event.SpecialSummoned summoned) {
                cardId = summoned.cardId();
                seat = summoned.seat();
            } else {
                continue;
            }
            List<Event> triggered = onSummon(current, seat, cardId);
            if (!triggered.isEmpty()) {
                events.addAll(triggered);
                current = Evolver.fold(current, triggered);
            }
        }
        return events;
    }

    private static List<Event> onSummon(GameState state, Seat seat, String cardId) {
        CardDefinition card = state.definitionOf(cardId);
        if (card == null || state.boardOwner(cardId).isEmpty()
                || state.hasRestriction(seat, EffectAction.Restriction.DISABLE_EFFECTS)) {
            return List.of();
        }
        List<Event> events = new ArrayList<>();
        GameState current = state;
        for (int i = 0; i < card.getEffects().size(); i++) {
            EffectDefinition effect = card.getEffects().get(i);
            if (effect.type() != EffectType.ON_SUMMON || !isUsageAvailable(current, cardId, i)) {
                continue;
            }
            Optional<List<String>> targets = activationTargets(current, seat, effect, List.of());
            if (targets.isEmpty()) {
                continue;
            }
            List<Event> resolved = new ArrayList<>();
            resolved.add(new Event.EffectActivated(seat, cardId, i));
            GameState activated = Evolver.fold(current, resolved);
            resolved.addAll(EffectInterpreter.executeEffect(activated, card, i, seat, cardId, targets.get(),
                    Evolver::fold));
            events.addAll(resolved);
            current = Evolver.fold(current, resolved);
        }
        return events;
    }
}
