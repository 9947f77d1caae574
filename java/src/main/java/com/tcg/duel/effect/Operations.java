package com.tcg.duel.effect;

import com.tcg.duel.card.Amount;
import com.tcg.duel.card.CardDefinition;
import com.tcg.duel.card.Duration;
import com.tcg.duel.card.EffectAction;
import com.tcg.duel.card.Recipient;
import com.tcg.duel.card.Zone;
import com.tcg.duel.game.ChainLink;
import com.tcg.duel.game.DestroyReason;
import com.tcg.duel.game.Event;
import com.tcg.duel.game.GameState;
import com.tcg.duel.game.ModifierExpiry;
import com.tcg.duel.game.Position;
import com.tcg.duel.game.Seat;
import com.tcg.duel.game.Stat;
import com.tcg.duel.game.zones.BoardCard;
import com.tcg.duel.game.zones.PlayerZones;
import com.tcg.duel.game.zones.SpellTrapCard;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Executes single effect actions. Every method is pure: it reads the state and returns the
 * events the action produces, in order. Unknown or out-of-place targets are skipped.
 */
public final class Operations {

    private Operations() {
        // Utility class - prevent instantiation
    }

    /**
     * Run one action.
     *
     * @param state           state the action observes
     * @param action          the action
     * @param seat            activating player
     * @param sourceCardId    card whose effect this is
     * @param explicitTargets targets chosen at activation, possibly empty
     */
    public static List<Event> executeAction(GameState state, EffectAction action, Seat seat,
                                            String sourceCardId, List<String> explicitTargets) {
        List<String> targets = resolveTargets(state, action, seat, sourceCardId, explicitTargets);
        return switch (action.kind()) {
            case BOOST_ATTACK -> {
                EffectAction.BoostAttack boost = (EffectAction.BoostAttack) action;
                yield boost(state, targets, Stat.ATTACK, resolveAmount(state, boost.amount(), seat),
                        boost.duration(), sourceCardId);
            }
            case BOOST_DEFENSE -> {
                EffectAction.BoostDefense boost = (EffectAction.BoostDefense) action;
                yield boost(state, targets, Stat.DEFENSE, resolveAmount(state, boost.amount(), seat),
                        boost.duration(), sourceCardId);
            }
            case DAMAGE -> damage(state, (EffectAction.Damage) action, seat);
            case HEAL -> heal(state, (EffectAction.Heal) action, seat);
            case DRAW -> draw(state, seat, ((EffectAction.Draw) action).count());
            case DISCARD -> discard(state, (EffectAction.Discard) action, seat);
            case DESTROY -> destroy(state, (EffectAction.Destroy) action, seat, targets);
            case NEGATE -> negate(state, sourceCardId);
            case RETURN_TO_HAND -> moveOut(state, targets, false);
            case BANISH -> moveOut(state, targets, true);
            case SPECIAL_SUMMON -> specialSummon(state, (EffectAction.SpecialSummon) action, seat, targets);
            case CHANGE_POSITION -> changePosition(state, targets);
            case ADD_VICE -> adjustVice(state, targets, ((EffectAction.AddVice) action).count());
            case REMOVE_VICE -> adjustVice(state, targets, -((EffectAction.RemoveVice) action).count());
            case APPLY_RESTRICTION -> applyRestriction((EffectAction.ApplyRestriction) action, seat, sourceCardId);
            case MODIFY_COST -> modifyCost((EffectAction.ModifyCost) action, seat, sourceCardId);
            case VIEW_TOP_CARDS -> viewTopCards(state, seat, ((EffectAction.ViewTopCards) action).count(),
                    sourceCardId);
            case REARRANGE_TOP_CARDS -> rearrangeTopCards(state, (EffectAction.RearrangeTopCards) action, seat);
        };
    }

    // ==================== TARGETS & AMOUNTS ====================

    /**
     * Explicit targets win. Self-targeting actions then fall back to the source card if it is on a
     * board, and finally to every monster on the activating player's board.
     */
    static List<String> resolveTargets(GameState state, EffectAction action, Seat seat,
                                       String sourceCardId, List<String> explicitTargets) {
        if (explicitTargets != null && !explicitTargets.isEmpty()) {
            return List.copyOf(new LinkedHashSet<>(explicitTargets));
        }
        if (!action.selfTargeting()) {
            return List.of();
        }
        if (sourceCardId != null && state.boardOwner(sourceCardId).isPresent()) {
            return List.of(sourceCardId);
        }
        return state.player(seat).board().stream().map(BoardCard::cardId).toList();
    }

    /**
     * Value of an amount at execution time. Graveyard counts are relative to {@code seat}.
     */
    public static int resolveAmount(GameState state, Amount amount, Seat seat) {
        if (amount instanceof Amount.Literal literal) {
            return literal.value();
        }
        if (amount instanceof Amount.GraveyardCount count) {
            int own = state.player(seat).graveyard().size();
            int theirs = state.player(seat.opponent()).graveyard().size();
            return switch (count.scope()) {
                case SELF -> own;
                case OPPONENT -> theirs;
                case BOTH -> own + theirs;
            };
        }
        return 0;
    }

    private static List<Seat> recipients(Recipient recipient, Seat seat) {
        return switch (recipient) {
            case SELF -> List.of(seat);
            case OPPONENT -> List.of(seat.opponent());
            case BOTH -> List.of(seat, seat.opponent());
        };
    }

    // ==================== STATS & LIFE POINTS ====================

    private static List<Event> boost(GameState state, List<String> targets, Stat stat, int amount,
                                     Duration duration, String source) {
        ModifierExpiry expiry = duration == Duration.TURN ? ModifierExpiry.END_OF_TURN : ModifierExpiry.PERMANENT;
        List<Event> events = new ArrayList<>();
        for (String target : targets) {
            if (state.boardOwner(target).isPresent()) {
                events.add(new Event.ModifierApplied(target, stat, amount, source, expiry));
            }
        }
        return events;
    }

    private static List<Event> damage(GameState state, EffectAction.Damage action, Seat seat) {
        int amount = resolveAmount(state, action.amount(), seat);
        if (amount <= 0) {
            return List.of();
        }
        List<Event> events = new ArrayList<>();
        for (Seat target : recipients(action.target(), seat)) {
            events.add(new Event.DamageDealt(target, amount, false));
        }
        return events;
    }

    private static List<Event> heal(GameState state, EffectAction.Heal action, Seat seat) {
        int amount = resolveAmount(state, action.amount(), seat);
        if (amount <= 0) {
            return List.of();
        }
        List<Event> events = new ArrayList<>();
        for (Seat target : recipients(action.target(), seat)) {
            events.add(new Event.LifeGained(target, amount));
        }
        return events;
    }

    // ==================== HAND & DECK ====================

    private static List<Event> draw(GameState state, Seat seat, int count) {
        List<String> deck = state.player(seat).deck();
        int n = Math.min(Math.max(0, count), deck.size());
        List<Event> events = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            events.add(new Event.CardDrawn(seat, deck.get(i)));
        }
        return events;
    }

    private static List<Event> discard(GameState state, EffectAction.Discard action, Seat seat) {
        List<Event> events = new ArrayList<>();
        for (Seat target : recipients(action.target(), seat)) {
            List<String> hand = state.player(target).hand();
            int n = Math.min(Math.max(0, action.count()), hand.size());
            for (int i = 0; i < n; i++) {
                String cardId = hand.get(hand.size() - 1 - i);
                events.add(new Event.CardSentToGraveyard(cardId, Zone.HAND, target));
            }
        }
        return events;
    }

    private static List<Event> viewTopCards(GameState state, Seat seat, int count, String source) {
        List<String> deck = state.player(seat).deck();
        int n = Math.min(Math.max(0, count), deck.size());
        if (n == 0) {
            return List.of();
        }
        return List.of(new Event.TopCardsViewed(seat, deck.subList(0, n), source));
    }

    private static List<Event> rearrangeTopCards(GameState state, EffectAction.RearrangeTopCards action, Seat seat) {
        List<String> deck = state.player(seat).deck();
        int n = Math.min(Math.max(0, action.count()), deck.size());
        if (n < 2 || action.strategy() == EffectAction.RearrangeStrategy.KEEP) {
            return List.of();
        }
        List<String> reordered = new ArrayList<>(deck.subList(0, n));
        Collections.reverse(reordered);
        return List.of(new Event.TopCardsRearranged(seat, reordered));
    }

    // ==================== REMOVAL ====================

    private static List<Event> destroy(GameState state, EffectAction.Destroy action, Seat seat, List<String> targets) {
        List<Event> events = new ArrayList<>();
        switch (action.target()) {
            case ALL_OPPONENT_MONSTERS -> {
                Seat opponent = seat.opponent();
                for (BoardCard card : state.player(opponent).board()) {
                    destroyCard(events, card.cardId(), Zone.BOARD, opponent);
                }
            }
            case ALL_SPELLS_TRAPS -> {
                Seat opponent = seat.opponent();
                PlayerZones zones = state.player(opponent);
                for (SpellTrapCard card : zones.spellTrapZone()) {
                    destroyCard(events, card.cardId(), Zone.SPELL_TRAP_ZONE, opponent);
                }
                if (zones.fieldSpell() != null) {
                    destroyCard(events, zones.fieldSpell().cardId(), Zone.FIELD, opponent);
                }
            }
            case SELECTED -> {
                for (String target : targets) {
                    Optional<Seat> owner = state.ownerOf(target);
                    if (owner.isEmpty()) {
                        continue;
                    }
                    Optional<Zone> zone = state.player(owner.get()).locate(target);
                    if (zone.isPresent() && isOnField(zone.get())) {
                        destroyCard(events, target, zone.get(), owner.get());
                    }
                }
            }
        }
        return events;
    }

    private static void destroyCard(List<Event> events, String cardId, Zone from, Seat owner) {
        events.add(new Event.CardDestroyed(cardId, DestroyReason.EFFECT));
        events.add(new Event.CardSentToGraveyard(cardId, from, owner));
    }

    private static boolean isOnField(Zone zone) {
        return zone == Zone.BOARD || zone == Zone.SPELL_TRAP_ZONE || zone == Zone.FIELD;
    }

    /**
     * Returns targets to their owner's hand or banishes them. Cards in a deck are never touched.
     */
    private static List<Event> moveOut(GameState state, List<String> targets, boolean banish) {
        List<Event> events = new ArrayList<>();
        for (String target : targets) {
            Optional<Seat> owner = state.ownerOf(target);
            if (owner.isEmpty()) {
                continue;
            }
            Optional<Zone> zone = state.player(owner.get()).locate(target);
            if (zone.isEmpty() || zone.get() == Zone.DECK) {
                continue;
            }
            if (banish && zone.get() != Zone.BANISHED) {
                events.add(new Event.CardBanished(target, zone.get(), owner.get()));
            } else if (!banish && zone.get() != Zone.HAND) {
                events.add(new Event.CardReturnedToHand(target, zone.get(), owner.get()));
            }
        }
        return events;
    }

    // ==================== BOARD ====================

    private static List<Event> specialSummon(GameState state, EffectAction.SpecialSummon action, Seat seat,
                                             List<String> targets) {
        int free = state.config().maxBoardSlots() - state.player(seat).board().size();
        List<Event> events = new ArrayList<>();
        for (String target : targets) {
            if (free <= 0) {
                break;
            }
            CardDefinition definition = state.definitionOf(target);
            if (definition == null || !definition.isMonster()) {
                continue;
            }
            Optional<Seat> owner = state.ownerOf(target);
            if (owner.isEmpty()) {
                continue;
            }
            Optional<Zone> zone = state.player(owner.get()).locate(target);
            if (zone.isPresent() && zone.get() == action.from()) {
                events.add(new Event.SpecialSummoned(seat, target, action.from(), Position.ATTACK));
                free--;
            }
        }
        return events;
    }

    private static List<Event> changePosition(GameState state, List<String> targets) {
        List<Event> events = new ArrayList<>();
        for (String target : targets) {
            state.findBoardCard(target).ifPresent(card ->
                    events.add(new Event.PositionChanged(target, card.position(), card.position().flip())));
        }
        return events;
    }

    private static List<Event> adjustVice(GameState state, List<String> targets, int delta) {
        List<Event> events = new ArrayList<>();
        for (String target : targets) {
            Optional<BoardCard> card = state.findBoardCard(target);
            if (card.isEmpty()) {
                continue;
            }
            int newCount = Math.max(0, card.get().viceCounters() + delta);
            if (delta >= 0) {
                events.add(new Event.ViceCounterAdded(target, newCount));
            } else {
                events.add(new Event.ViceCounterRemoved(target, newCount));
            }
        }
        return events;
    }

    // ==================== CHAIN ====================

    /**
     * Marks the nearest link below the resolving one that is not already negated. The source's own
     * link is never a candidate. Outside a chain, or with nothing left to hit, nothing happens.
     */
    private static List<Event> negate(GameState state, String sourceCardId) {
        List<ChainLink> chain = state.currentChain();
        for (int i = chain.size() - 1; i >= 0; i--) {
            if (state.negatedLinks().contains(i) || chain.get(i).cardId().equals(sourceCardId)) {
                continue;
            }
            return List.of(new Event.ChainLinkNegated(i, sourceCardId));
        }
        return List.of();
    }

    // ==================== TURN-SCOPED RULES ====================

    private static List<Event> applyRestriction(EffectAction.ApplyRestriction action, Seat seat, String source) {
        List<Event> events = new ArrayList<>();
        for (Seat target : recipients(action.target(), seat)) {
            events.add(new Event.TurnRestrictionApplied(target, action.restriction(), source,
                    Math.max(1, action.durationTurns())));
        }
        return events;
    }

    private static List<Event> modifyCost(EffectAction.ModifyCost action, Seat seat, String source) {
        List<Event> events = new ArrayList<>();
        for (Seat target : recipients(action.target(), seat)) {
            events.add(new Event.CostModifierApplied(target, action.cardType(), action.operation(),
                    action.amount(), source, Math.max(1, action.durationTurns())));
        }
        return events;
    }
}
