package com.tcg.duel.engine;

import com.tcg.duel.card.CardDefinition;
import com.tcg.duel.card.EffectDefinition;
import com.tcg.duel.card.Zone;
import com.tcg.duel.game.ChainLink;
import com.tcg.duel.game.CostModifier;
import com.tcg.duel.game.Event;
import com.tcg.duel.game.GameState;
import com.tcg.duel.game.Phase;
import com.tcg.duel.game.Position;
import com.tcg.duel.game.Seat;
import com.tcg.duel.game.TemporaryModifier;
import com.tcg.duel.game.TopDeckView;
import com.tcg.duel.game.TurnRestriction;
import com.tcg.duel.game.zones.BoardCard;
import com.tcg.duel.game.zones.PlayerZones;
import com.tcg.duel.game.zones.SpellTrapCard;
import com.tcg.duel.rules.ContinuousEffects;
import com.tcg.duel.rules.EffectRules;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Folds events into state. Folding is total and pure: events that refer to missing cards
 * leave the state unchanged, and follow-up rules never run here.
 */
public final class Evolver {

    private Evolver() {
        // Utility class - prevent instantiation
    }

    public static GameState fold(GameState state, List<Event> events) {
        GameState current = state;
        for (Event event : events) {
            current = apply(current, event);
        }
        return current;
    }

    public static GameState apply(GameState s, Event event) {
        return switch (event.kind()) {
            case GAME_ENDED -> {
                Event.GameEnded e = (Event.GameEnded) event;
                yield s.toBuilder().gameOver(e.winner(), e.reason()).build();
            }
            case TURN_STARTED -> startTurn(s, (Event.TurnStarted) event);
            case TURN_ENDED -> {
                Seat seat = ((Event.TurnEnded) event).seat();
                yield s.withPlayer(seat, s.player(seat).mapBoard(c -> c.withTurnFlags(c.canAttack(), false, false)));
            }
            case PHASE_CHANGED -> s.toBuilder().currentPhase(((Event.PhaseChanged) event).to()).build();
            case CARD_DRAWN -> {
                Event.CardDrawn e = (Event.CardDrawn) event;
                PlayerZones zones = s.player(e.seat());
                if (!zones.deck().contains(e.cardId())) {
                    yield s;
                }
                yield s.withPlayer(e.seat(), zones.remove(e.cardId()).addToHand(e.cardId()));
            }
            case DECK_OUT, BATTLE_RESOLVED, CARD_DESTROYED, EQUIP_DESTROYED -> s;
            case MONSTER_SUMMONED -> {
                Event.MonsterSummoned e = (Event.MonsterSummoned) event;
                yield placeFromHand(s, e.seat(), e.cardId(), e.position(), false);
            }
            case MONSTER_SET -> {
                Event.MonsterSet e = (Event.MonsterSet) event;
                yield placeFromHand(s, e.seat(), e.cardId(), Position.DEFENSE, true);
            }
            case FLIP_SUMMONED -> {
                Event.FlipSummoned e = (Event.FlipSummoned) event;
                yield mapBoardCard(s, e.cardId(), c -> c.withPosition(Position.ATTACK, false)
                        .withChangedPosition(Position.ATTACK));
            }
            case SPECIAL_SUMMONED -> specialSummon(s, (Event.SpecialSummoned) event);
            case SPELL_TRAP_SET -> {
                Event.SpellTrapSet e = (Event.SpellTrapSet) event;
                PlayerZones zones = s.player(e.seat());
                if (!zones.hand().contains(e.cardId())) {
                    yield s;
                }
                String definitionId = s.instances().get(e.cardId());
                yield s.withPlayer(e.seat(), zones.remove(e.cardId())
                        .addToSpellTrapZone(SpellTrapCard.set(e.cardId(), definitionId)));
            }
            case SPELL_ACTIVATED -> {
                Event.SpellActivated e = (Event.SpellActivated) event;
                yield activateSpellTrap(s, e.seat(), e.cardId());
            }
            case TRAP_ACTIVATED -> {
                Event.TrapActivated e = (Event.TrapActivated) event;
                yield activateSpellTrap(s, e.seat(), e.cardId());
            }
            case SPELL_EQUIPPED -> {
                Event.SpellEquipped e = (Event.SpellEquipped) event;
                yield mapBoardCard(s, e.targetCardId(), c -> c.withEquipped(e.cardId()));
            }
            case EFFECT_ACTIVATED -> recordUsage(s, (Event.EffectActivated) event);
            case ATTACK_DECLARED -> mapBoardCard(s, ((Event.AttackDeclared) event).attackerId(), BoardCard::withAttacked);
            case DAMAGE_DEALT -> {
                Event.DamageDealt e = (Event.DamageDealt) event;
                PlayerZones zones = s.player(e.seat());
                yield s.withPlayer(e.seat(), zones.withLifePoints(Math.max(0, zones.lifePoints() - e.amount())));
            }
            case LIFE_GAINED -> {
                Event.LifeGained e = (Event.LifeGained) event;
                PlayerZones zones = s.player(e.seat());
                yield s.withPlayer(e.seat(), zones.withLifePoints(zones.lifePoints() + e.amount()));
            }
            case CARD_SENT_TO_GRAVEYARD -> {
                Event.CardSentToGraveyard e = (Event.CardSentToGraveyard) event;
                yield move(s, e.cardId(), e.seat(), Zone.GRAVEYARD);
            }
            case CARD_BANISHED -> {
                Event.CardBanished e = (Event.CardBanished) event;
                yield move(s, e.cardId(), e.seat(), Zone.BANISHED);
            }
            case CARD_RETURNED_TO_HAND -> {
                Event.CardReturnedToHand e = (Event.CardReturnedToHand) event;
                yield move(s, e.cardId(), e.seat(), Zone.HAND);
            }
            case VICE_COUNTER_ADDED -> {
                Event.ViceCounterAdded e = (Event.ViceCounterAdded) event;
                yield mapBoardCard(s, e.cardId(), c -> c.withViceCounters(e.newCount()));
            }
            case VICE_COUNTER_REMOVED -> {
                Event.ViceCounterRemoved e = (Event.ViceCounterRemoved) event;
                yield mapBoardCard(s, e.cardId(), c -> c.withViceCounters(e.newCount()));
            }
            case BREAKDOWN_TRIGGERED -> {
                Seat credited = ((Event.BreakdownTriggered) event).seat().opponent();
                PlayerZones zones = s.player(credited);
                yield s.withPlayer(credited, zones.withBreakdownsCaused(zones.breakdownsCaused() + 1));
            }
            case POSITION_CHANGED -> {
                Event.PositionChanged e = (Event.PositionChanged) event;
                yield mapBoardCard(s, e.cardId(), c -> c.withChangedPosition(e.to()));
            }
            case MODIFIER_APPLIED -> applyModifier(s, (Event.ModifierApplied) event);
            case MODIFIER_EXPIRED -> expireModifier(s, (Event.ModifierExpired) event);
            case CHAIN_STARTED -> s.toBuilder().currentChain(List.of()).negatedLinks(Set.of()).build();
            case CHAIN_LINK_ADDED -> {
                Event.ChainLinkAdded e = (Event.ChainLinkAdded) event;
                List<ChainLink> chain = new ArrayList<>(s.currentChain());
                chain.add(new ChainLink(e.cardId(), s.instances().get(e.cardId()), e.effectIndex(), e.seat(),
                        e.targets()));
                yield s.toBuilder()
                        .currentChain(chain)
                        .currentPriorityPlayer(e.seat().opponent())
                        .currentChainPasser(null)
                        .build();
            }
            case CHAIN_PASSED -> {
                Seat seat = ((Event.ChainPassed) event).seat();
                yield s.toBuilder().currentChainPasser(seat).currentPriorityPlayer(seat.opponent()).build();
            }
            case CHAIN_LINK_RESOLVED -> popLink(s);
            case CHAIN_LINK_NEGATED -> {
                Set<Integer> negated = new HashSet<>(s.negatedLinks());
                negated.add(((Event.ChainLinkNegated) event).linkIndex());
                yield s.toBuilder().negatedLinks(negated).build();
            }
            case CHAIN_RESOLVED -> s.toBuilder()
                    .currentChain(List.of())
                    .negatedLinks(Set.of())
                    .currentPriorityPlayer(null)
                    .currentChainPasser(null)
                    .build();
            case COST_MODIFIER_APPLIED -> {
                Event.CostModifierApplied e = (Event.CostModifierApplied) event;
                List<CostModifier> modifiers = new ArrayList<>(s.costModifiers());
                modifiers.add(new CostModifier(e.seat(), e.cardType(), e.operation(), e.amount(), e.source(),
                        s.turnNumber() + Math.max(1, e.durationTurns())));
                yield s.toBuilder().costModifiers(modifiers).build();
            }
            case TURN_RESTRICTION_APPLIED -> {
                Event.TurnRestrictionApplied e = (Event.TurnRestrictionApplied) event;
                List<TurnRestriction> restrictions = new ArrayList<>(s.turnRestrictions());
                restrictions.add(new TurnRestriction(e.seat(), e.restriction(), e.source(),
                        s.turnNumber() + Math.max(1, e.durationTurns())));
                yield s.toBuilder().turnRestrictions(restrictions).build();
            }
            case TOP_CARDS_VIEWED -> {
                Event.TopCardsViewed e = (Event.TopCardsViewed) event;
                List<TopDeckView> views = new ArrayList<>(s.topDeckViews());
                views.removeIf(v -> v.seat() == e.seat());
                views.add(new TopDeckView(e.seat(), e.cardIds(), e.source(), s.turnNumber()));
                yield s.toBuilder().topDeckViews(views).build();
            }
            case TOP_CARDS_REARRANGED -> {
                Event.TopCardsRearranged e = (Event.TopCardsRearranged) event;
                PlayerZones zones = s.player(e.seat());
                int n = e.cardIds().size();
                if (n > zones.deck().size()) {
                    yield s;
                }
                List<String> deck = new ArrayList<>(e.cardIds());
                deck.addAll(zones.deck().subList(n, zones.deck().size()));
                yield s.withPlayer(e.seat(), zones.withDeck(deck));
            }
        };
    }

    // ==================== TURN STRUCTURE ====================

    /**
     * New turn: both normal summons and all usage trackers reset, the new turn player's monsters
     * may attack again, and expired restrictions, cost modifiers and top-deck views are dropped.
     */
    private static GameState startTurn(GameState s, Event.TurnStarted e) {
        int turn = e.turnNumber();
        GameState.Builder builder = s.toBuilder()
                .currentTurnPlayer(e.seat())
                .turnNumber(turn)
                .currentPhase(Phase.DRAW)
                .optUsedThisTurn(Set.of())
                .hoptUsedEffects(Set.of())
                .turnRestrictions(s.turnRestrictions().stream().filter(r -> r.expiresOnTurn() > turn).toList())
                .costModifiers(s.costModifiers().stream().filter(m -> m.expiresOnTurn() > turn).toList())
                .topDeckViews(List.of());
        for (Seat seat : Seat.values()) {
            PlayerZones zones = s.player(seat).withNormalSummoned(false);
            if (seat == e.seat()) {
                zones = zones.mapBoard(c -> c.withTurnFlags(true, false, false));
            }
            builder.player(seat, zones);
        }
        return builder.build();
    }

    // ==================== CARD MOVEMENT ====================

    private static GameState placeFromHand(GameState s, Seat seat, String cardId, Position position, boolean faceDown) {
        PlayerZones zones = s.player(seat);
        if (!zones.hand().contains(cardId)) {
            return s;
        }
        BoardCard card = BoardCard.summoned(cardId, s.instances().get(cardId), position, faceDown, s.turnNumber());
        return s.withPlayer(seat, zones.remove(cardId).addToBoard(card).withNormalSummoned(true));
    }

    private static GameState specialSummon(GameState s, Event.SpecialSummoned e) {
        Optional<Seat> owner = s.ownerOf(e.cardId());
        if (owner.isEmpty()) {
            return s;
        }
        GameState removed = s.withPlayer(owner.get(), s.player(owner.get()).remove(e.cardId()));
        BoardCard card = BoardCard.summoned(e.cardId(), s.instances().get(e.cardId()), e.position(), false,
                s.turnNumber());
        return removed.withPlayer(e.seat(), removed.player(e.seat()).addToBoard(card));
    }

    private static GameState activateSpellTrap(GameState s, Seat seat, String cardId) {
        PlayerZones zones = s.player(seat);
        if (zones.hand().contains(cardId)) {
            CardDefinition definition = s.definitionOf(cardId);
            boolean field = definition != null && definition.isFieldSpell();
            SpellTrapCard placed = SpellTrapCard.activated(cardId, s.instances().get(cardId), field);
            PlayerZones without = zones.remove(cardId);
            return s.withPlayer(seat, field ? without.withFieldSpell(placed) : without.addToSpellTrapZone(placed));
        }
        List<SpellTrapCard> zone = new ArrayList<>(zones.spellTrapZone().size());
        boolean found = false;
        for (SpellTrapCard card : zones.spellTrapZone()) {
            if (card.cardId().equals(cardId)) {
                zone.add(card.flipUp());
                found = true;
            } else {
                zone.add(card);
            }
        }
        return found ? s.withPlayer(seat, zones.withSpellTrapZone(zone)) : s;
    }

    /**
     * Moves a card owned by {@code owner} to a public zone. A card leaving the board takes its
     * modifiers with it; an equip, field or continuous card leaving the field takes back the
     * boosts it granted.
     */
    private static GameState move(GameState s, String cardId, Seat owner, Zone destination) {
        Optional<Seat> holder = s.player(owner).locate(cardId).isPresent() ? Optional.of(owner) : s.ownerOf(cardId);
        if (holder.isEmpty()) {
            return s;
        }
        GameState cleared = leaveField(s, cardId);
        PlayerZones zones = cleared.player(holder.get()).remove(cardId);
        cleared = cleared.withPlayer(holder.get(), zones);
        PlayerZones target = cleared.player(owner);
        PlayerZones moved = switch (destination) {
            case GRAVEYARD -> target.addToGraveyard(cardId);
            case BANISHED -> target.addToBanished(cardId);
            case HAND -> target.addToHand(cardId);
            default -> target;
        };
        return cleared.withPlayer(owner, moved);
    }

    private static GameState leaveField(GameState s, String cardId) {
        List<TemporaryModifier> kept = new ArrayList<>();
        GameState current = s;
        for (TemporaryModifier modifier : s.temporaryModifiers()) {
            if (modifier.cardId().equals(cardId)) {
                continue;
            }
            if (cardId.equals(modifier.source()) && ContinuousEffects.lingers(s.definitionOf(cardId))) {
                current = mapBoardCard(current, modifier.cardId(), c -> c.withBoost(modifier.stat(), -modifier.amount()));
                continue;
            }
            kept.add(modifier);
        }
        GameState.Builder builder = current.toBuilder().temporaryModifiers(kept);
        for (Seat seat : Seat.values()) {
            PlayerZones zones = current.player(seat);
            boolean equipped = zones.board().stream().anyMatch(c -> c.equippedCards().contains(cardId));
            if (equipped) {
                builder.player(seat, zones.mapBoard(c -> c.withoutEquipped(cardId)));
            }
        }
        return builder.build();
    }

    // ==================== MODIFIERS ====================

    private static GameState applyModifier(GameState s, Event.ModifierApplied e) {
        if (s.boardOwner(e.cardId()).isEmpty()) {
            return s;
        }
        List<TemporaryModifier> modifiers = new ArrayList<>(s.temporaryModifiers());
        modifiers.add(new TemporaryModifier(e.cardId(), e.stat(), e.amount(), e.source(),
                e.expiry().expiresOnTurn(s.turnNumber())));
        return mapBoardCard(s, e.cardId(), c -> c.withBoost(e.stat(), e.amount()))
                .toBuilder().temporaryModifiers(modifiers).build();
    }

    private static GameState expireModifier(GameState s, Event.ModifierExpired e) {
        List<TemporaryModifier> modifiers = new ArrayList<>(s.temporaryModifiers());
        int index = -1;
        for (int i = 0; i < modifiers.size(); i++) {
            TemporaryModifier m = modifiers.get(i);
            if (m.cardId().equals(e.cardId()) && m.stat() == e.stat() && m.amount() == e.amount()
                    && Objects.equals(m.source(), e.source())) {
                index = i;
                break;
            }
        }
        if (index < 0) {
            return s;
        }
        modifiers.remove(index);
        return mapBoardCard(s, e.cardId(), c -> c.withBoost(e.stat(), -e.amount()))
                .toBuilder().temporaryModifiers(modifiers).build();
    }

    // ==================== CHAIN & USAGE ====================

    private static GameState popLink(GameState s) {
        if (s.currentChain().isEmpty()) {
            return s;
        }
        List<ChainLink> chain = new ArrayList<>(s.currentChain());
        int index = chain.size() - 1;
        chain.remove(index);
        Set<Integer> negated = new HashSet<>(s.negatedLinks());
        negated.remove(index);
        Seat priority = chain.isEmpty() ? null : chain.get(chain.size() - 1).activatingPlayer().opponent();
        return s.toBuilder()
                .currentChain(chain)
                .negatedLinks(negated)
                .currentPriorityPlayer(priority)
                .currentChainPasser(null)
                .build();
    }

    private static GameState recordUsage(GameState s, Event.EffectActivated e) {
        CardDefinition card = s.definitionOf(e.cardId());
        Optional<EffectDefinition> effect = EffectRules.effectAt(card, e.effectIndex());
        if (effect.isEmpty()) {
            return s;
        }
        GameState.Builder builder = s.toBuilder();
        if (effect.get().oncePerTurn()) {
            Set<String> used = new HashSet<>(s.optUsedThisTurn());
            used.add(EffectRules.optKey(e.cardId(), e.effectIndex()));
            builder.optUsedThisTurn(used);
        }
        if (effect.get().hardOncePerTurn()) {
            Set<String> used = new HashSet<>(s.hoptUsedEffects());
            used.add(EffectRules.hoptKey(card.getId(), effect.get()));
            builder.hoptUsedEffects(used);
        }
        return builder.build();
    }

    private static GameState mapBoardCard(GameState s, String cardId,
                                          UnaryOperator<BoardCard> fn) {
        Optional<Seat> owner = s.boardOwner(cardId);
        if (owner.isEmpty()) {
            return s;
        }
        return s.withPlayer(owner.get(), s.player(owner.get()).mapBoardCard(cardId, fn));
    }
}
