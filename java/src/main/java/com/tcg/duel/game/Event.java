package com.tcg.duel.game;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.tcg.duel.card.EffectAction;
import com.tcg.duel.card.Zone;

import java.util.List;

/**
 * Immutable facts emitted by the engine. Folding them in order over a state yields the next state.
 * Uses Jackson polymorphic deserialization based on the "type" field.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.PROPERTY,
    property = "type"
)
@JsonSubTypes({
    @JsonSubTypes.Type(value = Event.GameEnded.class, name = "GAME_ENDED"),
    @JsonSubTypes.Type(value = Event.TurnStarted.class, name = "TURN_STARTED"),
    @JsonSubTypes.Type(value = Event.TurnEnded.class, name = "TURN_ENDED"),
    @JsonSubTypes.Type(value = Event.PhaseChanged.class, name = "PHASE_CHANGED"),
    @JsonSubTypes.Type(value = Event.CardDrawn.class, name = "CARD_DRAWN"),
    @JsonSubTypes.Type(value = Event.DeckOut.class, name = "DECK_OUT"),
    @JsonSubTypes.Type(value = Event.MonsterSummoned.class, name = "MONSTER_SUMMONED"),
    @JsonSubTypes.Type(value = Event.MonsterSet.class, name = "MONSTER_SET"),
    @JsonSubTypes.Type(value = Event.FlipSummoned.class, name = "FLIP_SUMMONED"),
    @JsonSubTypes.Type(value = Event.SpecialSummoned.class, name = "SPECIAL_SUMMONED"),
    @JsonSubTypes.Type(value = Event.SpellTrapSet.class, name = "SPELL_TRAP_SET"),
    @JsonSubTypes.Type(value = Event.SpellActivated.class, name = "SPELL_ACTIVATED"),
    @JsonSubTypes.Type(value = Event.TrapActivated.class, name = "TRAP_ACTIVATED"),
    @JsonSubTypes.Type(value = Event.SpellEquipped.class, name = "SPELL_EQUIPPED"),
    @JsonSubTypes.Type(value = Event.EquipDestroyed.class, name = "EQUIP_DESTROYED"),
    @JsonSubTypes.Type(value = Event.EffectActivated.class, name = "EFFECT_ACTIVATED"),
    @JsonSubTypes.Type(value = Event.AttackDeclared.class, name = "ATTACK_DECLARED"),
    @JsonSubTypes.Type(value = Event.DamageDealt.class, name = "DAMAGE_DEALT"),
    @JsonSubTypes.Type(value = Event.LifeGained.class, name = "LIFE_GAINED"),
    @JsonSubTypes.Type(value = Event.BattleResolved.class, name = "BATTLE_RESOLVED"),
    @JsonSubTypes.Type(value = Event.CardDestroyed.class, name = "CARD_DESTROYED"),
    @JsonSubTypes.Type(value = Event.CardSentToGraveyard.class, name = "CARD_SENT_TO_GRAVEYARD"),
    @JsonSubTypes.Type(value = Event.CardBanished.class, name = "CARD_BANISHED"),
    @JsonSubTypes.Type(value = Event.CardReturnedToHand.class, name = "CARD_RETURNED_TO_HAND"),
    @JsonSubTypes.Type(value = Event.ViceCounterAdded.class, name = "VICE_COUNTER_ADDED"),
    @JsonSubTypes.Type(value = Event.ViceCounterRemoved.class, name = "VICE_COUNTER_REMOVED"),
    @JsonSubTypes.Type(value = Event.BreakdownTriggered.class, name = "BREAKDOWN_TRIGGERED"),
    @JsonSubTypes.Type(value = Event.PositionChanged.class, name = "POSITION_CHANGED"),
    @JsonSubTypes.Type(value = Event.ModifierApplied.class, name = "MODIFIER_APPLIED"),
    @JsonSubTypes.Type(value = Event.ModifierExpired.class, name = "MODIFIER_EXPIRED"),
    @JsonSubTypes.Type(value = Event.ChainStarted.class, name = "CHAIN_STARTED"),
    @JsonSubTypes.Type(value = Event.ChainLinkAdded.class, name = "CHAIN_LINK_ADDED"),
    @JsonSubTypes.Type(value = Event.ChainPassed.class, name = "CHAIN_PASSED"),
    @JsonSubTypes.Type(value = Event.ChainLinkResolved.class, name = "CHAIN_LINK_RESOLVED"),
    @JsonSubTypes.Type(value = Event.ChainLinkNegated.class, name = "CHAIN_LINK_NEGATED"),
    @JsonSubTypes.Type(value = Event.ChainResolved.class, name = "CHAIN_RESOLVED"),
    @JsonSubTypes.Type(value = Event.CostModifierApplied.class, name = "COST_MODIFIER_APPLIED"),
    @JsonSubTypes.Type(value = Event.TurnRestrictionApplied.class, name = "TURN_RESTRICTION_APPLIED"),
    @JsonSubTypes.Type(value = Event.TopCardsViewed.class, name = "TOP_CARDS_VIEWED"),
    @JsonSubTypes.Type(value = Event.TopCardsRearranged.class, name = "TOP_CARDS_REARRANGED")
})
public sealed interface Event permits
        Event.GameEnded, Event.TurnStarted, Event.TurnEnded, Event.PhaseChanged, Event.CardDrawn,
        Event.DeckOut, Event.MonsterSummoned, Event.MonsterSet, Event.FlipSummoned, Event.SpecialSummoned,
        Event.SpellTrapSet, Event.SpellActivated, Event.TrapActivated, Event.SpellEquipped,
        Event.EquipDestroyed, Event.EffectActivated, Event.AttackDeclared, Event.DamageDealt,
        Event.LifeGained, Event.BattleResolved, Event.CardDestroyed, Event.CardSentToGraveyard,
        Event.CardBanished, Event.CardReturnedToHand, Event.ViceCounterAdded, Event.ViceCounterRemoved,
        Event.BreakdownTriggered, Event.PositionChanged, Event.ModifierApplied, Event.ModifierExpired,
        Event.ChainStarted, Event.ChainLinkAdded, Event.ChainPassed, Event.ChainLinkResolved,
        Event.ChainLinkNegated, Event.ChainResolved, Event.CostModifierApplied, Event.TurnRestrictionApplied,
        Event.TopCardsViewed, Event.TopCardsRearranged {

    Kind kind();

    enum Kind {
        GAME_ENDED, TURN_STARTED, TURN_ENDED, PHASE_CHANGED, CARD_DRAWN, DECK_OUT, MONSTER_SUMMONED,
        MONSTER_SET, FLIP_SUMMONED, SPECIAL_SUMMONED, SPELL_TRAP_SET, SPELL_ACTIVATED, TRAP_ACTIVATED,
        SPELL_EQUIPPED, EQUIP_DESTROYED, EFFECT_ACTIVATED, ATTACK_DECLARED, DAMAGE_DEALT, LIFE_GAINED,
        BATTLE_RESOLVED, CARD_DESTROYED, CARD_SENT_TO_GRAVEYARD, CARD_BANISHED, CARD_RETURNED_TO_HAND,
        VICE_COUNTER_ADDED, VICE_COUNTER_REMOVED, BREAKDOWN_TRIGGERED, POSITION_CHANGED, MODIFIER_APPLIED,
        MODIFIER_EXPIRED, CHAIN_STARTED, CHAIN_LINK_ADDED, CHAIN_PASSED, CHAIN_LINK_RESOLVED,
        CHAIN_LINK_NEGATED, CHAIN_RESOLVED, COST_MODIFIER_APPLIED, TURN_RESTRICTION_APPLIED, TOP_CARDS_VIEWED,
        TOP_CARDS_REARRANGED
    }

    record GameEnded(
        @JsonProperty("winner") Seat winner,
        @JsonProperty("reason") WinReason reason
    ) implements Event {
        @Override
        public Kind kind() {
            return Kind.GAME_ENDED;
        }
    }

    record TurnStarted(
        @JsonProperty("seat") Seat seat,
        @JsonProperty("turn_number") int turnNumber
    ) implements Event {
        @Override
        public Kind kind() {
            return Kind.TURN_STARTED;
        }
    }

    record TurnEnded(@JsonProperty("seat") Seat seat) implements Event {
        @Override
        public Kind kind() {
            return Kind.TURN_ENDED;
        }
    }

    record PhaseChanged(
        @JsonProperty("from") Phase from,
        @JsonProperty("to") Phase to
    ) implements Event {
        @Override
        public Kind kind() {
            return Kind.PHASE_CHANGED;
        }
    }

    record CardDrawn(
        @JsonProperty("seat") Seat seat,
        @JsonProperty("card_id") String cardId
    ) implements Event {
        @Override
        public Kind kind() {
            return Kind.CARD_DRAWN;
        }
    }

    /**
     * The seat had to draw from an empty deck and loses.
     */
    record DeckOut(@JsonProperty("seat") Seat seat) implements Event {
        @Override
        public Kind kind() {
            return Kind.DECK_OUT;
        }
    }

    record MonsterSummoned(
        @JsonProperty("seat") Seat seat,
        @JsonProperty("card_id") String cardId,
        @JsonProperty("position") Position position,
        @JsonProperty("tributes") List<String> tributes
    ) implements Event {
        public MonsterSummoned {
            tributes = tributes != null ? List.copyOf(tributes) : List.of();
        }

        @Override
        public Kind kind() {
            return Kind.MONSTER_SUMMONED;
        }
    }

    record MonsterSet(
        @JsonProperty("seat") Seat seat,
        @JsonProperty("card_id") String cardId
    ) implements Event {
        @Override
        public Kind kind() {
            return Kind.MONSTER_SET;
        }
    }

    record FlipSummoned(
        @JsonProperty("seat") Seat seat,
        @JsonProperty("card_id") String cardId
    ) implements Event {
        @Override
        public Kind kind() {
            return Kind.FLIP_SUMMONED;
        }
    }

    record SpecialSummoned(
        @JsonProperty("seat") Seat seat,
        @JsonProperty("card_id") String cardId,
        @JsonProperty("from") Zone from,
        @JsonProperty("position") Position position
    ) implements Event {
        @Override
        public Kind kind() {
            return Kind.SPECIAL_SUMMONED;
        }
    }

    record SpellTrapSet(
        @JsonProperty("seat") Seat seat,
        @JsonProperty("card_id") String cardId
    ) implements Event {
        @Override
        public Kind kind() {
            return Kind.SPELL_TRAP_SET;
        }
    }

    /**
     * Moves the spell face-up onto the field; a field spell replaces the current one.
     */
    record SpellActivated(
        @JsonProperty("seat") Seat seat,
        @JsonProperty("card_id") String cardId,
        @JsonProperty("targets") List<String> targets
    ) implements Event {
        public SpellActivated {
            targets = targets != null ? List.copyOf(targets) : List.of();
        }

        @Override
        public Kind kind() {
            return Kind.SPELL_ACTIVATED;
        }
    }

    record TrapActivated(
        @JsonProperty("seat") Seat seat,
        @JsonProperty("card_id") String cardId,
        @JsonProperty("targets") List<String> targets
    ) implements Event {
        public TrapActivated {
            targets = targets != null ? List.copyOf(targets) : List.of();
        }

        @Override
        public Kind kind() {
            return Kind.TRAP_ACTIVATED;
        }
    }

    record SpellEquipped(
        @JsonProperty("seat") Seat seat,
        @JsonProperty("card_id") String cardId,
        @JsonProperty("target_card_id") String targetCardId
    ) implements Event {
        @Override
        public Kind kind() {
            return Kind.SPELL_EQUIPPED;
        }
    }

    /**
     * The equipped monster left the board; the equip card follows it to the graveyard.
     */
    record EquipDestroyed(
        @JsonProperty("card_id") String cardId,
        @JsonProperty("target_card_id") String targetCardId
    ) implements Event {
        @Override
        public Kind kind() {
            return Kind.EQUIP_DESTROYED;
        }
    }

    /**
     * Records once-per-turn usage of a monster effect.
     */
    record EffectActivated(
        @JsonProperty("seat") Seat seat,
        @JsonProperty("card_id") String cardId,
        @JsonProperty("effect_index") int effectIndex
    ) implements Event {
        @Override
        public Kind kind() {
            return Kind.EFFECT_ACTIVATED;
        }
    }

    record AttackDeclared(
        @JsonProperty("seat") Seat seat,
        @JsonProperty("attacker_id") String attackerId,
        @JsonProperty("target_id") String targetId
    ) implements Event {
        @Override
        public Kind kind() {
            return Kind.ATTACK_DECLARED;
        }
    }

    /**
     * Life points never drop below zero.
     */
    record DamageDealt(
        @JsonProperty("seat") Seat seat,
        @JsonProperty("amount") int amount,
        @JsonProperty("is_battle") boolean battle
    ) implements Event {
        @Override
        public Kind kind() {
            return Kind.DAMAGE_DEALT;
        }
    }

    record LifeGained(
        @JsonProperty("seat") Seat seat,
        @JsonProperty("amount") int amount
    ) implements Event {
        @Override
        public Kind kind() {
            return Kind.LIFE_GAINED;
        }
    }

    record BattleResolved(
        @JsonProperty("attacker_id") String attackerId,
        @JsonProperty("defender_id") String defenderId,
        @JsonProperty("result") BattleResult result
    ) implements Event {
        @Override
        public Kind kind() {
            return Kind.BATTLE_RESOLVED;
        }
    }

    record CardDestroyed(
        @JsonProperty("card_id") String cardId,
        @JsonProperty("reason") DestroyReason reason
    ) implements Event {
        @Override
        public Kind kind() {
            return Kind.CARD_DESTROYED;
        }
    }

    /**
     * {@code seat} is the owner, not necessarily the player who caused the move.
     */
    record CardSentToGraveyard(
        @JsonProperty("card_id") String cardId,
        @JsonProperty("from") Zone from,
        @JsonProperty("seat") Seat seat
    ) implements Event {
        @Override
        public Kind kind() {
            return Kind.CARD_SENT_TO_GRAVEYARD;
        }
    }

    record CardBanished(
        @JsonProperty("card_id") String cardId,
        @JsonProperty("from") Zone from,
        @JsonProperty("seat") Seat seat
    ) implements Event {
        @Override
        public Kind kind() {
            return Kind.CARD_BANISHED;
        }
    }

    record CardReturnedToHand(
        @JsonProperty("card_id") String cardId,
        @JsonProperty("from") Zone from,
        @JsonProperty("seat") Seat seat
    ) implements Event {
        @Override
        public Kind kind() {
            return Kind.CARD_RETURNED_TO_HAND;
        }
    }

    record ViceCounterAdded(
        @JsonProperty("card_id") String cardId,
        @JsonProperty("new_count") int newCount
    ) implements Event {
        @Override
        public Kind kind() {
            return Kind.VICE_COUNTER_ADDED;
        }
    }

    record ViceCounterRemoved(
        @JsonProperty("card_id") String cardId,
        @JsonProperty("new_count") int newCount
    ) implements Event {
        @Override
        public Kind kind() {
            return Kind.VICE_COUNTER_REMOVED;
        }
    }

    /**
     * {@code seat} owns the broken-down monster; the opponent is credited with the breakdown.
     */
    record BreakdownTriggered(
        @JsonProperty("seat") Seat seat,
        @JsonProperty("card_id") String cardId
    ) implements Event {
        @Override
        public Kind kind() {
            return Kind.BREAKDOWN_TRIGGERED;
        }
    }

    record PositionChanged(
        @JsonProperty("card_id") String cardId,
        @JsonProperty("from") Position from,
        @JsonProperty("to") Position to
    ) implements Event {
        @Override
        public Kind kind() {
            return Kind.POSITION_CHANGED;
        }
    }

    record ModifierApplied(
        @JsonProperty("card_id") String cardId,
        @JsonProperty("stat") Stat stat,
        @JsonProperty("amount") int amount,
        @JsonProperty("source") String source,
        @JsonProperty("expiry") ModifierExpiry expiry
    ) implements Event {
        @Override
        public Kind kind() {
            return Kind.MODIFIER_APPLIED;
        }
    }

    record ModifierExpired(
        @JsonProperty("card_id") String cardId,
        @JsonProperty("stat") Stat stat,
        @JsonProperty("amount") int amount,
        @JsonProperty("source") String source
    ) implements Event {
        @Override
        public Kind kind() {
            return Kind.MODIFIER_EXPIRED;
        }
    }

    record ChainStarted() implements Event {
        @Override
        public Kind kind() {
            return Kind.CHAIN_STARTED;
        }
    }

    record ChainLinkAdded(
        @JsonProperty("seat") Seat seat,
        @JsonProperty("card_id") String cardId,
        @JsonProperty("effect_index") int effectIndex,
        @JsonProperty("targets") List<String> targets
    ) implements Event {
        public ChainLinkAdded {
            targets = targets != null ? List.copyOf(targets) : List.of();
        }

        @Override
        public Kind kind() {
            return Kind.CHAIN_LINK_ADDED;
        }
    }

    record ChainPassed(@JsonProperty("seat") Seat seat) implements Event {
        @Override
        public Kind kind() {
            return Kind.CHAIN_PASSED;
        }
    }

    /**
     * Pops the top link. Its effect events, if any, follow this event.
     */
    record ChainLinkResolved(
        @JsonProperty("link_index") int linkIndex,
        @JsonProperty("card_id") String cardId,
        @JsonProperty("negated") boolean negated
    ) implements Event {
        @Override
        public Kind kind() {
            return Kind.CHAIN_LINK_RESOLVED;
        }
    }

    record ChainLinkNegated(
        @JsonProperty("link_index") int linkIndex,
        @JsonProperty("negated_by") String negatedBy
    ) implements Event {
        @Override
        public Kind kind() {
            return Kind.CHAIN_LINK_NEGATED;
        }
    }

    record ChainResolved() implements Event {
        @Override
        public Kind kind() {
            return Kind.CHAIN_RESOLVED;
        }
    }

    record CostModifierApplied(
        @JsonProperty("seat") Seat seat,
        @JsonProperty("card_type") EffectAction.CostCardType cardType,
        @JsonProperty("operation") EffectAction.CostOperation operation,
        @JsonProperty("amount") int amount,
        @JsonProperty("source") String source,
        @JsonProperty("duration_turns") int durationTurns
    ) implements Event {
        @Override
        public Kind kind() {
            return Kind.COST_MODIFIER_APPLIED;
        }
    }

    record TurnRestrictionApplied(
        @JsonProperty("seat") Seat seat,
        @JsonProperty("restriction") EffectAction.Restriction restriction,
        @JsonProperty("source") String source,
        @JsonProperty("duration_turns") int durationTurns
    ) implements Event {
        @Override
        public Kind kind() {
            return Kind.TURN_RESTRICTION_APPLIED;
        }
    }

    record TopCardsViewed(
        @JsonProperty("seat") Seat seat,
        @JsonProperty("card_ids") List<String> cardIds,
        @JsonProperty("source") String source
    ) implements Event {
        public TopCardsViewed {
            cardIds = cardIds != null ? List.copyOf(cardIds) : List.of();
        }

        @Override
        public Kind kind() {
            return Kind.TOP_CARDS_VIEWED;
        }
    }

    /**
     * {@code cardIds} is the new order of the top of the deck.
     */
    record TopCardsRearranged(
        @JsonProperty("seat") Seat seat,
        @JsonProperty("card_ids") List<String> cardIds
    ) implements Event {
        public TopCardsRearranged {
            cardIds = cardIds != null ? List.copyOf(cardIds) : List.of();
        }

        @Override
        public Kind kind() {
            return Kind.TOP_CARDS_REARRANGED;
        }
    }

}
