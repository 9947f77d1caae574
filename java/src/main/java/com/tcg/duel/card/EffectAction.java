package com.tcg.duel.card;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * One step of an effect. A closed union keyed by {@link Kind}; consumers switch on
 * {@link #kind()} so that adding a variant breaks every switch that does not handle it.
 * Uses Jackson polymorphic deserialization based on the "type" field.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.PROPERTY,
    property = "type"
)
@JsonSubTypes({
    @JsonSubTypes.Type(value = EffectAction.BoostAttack.class, name = "boost_attack"),
    @JsonSubTypes.Type(value = EffectAction.BoostDefense.class, name = "boost_defense"),
    @JsonSubTypes.Type(value = EffectAction.Damage.class, name = "damage"),
    @JsonSubTypes.Type(value = EffectAction.Heal.class, name = "heal"),
    @JsonSubTypes.Type(value = EffectAction.Draw.class, name = "draw"),
    @JsonSubTypes.Type(value = EffectAction.Discard.class, name = "discard"),
    @JsonSubTypes.Type(value = EffectAction.Destroy.class, name = "destroy"),
    @JsonSubTypes.Type(value = EffectAction.Negate.class, name = "negate"),
    @JsonSubTypes.Type(value = EffectAction.ReturnToHand.class, name = "return_to_hand"),
    @JsonSubTypes.Type(value = EffectAction.Banish.class, name = "banish"),
    @JsonSubTypes.Type(value = EffectAction.SpecialSummon.class, name = "special_summon"),
    @JsonSubTypes.Type(value = EffectAction.ChangePosition.class, name = "change_position"),
    @JsonSubTypes.Type(value = EffectAction.AddVice.class, name = "add_vice"),
    @JsonSubTypes.Type(value = EffectAction.RemoveVice.class, name = "remove_vice"),
    @JsonSubTypes.Type(value = EffectAction.ApplyRestriction.class, name = "apply_restriction"),
    @JsonSubTypes.Type(value = EffectAction.ModifyCost.class, name = "modify_cost"),
    @JsonSubTypes.Type(value = EffectAction.ViewTopCards.class, name = "view_top_cards"),
    @JsonSubTypes.Type(value = EffectAction.RearrangeTopCards.class, name = "rearrange_top_cards")
})
@JsonInclude(JsonInclude.Include.NON_NULL)
public sealed interface EffectAction permits
        EffectAction.BoostAttack, EffectAction.BoostDefense, EffectAction.Damage, EffectAction.Heal,
        EffectAction.Draw, EffectAction.Discard, EffectAction.Destroy, EffectAction.Negate,
        EffectAction.ReturnToHand, EffectAction.Banish, EffectAction.SpecialSummon,
        EffectAction.ChangePosition, EffectAction.AddVice, EffectAction.RemoveVice,
        EffectAction.ApplyRestriction, EffectAction.ModifyCost, EffectAction.ViewTopCards,
        EffectAction.RearrangeTopCards {

    Kind kind();

    /**
     * Whether the action falls back to the source card, then to all friendly monsters,
     * when no explicit targets were chosen.
     */
    default boolean selfTargeting() {
        return false;
    }

    enum Kind {
        BOOST_ATTACK, BOOST_DEFENSE, DAMAGE, HEAL, DRAW, DISCARD, DESTROY, NEGATE,
        RETURN_TO_HAND, BANISH, SPECIAL_SUMMON, CHANGE_POSITION, ADD_VICE, REMOVE_VICE,
        APPLY_RESTRICTION, MODIFY_COST, VIEW_TOP_CARDS, REARRANGE_TOP_CARDS
    }

    // ==================== STATS ====================

    record BoostAttack(
        @JsonProperty("amount") Amount amount,
        @JsonProperty("duration") Duration duration
    ) implements EffectAction {
        public BoostAttack {
            duration = duration != null ? duration : Duration.PERMANENT;
        }

        @Override
        public Kind kind() {
            return Kind.BOOST_ATTACK;
        }

        @Override
        public boolean selfTargeting() {
            return true;
        }
    }

    record BoostDefense(
        @JsonProperty("amount") Amount amount,
        @JsonProperty("duration") Duration duration
    ) implements EffectAction {
        public BoostDefense {
            duration = duration != null ? duration : Duration.PERMANENT;
        }

        @Override
        public Kind kind() {
            return Kind.BOOST_DEFENSE;
        }

        @Override
        public boolean selfTargeting() {
            return true;
        }
    }

    // ==================== LIFE POINTS ====================

    record Damage(
        @JsonProperty("amount") Amount amount,
        @JsonProperty("target") Recipient target
    ) implements EffectAction {
        public Damage {
            target = target != null ? target : Recipient.OPPONENT;
        }

        @Override
        public Kind kind() {
            return Kind.DAMAGE;
        }
    }

    record Heal(
        @JsonProperty("amount") Amount amount,
        @JsonProperty("target") Recipient target
    ) implements EffectAction {
        public Heal {
            target = target != null ? target : Recipient.SELF;
        }

        @Override
        public Kind kind() {
            return Kind.HEAL;
        }
    }

    // ==================== CARDS ====================

    record Draw(@JsonProperty("count") int count) implements EffectAction {
        @Override
        public Kind kind() {
            return Kind.DRAW;
        }
    }

    /**
     * Discards from the end of the target hand. A count at or above the hand size empties it.
     */
    record Discard(
        @JsonProperty("count") int count,
        @JsonProperty("target") Recipient target
    ) implements EffectAction {
        public Discard {
            target = target != null ? target : Recipient.OPPONENT;
        }

        @Override
        public Kind kind() {
            return Kind.DISCARD;
        }
    }

    record Destroy(@JsonProperty("target") DestroyTarget target) implements EffectAction {
        public Destroy {
            target = target != null ? target : DestroyTarget.SELECTED;
        }

        @Override
        public Kind kind() {
            return Kind.DESTROY;
        }
    }

    /**
     * Makes the chain link directly below the resolving one inert.
     */
    record Negate() implements EffectAction {
        @Override
        public Kind kind() {
            return Kind.NEGATE;
        }
    }

    record ReturnToHand() implements EffectAction {
        @Override
        public Kind kind() {
            return Kind.RETURN_TO_HAND;
        }
    }

    record Banish() implements EffectAction {
        @Override
        public Kind kind() {
            return Kind.BANISH;
        }
    }

    record SpecialSummon(@JsonProperty("from") Zone from) implements EffectAction {
        public SpecialSummon {
            from = from != null ? from : Zone.GRAVEYARD;
        }

        @Override
        public Kind kind() {
            return Kind.SPECIAL_SUMMON;
        }
    }

    record ChangePosition() implements EffectAction {
        @Override
        public Kind kind() {
            return Kind.CHANGE_POSITION;
        }
    }

    // ==================== VICE ====================

    record AddVice(@JsonProperty("count") int count) implements EffectAction {
        @Override
        public Kind kind() {
            return Kind.ADD_VICE;
        }
    }

    record RemoveVice(@JsonProperty("count") int count) implements EffectAction {
        @Override
        public Kind kind() {
            return Kind.REMOVE_VICE;
        }
    }

    // ==================== TURN-SCOPED RULE CHANGES ====================

    record ApplyRestriction(
        @JsonProperty("restriction") Restriction restriction,
        @JsonProperty("target") Recipient target,
        @JsonProperty("duration_turns") int durationTurns
    ) implements EffectAction {
        public ApplyRestriction {
            target = target != null ? target : Recipient.OPPONENT;
        }

        @Override
        public Kind kind() {
            return Kind.APPLY_RESTRICTION;
        }
    }

    record ModifyCost(
        @JsonProperty("card_type") CostCardType cardType,
        @JsonProperty("operation") CostOperation operation,
        @JsonProperty("amount") int amount,
        @JsonProperty("target") Recipient target,
        @JsonProperty("duration_turns") int durationTurns
    ) implements EffectAction {
        public ModifyCost {
            cardType = cardType != null ? cardType : CostCardType.ALL;
            operation = operation != null ? operation : CostOperation.INCREASE;
            target = target != null ? target : Recipient.OPPONENT;
        }

        @Override
        public Kind kind() {
            return Kind.MODIFY_COST;
        }
    }

    record ViewTopCards(@JsonProperty("count") int count) implements EffectAction {
        @Override
        public Kind kind() {
            return Kind.VIEW_TOP_CARDS;
        }
    }

    record RearrangeTopCards(
        @JsonProperty("count") int count,
        @JsonProperty("strategy") RearrangeStrategy strategy
    ) implements EffectAction {
        public RearrangeTopCards {
            strategy = strategy != null ? strategy : RearrangeStrategy.KEEP;
        }

        @Override
        public Kind kind() {
            return Kind.REARRANGE_TOP_CARDS;
        }
    }

    // ==================== VALUE ENUMS ====================

    enum DestroyTarget {
        SELECTED("selected"),
        ALL_OPPONENT_MONSTERS("all_opponent_monsters"),
        ALL_SPELLS_TRAPS("all_spells_traps");

        private final String jsonValue;

        DestroyTarget(String jsonValue) {
            this.jsonValue = jsonValue;
        }

        @JsonValue
        public String getJsonValue() {
            return jsonValue;
        }
    }

    enum Restriction {
        DISABLE_ATTACKS("disable_attacks"),
        DISABLE_BATTLE_PHASE("disable_battle_phase"),
        DISABLE_DRAW_PHASE("disable_draw_phase"),
        DISABLE_EFFECTS("disable_effects");

        private final String jsonValue;

        Restriction(String jsonValue) {
            this.jsonValue = jsonValue;
        }

        @JsonValue
        public String getJsonValue() {
            return jsonValue;
        }
    }

    enum CostCardType {
        MONSTER("monster"),
        SPELL("spell"),
        TRAP("trap"),
        ALL("all");

        private final String jsonValue;

        CostCardType(String jsonValue) {
            this.jsonValue = jsonValue;
        }

        @JsonValue
        public String getJsonValue() {
            return jsonValue;
        }
    }

    enum CostOperation {
        INCREASE("increase"),
        DECREASE("decrease"),
        SET("set");

        private final String jsonValue;

        CostOperation(String jsonValue) {
            this.jsonValue = jsonValue;
        }

        @JsonValue
        public String getJsonValue() {
            return jsonValue;
        }
    }

    enum RearrangeStrategy {
        REVERSE("reverse"),
        KEEP("keep");

        private final String jsonValue;

        RearrangeStrategy(String jsonValue) {
            this.jsonValue = jsonValue;
        }

        @JsonValue
        public String getJsonValue() {
            return jsonValue;
        }
    }
}
