package com.tcg.duel.game;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * A player's request. Commands carry no seat; the caller supplies the acting seat.
 * Uses Jackson polymorphic deserialization based on the "type" field.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.PROPERTY,
    property = "type"
)
@JsonSubTypes({
    @JsonSubTypes.Type(value = Command.AdvancePhase.class, name = "ADVANCE_PHASE"),
    @JsonSubTypes.Type(value = Command.EndTurn.class, name = "END_TURN"),
    @JsonSubTypes.Type(value = Command.Surrender.class, name = "SURRENDER"),
    @JsonSubTypes.Type(value = Command.Summon.class, name = "SUMMON"),
    @JsonSubTypes.Type(value = Command.SetMonster.class, name = "SET_MONSTER"),
    @JsonSubTypes.Type(value = Command.FlipSummon.class, name = "FLIP_SUMMON"),
    @JsonSubTypes.Type(value = Command.SetSpellTrap.class, name = "SET_SPELL_TRAP"),
    @JsonSubTypes.Type(value = Command.ActivateSpell.class, name = "ACTIVATE_SPELL"),
    @JsonSubTypes.Type(value = Command.ActivateTrap.class, name = "ACTIVATE_TRAP"),
    @JsonSubTypes.Type(value = Command.ActivateEffect.class, name = "ACTIVATE_EFFECT"),
    @JsonSubTypes.Type(value = Command.DeclareAttack.class, name = "DECLARE_ATTACK"),
    @JsonSubTypes.Type(value = Command.ChangePosition.class, name = "CHANGE_POSITION"),
    @JsonSubTypes.Type(value = Command.ChainResponse.class, name = "CHAIN_RESPONSE")
})
public sealed interface Command permits
        Command.AdvancePhase, Command.EndTurn, Command.Surrender, Command.Summon, Command.SetMonster,
        Command.FlipSummon, Command.SetSpellTrap, Command.ActivateSpell, Command.ActivateTrap,
        Command.ActivateEffect, Command.DeclareAttack, Command.ChangePosition, Command.ChainResponse {

    /** Attack target meaning "attack the opponent directly". */
    String DIRECT_ATTACK = "";

    Kind kind();

    enum Kind {
        ADVANCE_PHASE, END_TURN, SURRENDER, SUMMON, SET_MONSTER, FLIP_SUMMON, SET_SPELL_TRAP,
        ACTIVATE_SPELL, ACTIVATE_TRAP, ACTIVATE_EFFECT, DECLARE_ATTACK, CHANGE_POSITION, CHAIN_RESPONSE
    }

    record AdvancePhase() implements Command {
        @Override
        public Kind kind() {
            return Kind.ADVANCE_PHASE;
        }
    }

    record EndTurn() implements Command {
        @Override
        public Kind kind() {
            return Kind.END_TURN;
        }
    }

    record Surrender() implements Command {
        @Override
        public Kind kind() {
            return Kind.SURRENDER;
        }
    }

    record Summon(
        @JsonProperty("card_id") String cardId,
        @JsonProperty("position") Position position,
        @JsonProperty("tribute_card_ids") List<String> tributeCardIds
    ) implements Command {
        public Summon {
            position = position != null ? position : Position.ATTACK;
            tributeCardIds = tributeCardIds != null ? List.copyOf(tributeCardIds) : List.of();
        }

        public Summon(String cardId, Position position) {
            this(cardId, position, List.of());
        }

        @Override
        public Kind kind() {
            return Kind.SUMMON;
        }
    }

    record SetMonster(@JsonProperty("card_id") String cardId) implements Command {
        @Override
        public Kind kind() {
            return Kind.SET_MONSTER;
        }
    }

    record FlipSummon(@JsonProperty("card_id") String cardId) implements Command {
        @Override
        public Kind kind() {
            return Kind.FLIP_SUMMON;
        }
    }

    record SetSpellTrap(@JsonProperty("card_id") String cardId) implements Command {
        @Override
        public Kind kind() {
            return Kind.SET_SPELL_TRAP;
        }
    }

    /**
     * Activates a spell from the hand or a set quick-play.
     */
    record ActivateSpell(
        @JsonProperty("card_id") String cardId,
        @JsonProperty("effect_index") int effectIndex,
        @JsonProperty("targets") List<String> targets
    ) implements Command {
        public ActivateSpell {
            targets = targets != null ? List.copyOf(targets) : List.of();
        }

        public ActivateSpell(String cardId) {
            this(cardId, 0, List.of());
        }

        @Override
        public Kind kind() {
            return Kind.ACTIVATE_SPELL;
        }
    }

    record ActivateTrap(
        @JsonProperty("card_id") String cardId,
        @JsonProperty("effect_index") int effectIndex,
        @JsonProperty("targets") List<String> targets
    ) implements Command {
        public ActivateTrap {
            targets = targets != null ? List.copyOf(targets) : List.of();
        }

        public ActivateTrap(String cardId) {
            this(cardId, 0, List.of());
        }

        @Override
        public Kind kind() {
            return Kind.ACTIVATE_TRAP;
        }
    }

    /**
     * Activates an ignition effect of a face-up monster.
     */
    record ActivateEffect(
        @JsonProperty("card_id") String cardId,
        @JsonProperty("effect_index") int effectIndex,
        @JsonProperty("targets") List<String> targets
    ) implements Command {
        public ActivateEffect {
            targets = targets != null ? List.copyOf(targets) : List.of();
        }

        @Override
        public Kind kind() {
            return Kind.ACTIVATE_EFFECT;
        }
    }

    /**
     * @param targetId defending card, or {@link #DIRECT_ATTACK}
     */
    record DeclareAttack(
        @JsonProperty("attacker_id") String attackerId,
        @JsonProperty("target_id") String targetId
    ) implements Command {
        public DeclareAttack {
            targetId = targetId != null ? targetId : DIRECT_ATTACK;
        }

        @JsonIgnore
        public boolean isDirect() {
            return DIRECT_ATTACK.equals(targetId);
        }

        @Override
        public Kind kind() {
            return Kind.DECLARE_ATTACK;
        }
    }

    record ChangePosition(@JsonProperty("card_id") String cardId) implements Command {
        @Override
        public Kind kind() {
            return Kind.CHANGE_POSITION;
        }
    }

    /**
     * Passes priority, or responds to the open chain with a set card or a quick effect.
     */
    record ChainResponse(
        @JsonProperty("pass") boolean pass,
        @JsonProperty("card_id") String cardId,
        @JsonProperty("effect_index") int effectIndex,
        @JsonProperty("targets") List<String> targets
    ) implements Command {
        public ChainResponse {
            targets = targets != null ? List.copyOf(targets) : List.of();
        }

        public static ChainResponse passPriority() {
            return new ChainResponse(true, null, 0, List.of());
        }

        public static ChainResponse respond(String cardId, int effectIndex) {
            return new ChainResponse(false, cardId, effectIndex, List.of());
        }

        @Override
        public Kind kind() {
            return Kind.CHAIN_RESPONSE;
        }
    }
}
