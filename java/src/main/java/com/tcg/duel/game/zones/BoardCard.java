package com.tcg.duel.game.zones;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tcg.duel.game.Position;
import com.tcg.duel.game.Stat;

import java.util.ArrayList;
import java.util.List;

/**
 * A monster on a player's board.
 *
 * @param attackBoost  sum of the active attack modifiers
 * @param defenseBoost sum of the active defense modifiers
 */
public record BoardCard(
    @JsonProperty("card_id") String cardId,
    @JsonProperty("definition_id") String definitionId,
    @JsonProperty("position") Position position,
    @JsonProperty("face_down") boolean faceDown,
    @JsonProperty("can_attack") boolean canAttack,
    @JsonProperty("has_attacked_this_turn") boolean hasAttackedThisTurn,
    @JsonProperty("changed_position_this_turn") boolean changedPositionThisTurn,
    @JsonProperty("vice_counters") int viceCounters,
    @JsonProperty("attack_boost") int attackBoost,
    @JsonProperty("defense_boost") int defenseBoost,
    @JsonProperty("equipped_cards") List<String> equippedCards,
    @JsonProperty("turn_summoned") int turnSummoned
) {
    public BoardCard {
        equippedCards = equippedCards != null ? List.copyOf(equippedCards) : List.of();
        viceCounters = Math.max(0, viceCounters);
    }

    /**
     * A freshly summoned or set monster. It cannot attack until its controller's next turn.
     */
    public static BoardCard summoned(String cardId, String definitionId, Position position,
                                     boolean faceDown, int turn) {
        return new BoardCard(cardId, definitionId, position, faceDown, false, false, false,
                0, 0, 0, List.of(), turn);
    }

    @JsonIgnore
    public boolean isFaceUp() {
        return !faceDown;
    }

    public BoardCard withPosition(Position newPosition, boolean newFaceDown) {
        return new BoardCard(cardId, definitionId, newPosition, newFaceDown, canAttack, hasAttackedThisTurn,
                changedPositionThisTurn, viceCounters, attackBoost, defenseBoost, equippedCards, turnSummoned);
    }

    public BoardCard withChangedPosition(Position newPosition) {
        return new BoardCard(cardId, definitionId, newPosition, faceDown, canAttack, hasAttackedThisTurn,
                true, viceCounters, attackBoost, defenseBoost, equippedCards, turnSummoned);
    }

    public BoardCard withAttacked() {
        return new BoardCard(cardId, definitionId, position, faceDown, canAttack, true,
                changedPositionThisTurn, viceCounters, attackBoost, defenseBoost, equippedCards, turnSummoned);
    }

    public BoardCard withTurnFlags(boolean newCanAttack, boolean attacked, boolean changedPosition) {
        return new BoardCard(cardId, definitionId, position, faceDown, newCanAttack, attacked,
                changedPosition, viceCounters, attackBoost, defenseBoost, equippedCards, turnSummoned);
    }

    public BoardCard withViceCounters(int count) {
        return new BoardCard(cardId, definitionId, position, faceDown, canAttack, hasAttackedThisTurn,
                changedPositionThisTurn, count, attackBoost, defenseBoost, equippedCards, turnSummoned);
    }

    public BoardCard withBoost(Stat stat, int delta) {
        int atk = stat == Stat.ATTACK ? attackBoost + delta : attackBoost;
        int def = stat == Stat.DEFENSE ? defenseBoost + delta : defenseBoost;
        return new BoardCard(cardId, definitionId, position, faceDown, canAttack, hasAttackedThisTurn,
                changedPositionThisTurn, viceCounters, atk, def, equippedCards, turnSummoned);
    }

    public BoardCard withEquipped(String equipCardId) {
        List<String> equipped = new ArrayList<>(equippedCards);
        equipped.add(equipCardId);
        return new BoardCard(cardId, definitionId, position, faceDown, canAttack, hasAttackedThisTurn,
                changedPositionThisTurn, viceCounters, attackBoost, defenseBoost, equipped, turnSummoned);
    }

    public BoardCard withoutEquipped(String equipCardId) {
        List<String> equipped = new ArrayList<>(equippedCards);
        equipped.remove(equipCardId);
        return new BoardCard(cardId, definitionId, position, faceDown, canAttack, hasAttackedThisTurn,
                changedPositionThisTurn, viceCounters, attackBoost, defenseBoost, equipped, turnSummoned);
    }
}
