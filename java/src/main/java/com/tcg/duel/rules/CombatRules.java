package com.tcg.duel.rules;

import com.tcg.duel.card.CardDefinition;
import com.tcg.duel.card.EffectAction;
import com.tcg.duel.card.Zone;
import com.tcg.duel.game.BattleResult;
import com.tcg.duel.game.Command;
import com.tcg.duel.game.DestroyReason;
import com.tcg.duel.game.Event;
import com.tcg.duel.game.GameState;
import com.tcg.duel.game.Phase;
import com.tcg.duel.game.Position;
import com.tcg.duel.game.Seat;
import com.tcg.duel.game.zones.BoardCard;
import com.tcg.duel.game.zones.PlayerZones;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Attack declaration and battle resolution.
 */
public final class CombatRules {

    private CombatRules() {
        // Utility class - prevent instantiation
    }

    public static List<Event> declareAttack(GameState state, Seat seat, Command.DeclareAttack command) {
        if (state.currentPhase() != Phase.COMBAT || state.turnNumber() <= 1
                || state.hasRestriction(seat, EffectAction.Restriction.DISABLE_ATTACKS)) {
            return List.of();
        }
        Optional<BoardCard> found = state.player(seat).findBoardCard(command.attackerId());
        if (found.isEmpty()) {
            return List.of();
        }
        BoardCard attacker = found.get();
        if (attacker.faceDown() || !attacker.canAttack() || attacker.hasAttackedThisTurn()) {
            return List.of();
        }
        CardDefinition attackerCard = state.definitionOf(attacker.cardId());
        if (attackerCard == null || !attackerCard.isMonster()) {
            return List.of();
        }

        PlayerZones defending = state.player(seat.opponent());
        if (command.isDirect()) {
            if (!defending.faceUpMonsters().isEmpty()) {
                return List.of();
            }
            List<Event> events = new ArrayList<>();
            events.add(new Event.AttackDeclared(seat, attacker.cardId(), Command.DIRECT_ATTACK));
            int damage = attack(attackerCard, attacker);
            if (damage > 0) {
                events.add(new Event.DamageDealt(seat.opponent(), damage, true));
            }
            events.add(new Event.BattleResolved(attacker.cardId(), Command.DIRECT_ATTACK, BattleResult.WIN));
            return events;
        }

        Optional<BoardCard> target = defending.findBoardCard(command.targetId());
        if (target.isEmpty()) {
            return List.of();
        }
        BoardCard defender = target.get();
        CardDefinition defenderCard = state.definitionOf(defender.cardId());
        if (defenderCard == null) {
            return List.of();
        }

        List<Event> events = new ArrayList<>();
        events.add(new Event.AttackDeclared(seat, attacker.cardId(), defender.cardId()));
        events.addAll(resolveBattle(seat, attacker, attackerCard, defender, defenderCard));
        return events;
    }

    // ==================== BATTLE MATH ====================

    /**
     * Attack position compares attack values and both sides can take damage. Defense position
     * compares against defense; only the attacker's controller takes damage, and only when the
     * attack bounces off.
     */
    static List<Event> resolveBattle(Seat seat, BoardCard attacker, CardDefinition attackerCard,
                                     BoardCard defender, CardDefinition defenderCard) {
        List<Event> events = new ArrayList<>();
        Seat defendingSeat = seat.opponent();
        int atk = attack(attackerCard, attacker);

        if (defender.position() == Position.ATTACK) {
            int defAtk = attack(defenderCard, defender);
            if (atk > defAtk) {
                destroy(events, defender.cardId(), defendingSeat);
                events.add(new Event.DamageDealt(defendingSeat, atk - defAtk, true));
                events.add(new Event.BattleResolved(attacker.cardId(), defender.cardId(), BattleResult.WIN));
            } else if (atk < defAtk) {
                destroy(events, attacker.cardId(), seat);
                events.add(new Event.DamageDealt(seat, defAtk - atk, true));
                events.add(new Event.BattleResolved(attacker.cardId(), defender.cardId(), BattleResult.LOSE));
            } else {
                destroy(events, attacker.cardId(), seat);
                destroy(events, defender.cardId(), defendingSeat);
                events.add(new Event.BattleResolved(attacker.cardId(), defender.cardId(), BattleResult.DRAW));
            }
            return events;
        }

        int def = defense(defenderCard, defender);
        if (atk > def) {
            destroy(events, defender.cardId(), defendingSeat);
            events.add(new Event.BattleResolved(attacker.cardId(), defender.cardId(), BattleResult.WIN));
        } else if (atk < def) {
            events.add(new Event.DamageDealt(seat, def - atk, true));
            events.add(new Event.BattleResolved(attacker.cardId(), defender.cardId(), BattleResult.LOSE));
        } else {
            events.add(new Event.BattleResolved(attacker.cardId(), defender.cardId(), BattleResult.DRAW));
        }
        return events;
    }

    private static void destroy(List<Event> events, String cardId, Seat owner) {
        events.add(new Event.CardDestroyed(cardId, DestroyReason.BATTLE));
        events.add(new Event.CardSentToGraveyard(cardId, Zone.BOARD, owner));
    }

    public static int attack(CardDefinition card, BoardCard monster) {
        return Math.max(0, card.getAttack() + monster.attackBoost());
    }

    public static int defense(CardDefinition card, BoardCard monster) {
        return Math.max(0, card.getDefense() + monster.defenseBoost());
    }
}
