package com.tcg.duel.rules;

import com.tcg.duel.card.CardDefinition;
import com.tcg.duel.card.Zone;
import com.tcg.duel.game.ChainLink;
import com.tcg.duel.game.Event;
import com.tcg.duel.game.GameState;
import com.tcg.duel.game.Seat;
import com.tcg.duel.game.WinReason;
import com.tcg.duel.game.zones.BoardCard;
import com.tcg.duel.game.zones.PlayerZones;
import com.tcg.duel.game.zones.SpellTrapCard;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks that run after every accepted command, independent of what the command was.
 */
public final class StateBasedActions {

    private StateBasedActions() {
        // Utility class - prevent instantiation
    }

    /**
     * Win conditions: life points first (host checked before away), then breakdowns.
     */
    public static List<Event> checkWinConditions(GameState state) {
        if (state.gameOver()) {
            return List.of();
        }
        for (Seat seat : Seat.values()) {
            if (state.player(seat).lifePoints() <= 0) {
                return List.of(new Event.GameEnded(seat.opponent(), WinReason.LP_ZERO));
            }
        }
        int needed = state.config().maxBreakdownsToWin();
        for (Seat seat : Seat.values()) {
            if (state.player(seat).breakdownsCaused() >= needed) {
                return List.of(new Event.GameEnded(seat, WinReason.BREAKDOWN));
            }
        }
        return List.of();
    }

    /**
     * Face-up equip spells whose monster has left the board go to the graveyard. An equip still
     * waiting on the chain is left alone.
     *
     * @param before state in which the equipped monster was last seen
     * @param after  state to check
     */
    public static List<Event> orphanedEquips(GameState before, GameState after) {
        List<Event> events = new ArrayList<>();
        for (Seat seat : Seat.values()) {
            for (SpellTrapCard card : after.player(seat).spellTrapZone()) {
                if (card.faceDown() || !isEquip(after, card.cardId()) || isEquipping(after, card.cardId())
                        || isOnChain(after, card.cardId())) {
                    continue;
                }
                events.add(new Event.EquipDestroyed(card.cardId(), equippedMonster(before, card.cardId())));
                events.add(new Event.CardSentToGraveyard(card.cardId(), Zone.SPELL_TRAP_ZONE, seat));
            }
        }
        return events;
    }

    private static boolean isEquip(GameState state, String cardId) {
        CardDefinition card = state.definitionOf(cardId);
        return card != null && card.isEquipSpell();
    }

    private static boolean isEquipping(GameState state, String equipId) {
        return !equippedMonster(state, equipId).isEmpty();
    }

    private static String equippedMonster(GameState state, String equipId) {
        for (Seat seat : Seat.values()) {
            PlayerZones zones = state.player(seat);
            for (BoardCard monster : zones.board()) {
                if (monster.equippedCards().contains(equipId)) {
                    return monster.cardId();
                }
            }
        }
        return "";
    }

    private static boolean isOnChain(GameState state, String cardId) {
        for (ChainLink link : state.currentChain()) {
            if (link.cardId().equals(cardId)) {
                return true;
            }
        }
        return false;
    }
}
