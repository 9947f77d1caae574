package com.tcg.duel.rules;

import com.tcg.duel.card.CardDefinition;
import com.tcg.duel.card.Zone;
import com.tcg.duel.game.Command;
import com.tcg.duel.game.EngineConfig;
import com.tcg.duel.game.Event;
import com.tcg.duel.game.GameState;
import com.tcg.duel.game.Seat;
import com.tcg.duel.game.zones.BoardCard;
import com.tcg.duel.game.zones.PlayerZones;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

/**
 * Normal summons, sets, flip summons and manual position changes. All of them need one of the
 * turn player's main phases.
 */
public final class SummonRules {

    private SummonRules() {
        // Utility class - prevent instantiation
    }

    /**
     * Normal summon from the hand. High-level monsters need tributes, which leave the board
     * before the summon.
     */
    public static List<Event> summon(GameState state, Seat seat, Command.Summon command) {
        PlayerZones zones = state.player(seat);
        CardDefinition card = monsterInHand(state, zones, command.cardId());
        if (card == null || !state.currentPhase().isMainPhase() || zones.normalSummonedThisTurn()) {
            return List.of();
        }

        EngineConfig config = state.config();
        List<String> tributes = command.tributeCardIds();
        if (card.getLevel() < config.tributeLevelThreshold()) {
            if (!tributes.isEmpty() || zones.board().size() >= config.maxBoardSlots()) {
                return List.of();
            }
        } else {
            if (tributes.size() != config.tributesRequired() || new HashSet<>(tributes).size() != tributes.size()) {
                return List.of();
            }
            for (String tribute : tributes) {
                Optional<BoardCard> onBoard = zones.findBoardCard(tribute);
                if (onBoard.isEmpty() || onBoard.get().faceDown()) {
                    return List.of();
                }
            }
            if (zones.board().size() - tributes.size() >= config.maxBoardSlots()) {
                return List.of();
            }
        }

        List<Event> events = new ArrayList<>();
        for (String tribute : tributes) {
            events.add(new Event.CardSentToGraveyard(tribute, Zone.BOARD, seat));
        }
        events.add(new Event.MonsterSummoned(seat, command.cardId(), command.position(), tributes));
        return events;
    }

    /**
     * Set a monster face-down in defense. Uses up the normal summon; tribute monsters cannot be set.
     */
    public static List<Event> setMonster(GameState state, Seat seat, Command.SetMonster command) {
        PlayerZones zones = state.player(seat);
        CardDefinition card = monsterInHand(state, zones, command.cardId());
        if (card == null || !state.currentPhase().isMainPhase() || zones.normalSummonedThisTurn()) {
            return List.of();
        }
        if (card.getLevel() >= state.config().tributeLevelThreshold()
                || zones.board().size() >= state.config().maxBoardSlots()) {
            return List.of();
        }
        return List.of(new Event.MonsterSet(seat, command.cardId()));
    }

    public static List<Event> flipSummon(GameState state, Seat seat, Command.FlipSummon command) {
        if (!state.currentPhase().isMainPhase()) {
            return List.of();
        }
        Optional<BoardCard> card = state.player(seat).findBoardCard(command.cardId());
        if (card.isEmpty() || !card.get().faceDown() || card.get().turnSummoned() >= state.turnNumber()) {
            return List.of();
        }
        return List.of(new Event.FlipSummoned(seat, command.cardId()));
    }

    /**
     * Switch a face-up monster between attack and defense, once per turn and never on the turn
     * it arrived.
     */
    public static List<Event> changePosition(GameState state, Seat seat, Command.ChangePosition command) {
        if (!state.currentPhase().isMainPhase()) {
            return List.of();
        }
        Optional<BoardCard> card = state.player(seat).findBoardCard(command.cardId());
        if (card.isEmpty()) {
            return List.of();
        }
        BoardCard monster = card.get();
        if (monster.faceDown() || monster.changedPositionThisTurn() || monster.turnSummoned() >= state.turnNumber()) {
            return List.of();
        }
        return List.of(new Event.PositionChanged(monster.cardId(), monster.position(), monster.position().flip()));
    }

    private static CardDefinition monsterInHand(GameState state, PlayerZones zones, String cardId) {
        if (cardId == null || !zones.hand().contains(cardId)) {
            return null;
        }
        CardDefinition card = state.definitionOf(cardId);
        return card != null && card.isMonster() ? card : null;
    }
}
