package com.tcg.duel.engine;

import com.tcg.duel.card.CardDefinition;
import com.tcg.duel.game.Command;
import com.tcg.duel.game.GameState;
import com.tcg.duel.game.Position;
import com.tcg.duel.game.Seat;
import com.tcg.duel.game.zones.BoardCard;
import com.tcg.duel.game.zones.PlayerZones;
import com.tcg.duel.game.zones.SpellTrapCard;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntConsumer;

/**
 * Legal command enumeration.
 * <p>
 * Builds every canonical command a seat could conceivably issue and keeps the ones
 * {@link Decider#decide} accepts, so legality is defined in exactly one place. Canonical means
 * empty target lists (effects auto-target) except where a target is the whole point of the
 * command: attack targets, equip targets and tributes.
 */
public final class LegalMoves {

    private LegalMoves() {
        // Utility class - prevent instantiation
    }

    public static List<Command> legalMoves(GameState state, Seat seat) {
        if (state.gameOver()) {
            return List.of();
        }
        List<Command> legal = new ArrayList<>();
        for (Command command : candidates(state, seat)) {
            if (!Decider.decide(state, seat, command).isEmpty()) {
                legal.add(command);
            }
        }
        return legal;
    }

    /**
     * The candidate universe, legal or not.
     */
    static List<Command> candidates(GameState state, Seat seat) {
        List<Command> commands = new ArrayList<>();
        PlayerZones zones = state.player(seat);

        if (state.isChainOpen()) {
            commands.add(Command.ChainResponse.passPriority());
            for (SpellTrapCard card : zones.spellTrapZone()) {
                addPerEffect(state, card.cardId(), i -> commands.add(Command.ChainResponse.respond(card.cardId(), i)));
            }
            for (BoardCard card : zones.board()) {
                addPerEffect(state, card.cardId(), i -> commands.add(Command.ChainResponse.respond(card.cardId(), i)));
            }
            commands.add(new Command.Surrender());
            return commands;
        }

        commands.add(new Command.AdvancePhase());
        commands.add(new Command.EndTurn());

        List<String> ownFaceUp = zones.faceUpMonsters().stream().map(BoardCard::cardId).toList();
        for (String cardId : zones.hand()) {
            CardDefinition card = state.definitionOf(cardId);
            if (card == null) {
                continue;
            }
            if (card.isMonster()) {
                List<List<String>> tributeSets = card.getLevel() >= state.config().tributeLevelThreshold()
                        ? combinations(ownFaceUp, state.config().tributesRequired())
                        : List.of(List.of());
                for (List<String> tributes : tributeSets) {
                    commands.add(new Command.Summon(cardId, Position.ATTACK, tributes));
                    commands.add(new Command.Summon(cardId, Position.DEFENSE, tributes));
                }
                commands.add(new Command.SetMonster(cardId));
                continue;
            }
            commands.add(new Command.SetSpellTrap(cardId));
            if (card.isSpell()) {
                addSpellActivations(state, card, cardId, ownFaceUp, commands);
            }
        }

        for (SpellTrapCard card : zones.spellTrapZone()) {
            CardDefinition definition = state.definitionOf(card.cardId());
            if (definition == null) {
                continue;
            }
            if (definition.isTrap()) {
                addPerEffect(state, card.cardId(),
                        i -> commands.add(new Command.ActivateTrap(card.cardId(), i, List.of())));
            } else {
                addSpellActivations(state, definition, card.cardId(), ownFaceUp, commands);
            }
        }

        List<BoardCard> opponentBoard = state.player(seat.opponent()).board();
        for (BoardCard card : zones.board()) {
            commands.add(new Command.FlipSummon(card.cardId()));
            commands.add(new Command.ChangePosition(card.cardId()));
            addPerEffect(state, card.cardId(),
                    i -> commands.add(new Command.ActivateEffect(card.cardId(), i, List.of())));
            commands.add(new Command.DeclareAttack(card.cardId(), Command.DIRECT_ATTACK));
            for (BoardCard target : opponentBoard) {
                commands.add(new Command.DeclareAttack(card.cardId(), target.cardId()));
            }
        }

        commands.add(new Command.Surrender());
        return commands;
    }

    private static void addSpellActivations(GameState state, CardDefinition card, String cardId,
                                            List<String> ownFaceUp, List<Command> commands) {
        if (card.isEquipSpell()) {
            int effects = Math.max(1, card.getEffects().size());
            for (int i = 0; i < effects; i++) {
                for (String monster : ownFaceUp) {
                    commands.add(new Command.ActivateSpell(cardId, i, List.of(monster)));
                }
            }
            return;
        }
        addPerEffect(state, cardId, i -> commands.add(new Command.ActivateSpell(cardId, i, List.of())));
    }

    /**
     * One call per effect index; a card without effects still gets index 0.
     */
    private static void addPerEffect(GameState state, String cardId, IntConsumer add) {
        CardDefinition card = state.definitionOf(cardId);
        int effects = card == null ? 0 : card.getEffects().size();
        for (int i = 0; i < Math.max(1, effects); i++) {
            add.accept(i);
        }
    }

    static List<List<String>> combinations(List<String> items, int size) {
        List<List<String>> result = new ArrayList<>();
        if (size < 0 || size > items.size()) {
            return result;
        }
        combine(items, size, 0, new ArrayList<>(), result);
        return result;
    }

    private static void combine(List<String> items, int size, int start, List<String> current,
                                List<List<String>> result) {
        if (current.size() == size) {
            result.add(List.copyOf(current));
            return;
        }
        for (int i = start; i < items.size(); i++) {
            current.add(items.get(i));
            combine(items, size, i + 1, current, result);
            current.remove(current.size() - 1);
        }
    }
}
