package com.tcg.duel.engine;

import com.tcg.duel.card.CardDefinition;
import com.tcg.duel.card.EffectAction;
import com.tcg.duel.game.Command;
import com.tcg.duel.game.Event;
import com.tcg.duel.game.GameState;
import com.tcg.duel.game.Phase;
import com.tcg.duel.game.Seat;
import com.tcg.duel.game.WinReason;
import com.tcg.duel.game.zones.SpellTrapCard;
import com.tcg.duel.rules.ChainRules;
import com.tcg.duel.rules.CombatRules;
import com.tcg.duel.rules.ContinuousEffects;
import com.tcg.duel.rules.EffectRules;
import com.tcg.duel.rules.SpellTrapRules;
import com.tcg.duel.rules.StateBasedActions;
import com.tcg.duel.rules.SummonRules;
import com.tcg.duel.rules.TurnManager;
import com.tcg.duel.rules.ViceRules;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Validates a command for a seat and produces the events it causes.
 * <p>
 * An illegal command yields an empty list; nothing here throws for bad input. The returned list
 * holds the command's own events followed by everything they set off: summon triggers, equip
 * cleanup, boosts owed by field and continuous cards, breakdowns, the end-phase hand limit and
 * win checks. Folding the whole list with
 * {@link Evolver#fold} gives the next state.
 */
public final class Decider {

    /** Upper bound on follow-up rounds for one command. */
    static final int MAX_DERIVED_ROUNDS = 16;

    private Decider() {
        // Utility class - prevent instantiation
    }

    public static List<Event> decide(GameState state, Seat seat, Command command) {
        if (state.gameOver() || seat == null || command == null) {
            return List.of();
        }
        if (command.kind() == Command.Kind.SURRENDER) {
            return List.of(new Event.GameEnded(seat.opponent(), WinReason.SURRENDER));
        }
        if (!mayAct(state, seat, command)) {
            return List.of();
        }
        if (command.kind() == Command.Kind.END_TURN) {
            return endTurn(state, seat);
        }
        List<Event> primary = route(state, seat, command);
        if (primary.isEmpty()) {
            return primary;
        }
        return withDerived(state, primary);
    }

    // ==================== GATE ====================

    /**
     * While a chain is open only the priority seat may respond. Otherwise the turn player acts,
     * and the other seat may only flip its own set traps and quick-play spells. Effects are
     * unavailable to a seat under an effect lock.
     */
    private static boolean mayAct(GameState state, Seat seat, Command command) {
        boolean effectsDisabled = state.hasRestriction(seat, EffectAction.Restriction.DISABLE_EFFECTS);
        if (state.isChainOpen()) {
            if (command.kind() != Command.Kind.CHAIN_RESPONSE || state.currentPriorityPlayer() != seat) {
                return false;
            }
            return !effectsDisabled || ((Command.ChainResponse) command).pass();
        }
        if (command.kind() == Command.Kind.CHAIN_RESPONSE) {
            return false;
        }
        boolean activation = command.kind() == Command.Kind.ACTIVATE_SPELL
                || command.kind() == Command.Kind.ACTIVATE_TRAP
                || command.kind() == Command.Kind.ACTIVATE_EFFECT;
        if (effectsDisabled && activation) {
            return false;
        }
        if (seat == state.currentTurnPlayer()) {
            return true;
        }
        return switch (command.kind()) {
            case ACTIVATE_SPELL -> isSetCard(state, seat, ((Command.ActivateSpell) command).cardId(), true);
            case ACTIVATE_TRAP -> isSetCard(state, seat, ((Command.ActivateTrap) command).cardId(), false);
            default -> false;
        };
    }

    private static boolean isSetCard(GameState state, Seat seat, String cardId, boolean quickPlay) {
        Optional<SpellTrapCard> card = state.player(seat).findSpellTrap(cardId);
        if (card.isEmpty() || !card.get().faceDown()) {
            return false;
        }
        CardDefinition definition = state.definitionOf(cardId);
        if (definition == null) {
            return false;
        }
        return quickPlay ? definition.isQuickPlay() : definition.isTrap();
    }

    // ==================== ROUTING ====================

    private static List<Event> route(GameState state, Seat seat, Command command) {
        return switch (command.kind()) {
            case ADVANCE_PHASE -> TurnManager.advancePhase(state, seat);
            case SUMMON -> SummonRules.summon(state, seat, (Command.Summon) command);
            case SET_MONSTER -> SummonRules.setMonster(state, seat, (Command.SetMonster) command);
            case FLIP_SUMMON -> SummonRules.flipSummon(state, seat, (Command.FlipSummon) command);
            case CHANGE_POSITION -> SummonRules.changePosition(state, seat, (Command.ChangePosition) command);
            case SET_SPELL_TRAP -> SpellTrapRules.setSpellTrap(state, seat, (Command.SetSpellTrap) command);
            case ACTIVATE_SPELL -> SpellTrapRules.activateSpell(state, seat, (Command.ActivateSpell) command);
            case ACTIVATE_TRAP -> SpellTrapRules.activateTrap(state, seat, (Command.ActivateTrap) command);
            case ACTIVATE_EFFECT -> ChainRules.activateEffect(state, seat, (Command.ActivateEffect) command);
            case DECLARE_ATTACK -> CombatRules.declareAttack(state, seat, (Command.DeclareAttack) command);
            case CHAIN_RESPONSE -> ChainRules.respond(state, seat, (Command.ChainResponse) command);
            case END_TURN, SURRENDER -> List.of();
        };
    }

    /**
     * Walk the remaining phases of the turn, running each phase's checks, until the opponent's
     * turn starts or the duel ends.
     */
    private static List<Event> endTurn(GameState state, Seat seat) {
        if (state.currentTurnPlayer() != seat
                || (state.currentPhase() != Phase.MAIN2 && state.currentPhase() != Phase.END)) {
            return List.of();
        }
        List<Event> events = new ArrayList<>();
        GameState current = state;
        for (int step = 0; step <= Phase.values().length; step++) {
            List<Event> advance = decide(current, seat, new Command.AdvancePhase());
            if (advance.isEmpty()) {
                break;
            }
            events.addAll(advance);
            current = Evolver.fold(current, advance);
            if (current.gameOver() || current.turnNumber() != state.turnNumber()) {
                break;
            }
        }
        return events;
    }

    // ==================== FOLLOW-UPS ====================

    /**
     * Append follow-up events until a round adds nothing or the duel ends.
     */
    static List<Event> withDerived(GameState state, List<Event> primary) {
        List<Event> all = new ArrayList<>(primary);
        GameState before = state;
        GameState current = Evolver.fold(state, primary);
        List<Event> batch = primary;
        for (int round = 0; round < MAX_DERIVED_ROUNDS && !current.gameOver(); round++) {
            List<Event> derived = derivedEvents(before, current, batch);
            if (derived.isEmpty()) {
                break;
            }
            all.addAll(derived);
            before = current;
            current = Evolver.fold(current, derived);
            batch = derived;
        }
        return all;
    }

    private static List<Event> derivedEvents(GameState before, GameState after, List<Event> batch) {
        List<Event> derived = new ArrayList<>();
        GameState current = after;

        current = collect(derived, current, EffectRules.detectSummonTriggers(current, batch));
        current = collect(derived, current, StateBasedActions.orphanedEquips(before, current));
        current = collect(derived, current, ContinuousEffects.refresh(current));
        if (ViceRules.changesVice(batch) || ViceRules.changesVice(derived) || entered(batch, Phase.BREAKDOWN_CHECK)) {
            current = collect(derived, current, ViceRules.checkBreakdowns(current));
        }
        if (entered(batch, Phase.END)) {
            current = collect(derived, current, TurnManager.handSizeDiscards(current));
        }
        collect(derived, current, StateBasedActions.checkWinConditions(current));
        return derived;
    }

    private static GameState collect(List<Event> into, GameState state, List<Event> events) {
        if (events.isEmpty() || state.gameOver()) {
            return state;
        }
        into.addAll(events);
        return Evolver.fold(state, events);
    }

    private static boolean entered(List<Event> batch, Phase phase) {
        for (Event event : batch) {
            if (event instanceof Event.PhaseChanged changed && changed.to() == phase) {
                return true;
            }
        }
        return false;
    }
}
