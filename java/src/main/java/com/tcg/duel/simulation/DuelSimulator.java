package com.tcg.duel.simulation;

import com.tcg.duel.engine.DuelEngine;
import com.tcg.duel.game.Command;
import com.tcg.duel.game.Event;
import com.tcg.duel.game.GameState;
import com.tcg.duel.game.Seat;
import com.tcg.duel.rng.GameRng;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Plays whole duels by picking uniformly among the legal moves of whichever seat must act.
 * Surrender is never picked.
 */
public final class DuelSimulator {
    private static final Logger log = LoggerFactory.getLogger(DuelSimulator.class);

    public static final int DEFAULT_MAX_TURNS = 40;

    /** Guards against a duel that never reaches its turn limit. */
    private static final int MAX_COMMANDS = 5000;

    private DuelSimulator() {
        // Utility class - prevent instantiation
    }

    // ==================== RUN DUEL ====================

    /**
     * Run a complete duel.
     *
     * @param engine   Rules engine with the card pool
     * @param hostDeck Host deck as definition ids
     * @param awayDeck Away deck as definition ids
     * @param seed     Random seed for reproducibility
     * @param maxTurns Turn limit
     * @param verbose  Whether to print every command and its events
     * @return The duel result
     */
    public static DuelResult runDuel(DuelEngine engine, List<String> hostDeck, List<String> awayDeck,
                                     long seed, int maxTurns, boolean verbose) {
        GameRng rng = new GameRng(seed);

        // Decide who goes first before the engine shuffles
        Seat firstPlayer = rng.next() < 0.5 ? Seat.HOST : Seat.AWAY;
        GameState state = engine.newDuel(hostDeck, awayDeck, firstPlayer, seed);

        if (verbose) {
            System.out.println("=== Duel Start (seed: " + seed + ") ===");
            System.out.println(firstPlayer + " goes first");
        }

        int commands = 0;
        while (!state.gameOver() && state.turnNumber() <= maxTurns && commands < MAX_COMMANDS) {
            Seat actor = actingSeat(state);
            List<Command> moves = playableMoves(engine, state, actor);
            if (moves.isEmpty()) {
                log.warn("No playable move for {} at turn {} ({}), stopping", actor, state.turnNumber(),
                        state.currentPhase());
                break;
            }
            Command command = rng.pick(moves);
            List<Event> events = engine.decide(state, actor, command);
            state = engine.evolve(state, events);
            commands++;

            if (verbose) {
                System.out.println("T" + state.turnNumber() + " " + actor + ": " + command);
                for (Event event : events) {
                    System.out.println("    " + event);
                }
            }
        }

        if (verbose && state.gameOver()) {
            System.out.println("=== " + state.winner() + " wins by " + state.winReason().getJsonValue() + " ===");
        }
        return new DuelResult(state.winner(), state.winReason(), state.turnNumber(), commands);
    }

    /**
     * The chain's priority holder while a chain is open, otherwise the turn player.
     */
    static Seat actingSeat(GameState state) {
        return state.isChainOpen() ? state.currentPriorityPlayer() : state.currentTurnPlayer();
    }

    private static List<Command> playableMoves(DuelEngine engine, GameState state, Seat seat) {
        List<Command> moves = new ArrayList<>();
        for (Command command : engine.legalMoves(state, seat)) {
            if (command.kind() != Command.Kind.SURRENDER) {
                moves.add(command);
            }
        }
        return moves;
    }

    // ==================== BATCHES ====================

    /**
     * Run many duels. With a seed they run sequentially on {@code seed + i} and the batch is
     * reproducible; without one they run in parallel on time-based seeds.
     */
    public static List<DuelResult> runDuels(DuelEngine engine, List<String> hostDeck, List<String> awayDeck,
                                            int count, Long seed, int maxTurns) {
        if (seed != null) {
            List<DuelResult> results = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                results.add(runDuel(engine, hostDeck, awayDeck, seed + i, maxTurns, false));
            }
            return results;
        }
        return IntStream.range(0, count)
                .parallel()
                .mapToObj(i -> runDuel(engine, hostDeck, awayDeck, System.nanoTime() + i, maxTurns, false))
                .toList();
    }
}
