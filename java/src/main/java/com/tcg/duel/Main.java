package com.tcg.duel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tcg.duel.card.CardDatabase;
import com.tcg.duel.card.CardDatabaseException;
import com.tcg.duel.card.CardJson;
import com.tcg.duel.card.EffectDefinition;
import com.tcg.duel.compiler.EffectCompiler;
import com.tcg.duel.engine.DuelEngine;
import com.tcg.duel.game.Command;
import com.tcg.duel.game.EngineConfig;
import com.tcg.duel.game.Event;
import com.tcg.duel.game.Seat;
import com.tcg.duel.game.WinReason;
import com.tcg.duel.match.DuelSession;
import com.tcg.duel.match.MatchException;
import com.tcg.duel.match.SubmitResult;
import com.tcg.duel.simulation.Deck;
import com.tcg.duel.simulation.DuelResult;
import com.tcg.duel.simulation.DuelSimulator;
import picocli.CommandLine;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.Callable;

/**
 * Duel engine CLI - Main entry point.
 */
@CommandLine.Command(name = "duel-engine",
        mixinStandardHelpOptions = true,
        version = "1.0",
        description = "Two-seat card duel rules engine",
        subcommands = {
                Main.SimulateCommand.class,
                Main.CompileCommand.class,
                Main.ReplayCommand.class
        })
public class Main implements Runnable {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        // Show help if no subcommand
        CommandLine.usage(this, System.out);
    }

    // ========== SIMULATE COMMAND ==========
    @CommandLine.Command(name = "simulate", description = "Play random legal duels between two decks")
    static class SimulateCommand implements Callable<Integer> {
        @Option(names = {"-n", "--num-duels"}, defaultValue = "100",
                description = "Number of duels to simulate")
        int numDuels;

        @Option(names = {"-s", "--seed"},
                description = "Random seed (optional)")
        Long seed;

        @Option(names = {"-v", "--verbose"},
                description = "Verbose output (single duel trace)")
        boolean verbose;

        @Option(names = {"--host-deck"}, defaultValue = "host.txt",
                description = "Path to the host deck file")
        String hostDeckPath;

        @Option(names = {"--away-deck"}, defaultValue = "away.txt",
                description = "Path to the away deck file")
        String awayDeckPath;

        @Option(names = {"-c", "--cards"}, defaultValue = "cards.json",
                description = "Path to cards database")
        String cardsPath;

        @Option(names = {"--config"},
                description = "Path to an engine config JSON file (optional)")
        String configPath;

        @Option(names = {"--starting-lp"},
                description = "Override the starting life points")
        Integer startingLP;

        @Option(names = {"--max-turns"}, defaultValue = "" + DuelSimulator.DEFAULT_MAX_TURNS,
                description = "Turn limit per duel")
        int maxTurns;

        @Override
        public Integer call() throws Exception {
            CardDatabase db = loadCards(cardsPath);
            if (db == null) {
                return 1;
            }
            EngineConfig config = loadConfig(configPath);
            if (config == null) {
                return 1;
            }
            if (startingLP != null) {
                config = config.withStartingLP(startingLP);
            }

            Deck hostDeck = loadDeck(hostDeckPath, db);
            Deck awayDeck = loadDeck(awayDeckPath, db);
            if (hostDeck == null || awayDeck == null) {
                return 1;
            }

            DuelEngine engine = new DuelEngine(db, config);

            System.out.println("\n=== Duel Simulator ===\n");
            System.out.println("Host deck: " + hostDeckPath + " (" + hostDeck.size() + " cards)");
            System.out.println("Away deck: " + awayDeckPath + " (" + awayDeck.size() + " cards)");
            System.out.println("Duels: " + numDuels);
            if (seed != null) {
                System.out.println("Seed: " + seed);
            }
            System.out.println();

            if (verbose) {
                long duelSeed = seed != null ? seed : System.nanoTime();
                DuelSimulator.runDuel(engine, hostDeck.getCardIds(), awayDeck.getCardIds(), duelSeed, maxTurns, true);
                return 0;
            }

            long startTime = System.currentTimeMillis();
            List<DuelResult> results = DuelSimulator.runDuels(engine, hostDeck.getCardIds(), awayDeck.getCardIds(),
                    numDuels, seed, maxTurns);
            long elapsed = System.currentTimeMillis() - startTime;

            printResults(results, numDuels, elapsed);
            return 0;
        }
    }

    // ========== COMPILE COMMAND ==========
    @CommandLine.Command(name = "compile", description = "Compile authored abilities into effect definitions")
    static class CompileCommand implements Callable<Integer> {
        @Parameters(index = "0", description = "JSON array of {\"id\", \"abilities\"} entries")
        String inputPath;

        @Option(names = {"-o", "--output"},
                description = "Write the compiled effects here instead of stdout")
        String outputPath;

        @Override
        public Integer call() throws Exception {
            ObjectMapper mapper = CardJson.mapper();
            JsonNode input;
            try {
                input = mapper.readTree(Files.readString(Path.of(inputPath)));
            } catch (IOException e) {
                System.err.println("✗ Failed to read abilities '" + inputPath + "': " + e.getMessage());
                return 1;
            }
            if (input == null || !input.isArray()) {
                System.err.println("✗ Expected a JSON array in '" + inputPath + "'");
                return 1;
            }

            ObjectNode compiled = mapper.createObjectNode();
            int withEffects = 0;
            for (JsonNode entry : input) {
                String id = entry.path("id").asText("");
                if (id.isEmpty()) {
                    continue;
                }
                Optional<List<EffectDefinition>> effects = EffectCompiler.compileAll(entry.path("abilities"));
                if (effects.isPresent()) {
                    compiled.set(id, mapper.valueToTree(effects.get()));
                    withEffects++;
                } else {
                    compiled.putNull(id);
                }
            }

            String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(compiled);
            if (outputPath != null) {
                Files.writeString(Path.of(outputPath), json);
                System.err.println("✓ Wrote " + compiled.size() + " cards to " + outputPath);
            } else {
                System.out.println(json);
            }
            System.err.println("✓ " + withEffects + " of " + compiled.size() + " cards have effects");
            return 0;
        }
    }

    // ========== REPLAY COMMAND ==========
    @CommandLine.Command(name = "replay", description = "Replay a scripted duel and print every event batch")
    static class ReplayCommand implements Callable<Integer> {
        @Parameters(index = "0", description = "JSON array of {\"seat\", \"command\"} steps")
        String scriptPath;

        @Option(names = {"--host-deck"}, defaultValue = "host.txt",
                description = "Path to the host deck file")
        String hostDeckPath;

        @Option(names = {"--away-deck"}, defaultValue = "away.txt",
                description = "Path to the away deck file")
        String awayDeckPath;

        @Option(names = {"-c", "--cards"}, defaultValue = "cards.json",
                description = "Path to cards database")
        String cardsPath;

        @Option(names = {"--config"},
                description = "Path to an engine config JSON file (optional)")
        String configPath;

        @Option(names = {"-s", "--seed"}, defaultValue = "0",
                description = "Shuffle seed")
        long seed;

        @Option(names = {"--first"}, defaultValue = "host",
                description = "Seat taking the first turn (host or away)")
        String first;

        @Override
        public Integer call() throws Exception {
            CardDatabase db = loadCards(cardsPath);
            if (db == null) {
                return 1;
            }
            EngineConfig config = loadConfig(configPath);
            if (config == null) {
                return 1;
            }
            Deck hostDeck = loadDeck(hostDeckPath, db);
            Deck awayDeck = loadDeck(awayDeckPath, db);
            if (hostDeck == null || awayDeck == null) {
                return 1;
            }

            ObjectMapper mapper = CardJson.mapper();
            JsonNode steps;
            try {
                steps = mapper.readTree(Files.readString(Path.of(scriptPath)));
            } catch (IOException e) {
                System.err.println("✗ Failed to read script '" + scriptPath + "': " + e.getMessage());
                return 1;
            }
            if (steps == null || !steps.isArray()) {
                System.err.println("✗ Expected a JSON array in '" + scriptPath + "'");
                return 1;
            }

            DuelEngine engine = new DuelEngine(db, config);
            DuelSession session = new DuelSession(engine,
                    engine.newDuel(hostDeck.getCardIds(), awayDeck.getCardIds(), Seat.fromString(first), seed),
                    "host", "away");

            int step = 0;
            for (JsonNode node : steps) {
                step++;
                Seat seat = Seat.fromString(node.path("seat").asText());
                Command command = mapper.treeToValue(node.get("command"), Command.class);
                try {
                    SubmitResult result = session.submit(seat, command, session.getVersion());
                    if (!result.accepted()) {
                        System.out.println("#" + step + " " + seat.getJsonValue() + " " + command.kind()
                                + ": rejected");
                        continue;
                    }
                    System.out.println("#" + step + " v" + result.version() + " " + seat.getJsonValue() + " "
                            + command.kind());
                    for (Event event : result.events()) {
                        System.out.println("    " + mapper.writeValueAsString(event));
                    }
                } catch (MatchException e) {
                    System.err.println("✗ Step " + step + ": " + e.getMessage());
                    return 1;
                }
            }

            if (session.getState().gameOver()) {
                System.out.println("\n" + session.getState().winner() + " wins by "
                        + session.getState().winReason().getJsonValue());
            }
            return 0;
        }
    }

    // ========== SHARED LOADING ==========

    private static CardDatabase loadCards(String cardsPath) {
        try {
            CardDatabase db = CardDatabase.fromFile(cardsPath);
            System.err.println("✓ Loaded " + db.cardCount() + " cards from " + cardsPath);
            return db;
        } catch (CardDatabaseException e) {
            System.err.println("✗ Failed to load cards: " + e.getMessage());
            return null;
        }
    }

    private static EngineConfig loadConfig(String configPath) {
        if (configPath == null) {
            return EngineConfig.defaults();
        }
        try {
            return EngineConfig.fromFile(configPath);
        } catch (IOException e) {
            System.err.println("✗ Failed to load config '" + configPath + "': " + e.getMessage());
            return null;
        }
    }

    private static Deck loadDeck(String deckPath, CardDatabase db) {
        try {
            return Deck.loadFromFile(deckPath, db);
        } catch (Deck.DeckException e) {
            System.err.println("✗ Failed to parse deck file '" + deckPath + "': " + e.getMessage());
            return null;
        }
    }

    // ========== RESULTS ==========

    private static void printResults(List<DuelResult> results, int numDuels, long elapsedMs) {
        long hostWins = results.stream().filter(r -> r.winner() == Seat.HOST).count();
        long awayWins = results.stream().filter(r -> r.winner() == Seat.AWAY).count();
        long unfinished = results.stream().filter(r -> !r.isFinished()).count();

        double avgTurns = results.stream().mapToInt(DuelResult::turns).average().orElse(0.0);
        double avgCommands = results.stream().mapToInt(DuelResult::commands).average().orElse(0.0);

        Map<WinReason, Long> reasons = new EnumMap<>(WinReason.class);
        Map<Integer, Long> turnDist = new TreeMap<>();
        for (DuelResult r : results) {
            if (r.isFinished()) {
                reasons.merge(r.reason(), 1L, Long::sum);
                turnDist.merge(r.turns(), 1L, Long::sum);
            }
        }

        System.out.println("=== Results ===\n");
        System.out.printf("Host wins: %5.1f%% (%d/%d)%n", (double) hostWins / numDuels * 100.0, hostWins, numDuels);
        System.out.printf("Away wins: %5.1f%% (%d/%d)%n", (double) awayWins / numDuels * 100.0, awayWins, numDuels);
        System.out.printf("Average length: %.2f turns, %.1f commands%n", avgTurns, avgCommands);
        System.out.println();

        System.out.println("Win reasons:");
        for (Map.Entry<WinReason, Long> entry : reasons.entrySet()) {
            System.out.printf("  %-10s %d%n", entry.getKey().getJsonValue(), entry.getValue());
        }
        System.out.println();

        System.out.println("Turn distribution:");
        for (Map.Entry<Integer, Long> entry : turnDist.entrySet()) {
            double pct = (double) entry.getValue() / numDuels * 100.0;
            String bar = "█".repeat((int) (pct / 2.0));
            System.out.printf("  Turn %2d: %5.1f%% %s (%d)%n",
                    entry.getKey(), pct, bar, entry.getValue());
        }
        if (unfinished > 0) {
            double pct = (double) unfinished / numDuels * 100.0;
            System.out.printf("  Turn limit: %5.1f%% (%d)%n", pct, unfinished);
        }

        System.out.println();
        double elapsedSec = elapsedMs / 1000.0;
        double duelsPerSec = elapsedSec > 0 ? numDuels / elapsedSec : 0;
        System.out.printf("Simulation completed in %.2fs (%.0f duels/sec)%n", elapsedSec, duelsPerSec);
    }
}
