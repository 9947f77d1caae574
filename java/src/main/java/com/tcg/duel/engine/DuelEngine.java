package com.tcg.duel.engine;

import com.tcg.duel.card.CardDatabase;
import com.tcg.duel.card.CardDefinition;
import com.tcg.duel.game.Command;
import com.tcg.duel.game.EngineConfig;
import com.tcg.duel.game.Event;
import com.tcg.duel.game.GameState;
import com.tcg.duel.game.Seat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point to the rules engine for one card pool and configuration.
 * <p>
 * Instances hold no duel state and are safe to share between threads; every method maps
 * immutable inputs to new immutable outputs.
 */
public final class DuelEngine {
    private static final Logger log = LoggerFactory.getLogger(DuelEngine.class);

    private final Map<String, CardDefinition> cards;
    private final EngineConfig config;

    public DuelEngine(Map<String, CardDefinition> cards, EngineConfig config) {
        this.cards = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(cards, "cards")));
        this.config = Objects.requireNonNull(config, "config");
    }

    public DuelEngine(CardDatabase database, EngineConfig config) {
        this(database.asLookup(), config);
    }

    public EngineConfig getConfig() {
        return config;
    }

    public Map<String, CardDefinition> getCards() {
        return cards;
    }

    /**
     * Opening state for two decks given as definition ids.
     */
    public GameState newDuel(List<String> hostDeck, List<String> awayDeck, Seat firstPlayer, long seed) {
        GameState state = GameSetup.createInitialState(cards, config, hostDeck, awayDeck, firstPlayer, seed);
        log.debug("New duel: seed={}, host deck {} cards, away deck {} cards, {} goes first",
                seed, hostDeck.size(), awayDeck.size(), state.currentTurnPlayer());
        return state;
    }

    public List<Event> decide(GameState state, Seat seat, Command command) {
        List<Event> events = Decider.decide(state, seat, command);
        if (events.isEmpty()) {
            log.debug("Rejected {} from {} in {} (turn {})", command.kind(), seat, state.currentPhase(),
                    state.turnNumber());
        }
        return events;
    }

    public GameState evolve(GameState state, List<Event> events) {
        return Evolver.fold(state, events);
    }

    public List<Command> legalMoves(GameState state, Seat seat) {
        return LegalMoves.legalMoves(state, seat);
    }

    public PlayerView mask(GameState state, Seat seat) {
        return PlayerView.mask(state, seat);
    }

    public SpectatorView spectate(GameState state) {
        return SpectatorView.of(state);
    }
}
