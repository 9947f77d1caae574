package com.tcg.duel.engine;

import com.tcg.duel.card.CardDefinition;
import com.tcg.duel.game.EngineConfig;
import com.tcg.duel.game.GameState;
import com.tcg.duel.game.Seat;
import com.tcg.duel.game.zones.PlayerZones;
import com.tcg.duel.rng.GameRng;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the opening state of a duel.
 */
public final class GameSetup {

    private GameSetup() {
        // Utility class - prevent instantiation
    }

    /**
     * Create the opening state. One generator shuffles the host deck and then the away deck, so a
     * seed fixes both opening hands. Instances are numbered after the shuffle as {@code h:<n>} or
     * {@code a:<n>}, where {@code n} is the card's position in the shuffled deck, so an id says
     * nothing about the card behind it. {@link GameState#instances()} holds the mapping.
     *
     * @param cards       definition id to card definition
     * @param config      duel tunables
     * @param hostDeck    host deck as definition ids
     * @param awayDeck    away deck as definition ids
     * @param firstPlayer seat taking the first turn; null means host
     * @param seed        shuffle seed
     */
    public static GameState createInitialState(Map<String, CardDefinition> cards, EngineConfig config,
                                               List<String> hostDeck, List<String> awayDeck,
                                               Seat firstPlayer, long seed) {
        List<String> hostOrder = new ArrayList<>(hostDeck);
        List<String> awayOrder = new ArrayList<>(awayDeck);
        GameRng rng = new GameRng(seed);
        rng.shuffle(hostOrder);
        rng.shuffle(awayOrder);

        Map<String, String> instances = new LinkedHashMap<>();
        List<String> hostInstances = instantiate("h", hostOrder, instances);
        List<String> awayInstances = instantiate("a", awayOrder, instances);

        return GameState.builder(config, Collections.unmodifiableMap(new LinkedHashMap<>(cards)),
                        Collections.unmodifiableMap(instances))
                .host(deal(hostInstances, config))
                .away(deal(awayInstances, config))
                .currentTurnPlayer(firstPlayer != null ? firstPlayer : Seat.HOST)
                .build();
    }

    private static List<String> instantiate(String prefix, List<String> shuffled, Map<String, String> instances) {
        List<String> ids = new ArrayList<>(shuffled.size());
        for (int i = 0; i < shuffled.size(); i++) {
            String id = prefix + ":" + i;
            instances.put(id, shuffled.get(i));
            ids.add(id);
        }
        return ids;
    }

    private static PlayerZones deal(List<String> shuffled, EngineConfig config) {
        int handSize = Math.min(config.startingHandSize(), shuffled.size());
        return PlayerZones.initial(shuffled.subList(0, handSize), shuffled.subList(handSize, shuffled.size()),
                config.startingLP());
    }
}
