package com.tcg.duel.engine;

import com.tcg.duel.DuelFixtures;
import com.tcg.duel.game.EngineConfig;
import com.tcg.duel.game.GameState;
import com.tcg.duel.game.Phase;
import com.tcg.duel.game.zones.PlayerZones;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.tcg.duel.game.Seat.AWAY;
import static com.tcg.duel.game.Seat.HOST;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GameSetup.
 */
class GameSetupTest {

    private static GameState opening(long seed) {
        return GameSetup.createInitialState(DuelFixtures.cards().asLookup(), EngineConfig.defaults(),
                DuelFixtures.SAMPLER_DECK, DuelFixtures.SAMPLER_DECK, HOST, seed);
    }

    @Test
    void testOpeningState() {
        GameState state = opening(42);

        assertEquals(1, state.turnNumber());
        assertEquals(Phase.DRAW, state.currentPhase());
        assertEquals(HOST, state.currentTurnPlayer());
        assertFalse(state.isChainOpen());
        assertFalse(state.gameOver());
        for (PlayerZones zones : List.of(state.host(), state.away())) {
            assertEquals(5, zones.hand().size());
            assertEquals(15, zones.deck().size());
            assertEquals(8000, zones.lifePoints());
            assertTrue(zones.board().isEmpty());
            assertTrue(zones.graveyard().isEmpty());
        }
    }

    @Test
    void testInstanceIdsAreOpaque() {
        GameState state = opening(42);

        assertEquals(40, state.instances().size());
        List<String> hostCards = new ArrayList<>(state.host().hand());
        hostCards.addAll(state.host().deck());
        List<String> expected = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            expected.add("h:" + i);
        }
        assertEquals(expected, hostCards, "Ids follow the shuffled order");
        assertEquals("a:19", state.away().deck().get(14));

        for (String id : state.instances().keySet()) {
            String definition = state.instances().get(id);
            assertFalse(id.contains(definition), id + " names its card");
        }
        List<String> definitions = hostCards.stream().map(state.instances()::get).sorted().toList();
        assertEquals(DuelFixtures.SAMPLER_DECK.stream().sorted().toList(), definitions);
    }

    @Test
    void testSeedFixesBothOpeningHands() {
        assertEquals(opening(7), opening(7));

        Set<List<String>> hands = new HashSet<>();
        for (long seed = 1; seed <= 5; seed++) {
            GameState state = opening(seed);
            hands.add(state.host().hand().stream().map(state.instances()::get).toList());
        }
        assertTrue(hands.size() > 1, "Different seeds should shuffle differently");
    }

    @Test
    void testFirstPlayer() {
        GameState away = GameSetup.createInitialState(DuelFixtures.cards().asLookup(), EngineConfig.defaults(),
                DuelFixtures.SAMPLER_DECK, DuelFixtures.SAMPLER_DECK, AWAY, 1);
        assertEquals(AWAY, away.currentTurnPlayer());

        GameState defaulted = GameSetup.createInitialState(DuelFixtures.cards().asLookup(), EngineConfig.defaults(),
                DuelFixtures.SAMPLER_DECK, DuelFixtures.SAMPLER_DECK, null, 1);
        assertEquals(HOST, defaulted.currentTurnPlayer());
    }

    @Test
    void testShortDeckDealsWhatItHas() {
        GameState state = GameSetup.createInitialState(DuelFixtures.cards().asLookup(),
                EngineConfig.defaults().withStartingLP(4000), List.of("grunt", "brute"), List.of(), HOST, 1);

        assertEquals(2, state.host().hand().size());
        assertTrue(state.host().deck().isEmpty());
        assertTrue(state.away().hand().isEmpty());
        assertEquals(4000, state.away().lifePoints());
    }
}
