package com.tcg.duel.simulation;

import com.tcg.duel.DuelFixtures;
import com.tcg.duel.engine.DuelEngine;
import com.tcg.duel.game.ChainLink;
import com.tcg.duel.game.GameState;
import com.tcg.duel.game.Phase;
import com.tcg.duel.game.Seat;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DuelSimulator.
 */
class DuelSimulatorTest {

    private final DuelEngine engine = DuelFixtures.engine();

    @Test
    void testSeededDuelIsReproducible() {
        DuelResult first = DuelSimulator.runDuel(engine, DuelFixtures.SAMPLER_DECK, DuelFixtures.SAMPLER_DECK,
                12345, DuelSimulator.DEFAULT_MAX_TURNS, false);
        DuelResult second = DuelSimulator.runDuel(engine, DuelFixtures.SAMPLER_DECK, DuelFixtures.SAMPLER_DECK,
                12345, DuelSimulator.DEFAULT_MAX_TURNS, false);
        assertEquals(first, second);
    }

    @Test
    void testDuelEndsOrHitsTurnLimit() {
        for (long seed = 0; seed < 5; seed++) {
            DuelResult result = DuelSimulator.runDuel(engine, DuelFixtures.SAMPLER_DECK, DuelFixtures.SAMPLER_DECK,
                    seed, 10, false);
            assertTrue(result.commands() > 0);
            if (result.isFinished()) {
                assertNotNull(result.reason());
            } else {
                assertNull(result.reason());
            }
        }
    }

    @Test
    void testShortDecksDeckOut() {
        List<String> tiny = List.of("wall", "wall", "wall", "wall", "wall", "wall");
        DuelResult result = DuelSimulator.runDuel(engine, tiny, tiny, 1, 50, false);
        assertTrue(result.isFinished());
    }

    @Test
    void testSeededBatch() {
        List<DuelResult> batch = DuelSimulator.runDuels(engine, DuelFixtures.SAMPLER_DECK,
                DuelFixtures.SAMPLER_DECK, 3, 100L, 8);
        assertEquals(3, batch.size());
        assertEquals(DuelSimulator.runDuel(engine, DuelFixtures.SAMPLER_DECK, DuelFixtures.SAMPLER_DECK,
                101, 8, false), batch.get(1));
    }

    @Test
    void testUnseededBatchRunsInParallel() {
        List<DuelResult> batch = DuelSimulator.runDuels(engine, DuelFixtures.SAMPLER_DECK,
                DuelFixtures.SAMPLER_DECK, 4, null, 4);
        assertEquals(4, batch.size());
    }

    @Test
    void testActingSeat() {
        GameState state = DuelFixtures.table().turnPlayer(Seat.AWAY).phase(Phase.MAIN).build();
        assertEquals(Seat.AWAY, DuelSimulator.actingSeat(state));

        GameState chained = state.toBuilder()
                .currentChain(List.of(new ChainLink("x", "fireball", 0, Seat.AWAY, List.of())))
                .currentPriorityPlayer(Seat.HOST)
                .build();
        assertEquals(Seat.HOST, DuelSimulator.actingSeat(chained));
    }
}
