package com.tcg.duel.rules;

import com.tcg.duel.DuelFixtures;
import com.tcg.duel.card.Zone;
import com.tcg.duel.engine.Decider;
import com.tcg.duel.engine.Evolver;
import com.tcg.duel.game.Command;
import com.tcg.duel.game.DestroyReason;
import com.tcg.duel.game.Event;
import com.tcg.duel.game.GameState;
import com.tcg.duel.game.Phase;
import com.tcg.duel.game.WinReason;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.tcg.duel.game.Seat.AWAY;
import static com.tcg.duel.game.Seat.HOST;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ViceRules and breakdowns.
 */
class ViceRulesTest {

    private static final Command PASS = Command.ChainResponse.passPriority();

    @Test
    void testCheckBreakdownsHostFirst() {
        DuelFixtures.Table table = DuelFixtures.table();
        table.monsterWithVice(HOST, "grunt", 2);
        String hostBroken = table.monsterWithVice(HOST, "brute", 3);
        String awayBroken = table.monsterWithVice(AWAY, "wall", 5);
        GameState state = table.build();

        List<Event> events = ViceRules.checkBreakdowns(state);
        assertEquals(List.of(
                new Event.BreakdownTriggered(HOST, hostBroken),
                new Event.CardDestroyed(hostBroken, DestroyReason.BREAKDOWN),
                new Event.CardSentToGraveyard(hostBroken, Zone.BOARD, HOST),
                new Event.BreakdownTriggered(AWAY, awayBroken),
                new Event.CardDestroyed(awayBroken, DestroyReason.BREAKDOWN),
                new Event.CardSentToGraveyard(awayBroken, Zone.BOARD, AWAY)), events);

        GameState after = Evolver.fold(state, events);
        assertEquals(1, after.host().breakdownsCaused(), "Host is credited for the away breakdown");
        assertEquals(1, after.away().breakdownsCaused());
        assertEquals(1, after.host().board().size());
    }

    @Test
    void testChangesVice() {
        assertTrue(ViceRules.changesVice(List.of(new Event.ViceCounterAdded("x", 1))));
        assertTrue(ViceRules.changesVice(List.of(new Event.ViceCounterRemoved("x", 0))));
        assertFalse(ViceRules.changesVice(List.of(new Event.ChainResolved())));
    }

    @Test
    void testAddingViceBreaksDownImmediately() {
        DuelFixtures.Table table = DuelFixtures.table();
        String tempter = table.monster(HOST, "tempter");
        String victim = table.monster(AWAY, "brute");
        GameState state = table.build();

        state = Evolver.fold(state, Decider.decide(state, HOST, new Command.ActivateEffect(tempter, 0, List.of())));
        assertEquals(List.of(victim), state.currentChain().get(0).targets());
        state = Evolver.fold(state, Decider.decide(state, AWAY, PASS));

        List<Event> events = Decider.decide(state, HOST, PASS);
        List<Event.Kind> kinds = DuelFixtures.kinds(events);
        int added = kinds.indexOf(Event.Kind.VICE_COUNTER_ADDED);
        int broken = kinds.indexOf(Event.Kind.BREAKDOWN_TRIGGERED);
        assertTrue(added >= 0 && broken > added);
        assertEquals(new Event.BreakdownTriggered(AWAY, victim), events.get(broken));

        GameState after = Evolver.fold(state, events);
        assertTrue(after.away().board().isEmpty());
        assertEquals(List.of(victim), after.away().graveyard());
        assertEquals(1, after.host().breakdownsCaused());
        assertFalse(after.gameOver());
    }

    @Test
    void testThirdBreakdownWins() {
        DuelFixtures.Table table = DuelFixtures.table().breakdowns(HOST, 2);
        String tempter = table.monster(HOST, "tempter");
        table.monster(AWAY, "brute");
        GameState state = table.build();

        state = Evolver.fold(state, Decider.decide(state, HOST, new Command.ActivateEffect(tempter, 0, List.of())));
        state = Evolver.fold(state, Decider.decide(state, AWAY, PASS));
        List<Event> events = Decider.decide(state, HOST, PASS);

        assertEquals(new Event.GameEnded(HOST, WinReason.BREAKDOWN), events.get(events.size() - 1));
        GameState after = Evolver.fold(state, events);
        assertTrue(after.gameOver());
        assertEquals(HOST, after.winner());
        assertTrue(Decider.decide(after, AWAY, PASS).isEmpty(), "No commands after the duel ends");
    }

    @Test
    void testThreeBreakdownsInOneCheckEndTheDuel() {
        DuelFixtures.Table table = DuelFixtures.table().phase(Phase.MAIN2);
        String first = table.monsterWithVice(HOST, "grunt", 3);
        String second = table.monsterWithVice(HOST, "brute", 3);
        String third = table.monsterWithVice(HOST, "wall", 3);
        GameState state = table.build();

        List<Event> expected = new ArrayList<>();
        for (String broken : List.of(first, second, third)) {
            expected.add(new Event.BreakdownTriggered(HOST, broken));
            expected.add(new Event.CardDestroyed(broken, DestroyReason.BREAKDOWN));
            expected.add(new Event.CardSentToGraveyard(broken, Zone.BOARD, HOST));
        }
        assertEquals(expected, ViceRules.checkBreakdowns(state));

        List<Event> events = Decider.decide(state, HOST, new Command.AdvancePhase());
        assertEquals(new Event.GameEnded(AWAY, WinReason.BREAKDOWN), events.get(events.size() - 1));
        GameState after = Evolver.fold(state, events);
        assertEquals(3, after.away().breakdownsCaused());
        assertEquals(0, after.host().breakdownsCaused());
        assertEquals(List.of(first, second, third), after.host().graveyard());
        assertTrue(after.gameOver());
        assertEquals(AWAY, after.winner());
        assertEquals(WinReason.BREAKDOWN, after.winReason());
    }

    @Test
    void testBreakdownCheckPhaseCatchesLeftoverCounters() {
        DuelFixtures.Table table = DuelFixtures.table().phase(Phase.MAIN2);
        String saturated = table.monsterWithVice(AWAY, "brute", 3);
        GameState state = table.build();

        List<Event> events = Decider.decide(state, HOST, new Command.AdvancePhase());
        assertEquals(new Event.PhaseChanged(Phase.MAIN2, Phase.BREAKDOWN_CHECK), events.get(0));
        assertTrue(events.contains(new Event.BreakdownTriggered(AWAY, saturated)));
    }
}
