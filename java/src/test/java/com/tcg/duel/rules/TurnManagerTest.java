package com.tcg.duel.rules;

import com.tcg.duel.DuelFixtures;
import com.tcg.duel.card.EffectAction;
import com.tcg.duel.card.Zone;
import com.tcg.duel.engine.Decider;
import com.tcg.duel.engine.Evolver;
import com.tcg.duel.game.Command;
import com.tcg.duel.game.Event;
import com.tcg.duel.game.GameState;
import com.tcg.duel.game.ModifierExpiry;
import com.tcg.duel.game.Phase;
import com.tcg.duel.game.Stat;
import com.tcg.duel.game.WinReason;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tcg.duel.game.Seat.AWAY;
import static com.tcg.duel.game.Seat.HOST;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TurnManager.
 */
class TurnManagerTest {

    @Test
    void testPhaseOrder() {
        assertEquals(Phase.STANDBY, Phase.DRAW.next());
        assertEquals(Phase.MAIN, Phase.STANDBY.next());
        assertEquals(Phase.COMBAT, Phase.MAIN.next());
        assertEquals(Phase.MAIN2, Phase.COMBAT.next());
        assertEquals(Phase.BREAKDOWN_CHECK, Phase.MAIN2.next());
        assertEquals(Phase.END, Phase.BREAKDOWN_CHECK.next());
        assertThrows(IllegalStateException.class, Phase.END::next);
    }

    @Test
    void testLeavingDrawPhaseDraws() {
        DuelFixtures.Table table = DuelFixtures.table().phase(Phase.DRAW).turn(1);
        String top = table.deck(HOST, "brute");
        table.deck(HOST, "grunt");
        GameState state = table.build();

        List<Event> events = TurnManager.advancePhase(state, HOST);
        assertEquals(List.of(new Event.PhaseChanged(Phase.DRAW, Phase.STANDBY), new Event.CardDrawn(HOST, top)),
                events);
        GameState after = Evolver.fold(state, events);
        assertEquals(List.of(top), after.host().hand());
        assertEquals(1, after.host().deck().size());
    }

    @Test
    void testOnlyTurnPlayerAdvances() {
        GameState state = DuelFixtures.table().build();
        assertTrue(TurnManager.advancePhase(state, AWAY).isEmpty());
    }

    @Test
    void testDrawFromEmptyDeckLoses() {
        GameState state = DuelFixtures.table().phase(Phase.DRAW).build();

        assertEquals(List.of(new Event.DeckOut(HOST), new Event.GameEnded(AWAY, WinReason.DECK_OUT)),
                TurnManager.drawCard(state, HOST));
        GameState after = Evolver.fold(state, Decider.decide(state, HOST, new Command.AdvancePhase()));
        assertTrue(after.gameOver());
        assertEquals(AWAY, after.winner());
        assertEquals(WinReason.DECK_OUT, after.winReason());
    }

    @Test
    void testRestrictionsSkipBattleAndDraw() {
        DuelFixtures.Table table = DuelFixtures.table().phase(Phase.DRAW);
        table.fillDeck(HOST, 3);
        GameState state = Evolver.fold(table.build(), List.of(
                new Event.TurnRestrictionApplied(HOST, EffectAction.Restriction.DISABLE_DRAW_PHASE, "src", 1),
                new Event.TurnRestrictionApplied(HOST, EffectAction.Restriction.DISABLE_BATTLE_PHASE, "src", 1)));

        assertEquals(List.of(new Event.PhaseChanged(Phase.DRAW, Phase.STANDBY)),
                TurnManager.advancePhase(state, HOST));
        GameState main = state.toBuilder().currentPhase(Phase.MAIN).build();
        assertEquals(List.of(new Event.PhaseChanged(Phase.MAIN, Phase.MAIN2)), TurnManager.advancePhase(main, HOST));
    }

    @Test
    void testEndPhasePassesTurnAndExpiresModifiers() {
        DuelFixtures.Table table = DuelFixtures.table().phase(Phase.END);
        String brute = table.monster(HOST, "brute");
        GameState state = Evolver.fold(table.build(), List.of(
                new Event.ModifierApplied(brute, Stat.ATTACK, 300, "src", ModifierExpiry.END_OF_TURN),
                new Event.ModifierApplied(brute, Stat.DEFENSE, 100, "eq", ModifierExpiry.PERMANENT)));

        List<Event> events = TurnManager.advancePhase(state, HOST);
        assertEquals(List.of(
                new Event.TurnEnded(HOST),
                new Event.ModifierExpired(brute, Stat.ATTACK, 300, "src"),
                new Event.TurnStarted(AWAY, 3)), events);

        GameState after = Evolver.fold(state, events);
        assertEquals(AWAY, after.currentTurnPlayer());
        assertEquals(3, after.turnNumber());
        assertEquals(Phase.DRAW, after.currentPhase());
        assertEquals(0, after.host().findBoardCard(brute).orElseThrow().attackBoost());
        assertEquals(100, after.host().findBoardCard(brute).orElseThrow().defenseBoost());
    }

    @Test
    void testHandSizeDiscardsLastCards() {
        DuelFixtures.Table table = DuelFixtures.table().phase(Phase.END);
        for (int i = 0; i < 7; i++) {
            table.hand(HOST, "grunt");
        }
        String eighth = table.hand(HOST, "brute");
        String ninth = table.hand(HOST, "wall");
        GameState state = table.build();

        assertEquals(List.of(
                new Event.CardSentToGraveyard(eighth, Zone.HAND, HOST),
                new Event.CardSentToGraveyard(ninth, Zone.HAND, HOST)), TurnManager.handSizeDiscards(state));
    }

    // ==================== END TURN ====================

    @Test
    void testEndTurnOnlyFromLateMainPhases() {
        GameState state = DuelFixtures.table().build();
        assertTrue(Decider.decide(state, HOST, new Command.EndTurn()).isEmpty());
    }

    @Test
    void testEndTurnWalksRemainingPhases() {
        DuelFixtures.Table table = DuelFixtures.table().phase(Phase.MAIN2);
        for (int i = 0; i < 8; i++) {
            table.hand(HOST, "grunt");
        }
        String last = table.hand(HOST, "brute");
        table.fillDeck(AWAY, 2);
        GameState state = table.build();

        List<Event> events = Decider.decide(state, HOST, new Command.EndTurn());
        assertEquals(List.of(
                new Event.PhaseChanged(Phase.MAIN2, Phase.BREAKDOWN_CHECK),
                new Event.PhaseChanged(Phase.BREAKDOWN_CHECK, Phase.END)),
                DuelFixtures.ofKind(events, Event.Kind.PHASE_CHANGED));
        assertEquals(2, DuelFixtures.ofKind(events, Event.Kind.CARD_SENT_TO_GRAVEYARD).size());
        assertTrue(events.contains(new Event.CardSentToGraveyard(last, Zone.HAND, HOST)));
        assertEquals(new Event.TurnStarted(AWAY, 3), events.get(events.size() - 1));

        GameState after = Evolver.fold(state, events);
        assertEquals(7, after.host().hand().size());
        assertEquals(AWAY, after.currentTurnPlayer());
    }
}
