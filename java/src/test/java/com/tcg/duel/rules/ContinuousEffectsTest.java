package com.tcg.duel.rules;

import com.tcg.duel.DuelFixtures;
import com.tcg.duel.card.Zone;
import com.tcg.duel.engine.Decider;
import com.tcg.duel.engine.Evolver;
import com.tcg.duel.game.Command;
import com.tcg.duel.game.Event;
import com.tcg.duel.game.GameState;
import com.tcg.duel.game.ModifierExpiry;
import com.tcg.duel.game.Position;
import com.tcg.duel.game.Seat;
import com.tcg.duel.game.Stat;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tcg.duel.game.Seat.AWAY;
import static com.tcg.duel.game.Seat.HOST;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ContinuousEffects and the cleanup when a lingering source leaves the field.
 */
class ContinuousEffectsTest {

    private static final Command PASS = Command.ChainResponse.passPriority();

    private static GameState act(GameState state, Seat seat, Command command) {
        List<Event> events = Decider.decide(state, seat, command);
        assertFalse(events.isEmpty(), seat + " could not " + command);
        return Evolver.fold(state, events);
    }

    private static GameState activateAndResolve(GameState state, String cardId) {
        GameState activated = act(state, HOST, new Command.ActivateSpell(cardId));
        return act(act(activated, AWAY, PASS), HOST, PASS);
    }

    private static int attackBoost(GameState state, String cardId) {
        return state.findBoardCard(cardId).orElseThrow().attackBoost();
    }

    // ==================== FIELD SPELLS ====================

    @Test
    void testReplacedFieldSpellTakesItsBoostAlong() {
        DuelFixtures.Table table = DuelFixtures.table();
        String brute = table.monster(HOST, "brute");
        String first = table.hand(HOST, "arena");
        String second = table.hand(HOST, "arena");

        GameState state = activateAndResolve(table.build(), first);
        assertEquals(200, attackBoost(state, brute));

        state = act(state, HOST, new Command.ActivateSpell(second));
        assertEquals(List.of(first), state.host().graveyard());
        assertEquals(0, attackBoost(state, brute), "The old field spell's boost ends with it");

        state = act(act(state, AWAY, PASS), HOST, PASS);
        assertEquals(200, attackBoost(state, brute));
        assertEquals(1, state.temporaryModifiers().size());
    }

    @Test
    void testMonsterArrivingLaterGetsFieldBoost() {
        DuelFixtures.Table table = DuelFixtures.table();
        String brute = table.monster(HOST, "brute");
        String arena = table.hand(HOST, "arena");
        String grunt = table.hand(HOST, "grunt");
        GameState state = activateAndResolve(table.build(), arena);

        List<Event> summon = Decider.decide(state, HOST, new Command.Summon(grunt, Position.ATTACK));
        assertEquals(List.of(
                new Event.MonsterSummoned(HOST, grunt, Position.ATTACK, List.of()),
                new Event.ModifierApplied(grunt, Stat.ATTACK, 200, arena, ModifierExpiry.PERMANENT)), summon);

        GameState after = Evolver.fold(state, summon);
        assertEquals(200, attackBoost(after, grunt));
        assertEquals(200, attackBoost(after, brute));
    }

    @Test
    void testDestroyedFieldSpellRevertsBoosts() {
        DuelFixtures.Table table = DuelFixtures.table();
        String brute = table.monster(HOST, "brute");
        String arena = table.hand(HOST, "arena");
        GameState state = activateAndResolve(table.build(), arena);

        GameState after = Evolver.fold(state, List.of(new Event.CardSentToGraveyard(arena, Zone.FIELD, HOST)));
        assertEquals(0, attackBoost(after, brute));
        assertTrue(after.temporaryModifiers().isEmpty());
        assertTrue(ContinuousEffects.refresh(after).isEmpty());
    }

    @Test
    void testNoBoostBeforeResolution() {
        DuelFixtures.Table table = DuelFixtures.table();
        table.monster(HOST, "brute");
        String arena = table.hand(HOST, "arena");
        GameState state = act(table.build(), HOST, new Command.ActivateSpell(arena));

        assertTrue(state.isChainOpen());
        assertTrue(ContinuousEffects.refresh(state).isEmpty());
    }

    @Test
    void testNegatedFieldSpellLeavesTheField() {
        DuelFixtures.Table table = DuelFixtures.table();
        String brute = table.monster(HOST, "brute");
        String arena = table.hand(HOST, "arena");
        String counter = table.setCard(AWAY, "counter");
        GameState state = act(table.build(), HOST, new Command.ActivateSpell(arena));

        state = act(state, AWAY, Command.ChainResponse.respond(counter, 0));
        state = act(act(state, HOST, PASS), AWAY, PASS);
        state = act(act(state, AWAY, PASS), HOST, PASS);

        assertFalse(state.isChainOpen());
        assertNull(state.host().fieldSpell());
        assertEquals(List.of(arena), state.host().graveyard());
        assertEquals(0, attackBoost(state, brute));
    }

    // ==================== CONTINUOUS SPELLS ====================

    @Test
    void testContinuousSpellBoostLastsWhileFaceUp() {
        DuelFixtures.Table table = DuelFixtures.table();
        String wall = table.monster(HOST, "wall");
        String banner = table.hand(HOST, "banner");
        String grunt = table.hand(HOST, "grunt");
        GameState state = activateAndResolve(table.build(), banner);
        assertEquals(300, state.findBoardCard(wall).orElseThrow().defenseBoost());
        assertTrue(state.host().findSpellTrap(banner).isPresent());

        state = act(state, HOST, new Command.Summon(grunt, Position.ATTACK));
        assertEquals(300, state.findBoardCard(grunt).orElseThrow().defenseBoost());

        GameState gone = Evolver.fold(state,
                List.of(new Event.CardReturnedToHand(banner, Zone.SPELL_TRAP_ZONE, HOST)));
        assertEquals(0, gone.findBoardCard(wall).orElseThrow().defenseBoost());
        assertEquals(0, gone.findBoardCard(grunt).orElseThrow().defenseBoost());
    }

    @Test
    void testEquipBoostDoesNotSpread() {
        DuelFixtures.Table table = DuelFixtures.table();
        String brute = table.monster(HOST, "brute");
        String sword = table.hand(HOST, "sword");
        String grunt = table.hand(HOST, "grunt");
        GameState state = act(table.build(), HOST, new Command.ActivateSpell(sword, 0, List.of(brute)));
        state = act(act(state, AWAY, PASS), HOST, PASS);
        assertEquals(500, attackBoost(state, brute));

        state = act(state, HOST, new Command.Summon(grunt, Position.ATTACK));
        assertEquals(0, attackBoost(state, grunt));
    }
}
