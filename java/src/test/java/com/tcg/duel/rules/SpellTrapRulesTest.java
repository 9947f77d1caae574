package com.tcg.duel.rules;

import com.tcg.duel.DuelFixtures;
import com.tcg.duel.card.Zone;
import com.tcg.duel.engine.Evolver;
import com.tcg.duel.game.Command;
import com.tcg.duel.game.Event;
import com.tcg.duel.game.GameState;
import com.tcg.duel.game.Phase;
import com.tcg.duel.game.zones.SpellTrapCard;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tcg.duel.game.Seat.AWAY;
import static com.tcg.duel.game.Seat.HOST;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SpellTrapRules.
 */
class SpellTrapRulesTest {

    // ==================== SET ====================

    @Test
    void testSetSpellFaceDown() {
        DuelFixtures.Table table = DuelFixtures.table();
        String fireball = table.hand(HOST, "fireball");
        GameState state = table.build();

        List<Event> events = SpellTrapRules.setSpellTrap(state, HOST, new Command.SetSpellTrap(fireball));
        assertEquals(List.of(new Event.SpellTrapSet(HOST, fireball)), events);

        SpellTrapCard card = Evolver.fold(state, events).host().findSpellTrap(fireball).orElseThrow();
        assertTrue(card.faceDown());
        assertFalse(card.activated());
    }

    @Test
    void testCannotSetFieldSpellsOrMonsters() {
        DuelFixtures.Table table = DuelFixtures.table();
        String arena = table.hand(HOST, "arena");
        String grunt = table.hand(HOST, "grunt");
        GameState state = table.build();

        assertTrue(SpellTrapRules.setSpellTrap(state, HOST, new Command.SetSpellTrap(arena)).isEmpty());
        assertTrue(SpellTrapRules.setSpellTrap(state, HOST, new Command.SetSpellTrap(grunt)).isEmpty());
    }

    @Test
    void testSetNeedsFreeSlotAndMainPhase() {
        DuelFixtures.Table table = DuelFixtures.table();
        table.setCard(HOST, "pitfall");
        table.setCard(HOST, "pitfall");
        table.setCard(HOST, "pitfall");
        String trap = table.hand(HOST, "barrier");
        GameState full = table.build();
        assertTrue(SpellTrapRules.setSpellTrap(full, HOST, new Command.SetSpellTrap(trap)).isEmpty());

        DuelFixtures.Table other = DuelFixtures.table().phase(Phase.COMBAT);
        String barrier = other.hand(HOST, "barrier");
        assertTrue(SpellTrapRules.setSpellTrap(other.build(), HOST, new Command.SetSpellTrap(barrier)).isEmpty());
    }

    // ==================== SPELLS ====================

    @Test
    void testActivateSpellFromHandOpensChain() {
        DuelFixtures.Table table = DuelFixtures.table();
        String fireball = table.hand(HOST, "fireball");
        GameState state = table.build();

        List<Event> events = SpellTrapRules.activateSpell(state, HOST, new Command.ActivateSpell(fireball));
        assertEquals(List.of(
                new Event.ChainStarted(),
                new Event.ChainLinkAdded(HOST, fireball, 0, List.of()),
                new Event.SpellActivated(HOST, fireball, List.of())), events);

        GameState after = Evolver.fold(state, events);
        assertEquals(1, after.currentChain().size());
        assertEquals(AWAY, after.currentPriorityPlayer());
        SpellTrapCard card = after.host().findSpellTrap(fireball).orElseThrow();
        assertFalse(card.faceDown());
        assertTrue(card.activated());
    }

    @Test
    void testHandSpellsOnlyInMainPhase() {
        DuelFixtures.Table table = DuelFixtures.table().phase(Phase.COMBAT);
        String fireball = table.hand(HOST, "fireball");
        assertTrue(SpellTrapRules.activateSpell(table.build(), HOST, new Command.ActivateSpell(fireball)).isEmpty());
    }

    @Test
    void testSetQuickPlayActivatesAnyPhase() {
        DuelFixtures.Table table = DuelFixtures.table().phase(Phase.COMBAT);
        String flash = table.setCard(HOST, "flash");
        String fireball = table.setCard(HOST, "fireball");
        GameState state = table.build();

        assertFalse(SpellTrapRules.activateSpell(state, HOST, new Command.ActivateSpell(flash)).isEmpty());
        assertTrue(SpellTrapRules.activateSpell(state, HOST, new Command.ActivateSpell(fireball)).isEmpty(),
                "A set normal spell stays put");
    }

    @Test
    void testEquipNeedsOneFaceUpMonster() {
        DuelFixtures.Table table = DuelFixtures.table();
        String sword = table.hand(HOST, "sword");
        String brute = table.monster(HOST, "brute");
        String hidden = table.faceDownMonster(HOST, "wall");
        String enemy = table.monster(AWAY, "grunt");
        GameState state = table.build();

        assertTrue(SpellTrapRules.activateSpell(state, HOST, new Command.ActivateSpell(sword)).isEmpty());
        assertTrue(SpellTrapRules.activateSpell(state, HOST,
                new Command.ActivateSpell(sword, 0, List.of(hidden))).isEmpty());
        assertTrue(SpellTrapRules.activateSpell(state, HOST,
                new Command.ActivateSpell(sword, 0, List.of(enemy))).isEmpty());

        List<Event> events = SpellTrapRules.activateSpell(state, HOST,
                new Command.ActivateSpell(sword, 0, List.of(brute)));
        assertEquals(new Event.SpellEquipped(HOST, sword, brute), events.get(events.size() - 1));
        GameState after = Evolver.fold(state, events);
        assertEquals(List.of(sword), after.host().findBoardCard(brute).orElseThrow().equippedCards());
    }

    @Test
    void testFieldSpellReplacesCurrentOne() {
        DuelFixtures.Table table = DuelFixtures.table();
        String first = table.hand(HOST, "arena");
        String second = table.hand(HOST, "arena");
        GameState state = table.build();

        GameState withField = Evolver.fold(state,
                SpellTrapRules.activateSpell(state, HOST, new Command.ActivateSpell(first)));
        assertEquals(first, withField.host().fieldSpell().cardId());
        assertTrue(withField.host().spellTrapZone().isEmpty());

        List<Event> events = SpellTrapRules.activateSpell(withField, HOST, new Command.ActivateSpell(second));
        assertEquals(new Event.CardSentToGraveyard(first, Zone.FIELD, HOST), events.get(0));
        GameState after = Evolver.fold(withField, events);
        assertEquals(second, after.host().fieldSpell().cardId());
        assertEquals(List.of(first), after.host().graveyard());
    }

    @Test
    void testCardWithoutEffectsActivatesOnIndexZero() {
        DuelFixtures.Table table = DuelFixtures.table();
        String blank = table.hand(HOST, "blank");
        GameState state = table.build();

        assertFalse(SpellTrapRules.activateSpell(state, HOST, new Command.ActivateSpell(blank)).isEmpty());
        assertTrue(SpellTrapRules.activateSpell(state, HOST,
                new Command.ActivateSpell(blank, 1, List.of())).isEmpty());
    }

    // ==================== TRAPS ====================

    @Test
    void testTrapAutoTargets() {
        DuelFixtures.Table table = DuelFixtures.table();
        String pitfall = table.setCard(HOST, "pitfall");
        table.faceDownMonster(AWAY, "wall");
        String target = table.monster(AWAY, "brute");
        GameState state = table.build();

        List<Event> events = SpellTrapRules.activateTrap(state, HOST, new Command.ActivateTrap(pitfall));
        assertEquals(List.of(
                new Event.ChainStarted(),
                new Event.ChainLinkAdded(HOST, pitfall, 0, List.of(target)),
                new Event.TrapActivated(HOST, pitfall, List.of(target))), events);
    }

    @Test
    void testTrapNeedsTargetsAndMustBeSet() {
        DuelFixtures.Table table = DuelFixtures.table();
        String pitfall = table.setCard(HOST, "pitfall");
        String inHand = table.hand(HOST, "barrier");
        GameState state = table.build();

        assertTrue(SpellTrapRules.activateTrap(state, HOST, new Command.ActivateTrap(pitfall)).isEmpty(),
                "No face-up opponent monster to destroy");
        assertTrue(SpellTrapRules.activateTrap(state, HOST, new Command.ActivateTrap(inHand)).isEmpty());
    }

    @Test
    void testExplicitTrapTargetsAreValidated() {
        DuelFixtures.Table table = DuelFixtures.table();
        String pitfall = table.setCard(HOST, "pitfall");
        String mine = table.monster(HOST, "grunt");
        String first = table.monster(AWAY, "grunt");
        String second = table.monster(AWAY, "brute");
        GameState state = table.build();

        assertTrue(SpellTrapRules.activateTrap(state, HOST,
                new Command.ActivateTrap(pitfall, 0, List.of(mine))).isEmpty());
        assertTrue(SpellTrapRules.activateTrap(state, HOST,
                new Command.ActivateTrap(pitfall, 0, List.of(first, second))).isEmpty());
        assertEquals(new Event.TrapActivated(HOST, pitfall, List.of(second)),
                SpellTrapRules.activateTrap(state, HOST, new Command.ActivateTrap(pitfall, 0, List.of(second))).get(2));
    }
}
