package com.tcg.duel.rules;

import com.tcg.duel.DuelFixtures;
import com.tcg.duel.card.EffectAction;
import com.tcg.duel.card.Zone;
import com.tcg.duel.engine.Evolver;
import com.tcg.duel.game.BattleResult;
import com.tcg.duel.game.Command;
import com.tcg.duel.game.DestroyReason;
import com.tcg.duel.game.Event;
import com.tcg.duel.game.GameState;
import com.tcg.duel.game.ModifierExpiry;
import com.tcg.duel.game.Phase;
import com.tcg.duel.game.Position;
import com.tcg.duel.game.Stat;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tcg.duel.game.Seat.AWAY;
import static com.tcg.duel.game.Seat.HOST;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CombatRules.
 */
class CombatRulesTest {

    private static DuelFixtures.Table combat() {
        return DuelFixtures.table().phase(Phase.COMBAT);
    }

    // ==================== DECLARATION ====================

    @Test
    void testDirectAttackWhenNoFaceUpDefenders() {
        DuelFixtures.Table table = combat();
        String brute = table.monster(HOST, "brute");
        table.faceDownMonster(AWAY, "wall");
        GameState state = table.build();

        List<Event> events = CombatRules.declareAttack(state, HOST,
                new Command.DeclareAttack(brute, Command.DIRECT_ATTACK));
        assertEquals(List.of(
                new Event.AttackDeclared(HOST, brute, Command.DIRECT_ATTACK),
                new Event.DamageDealt(AWAY, 1800, true),
                new Event.BattleResolved(brute, Command.DIRECT_ATTACK, BattleResult.WIN)), events);

        GameState after = Evolver.fold(state, events);
        assertEquals(6200, after.away().lifePoints());
        assertTrue(after.host().findBoardCard(brute).orElseThrow().hasAttackedThisTurn());
    }

    @Test
    void testNoDirectAttackPastFaceUpMonster() {
        DuelFixtures.Table table = combat();
        String brute = table.monster(HOST, "brute");
        table.monster(AWAY, "wall", Position.DEFENSE);
        GameState state = table.build();

        assertTrue(CombatRules.declareAttack(state, HOST,
                new Command.DeclareAttack(brute, Command.DIRECT_ATTACK)).isEmpty());
    }

    @Test
    void testAttackOutsideCombatOrOnFirstTurn() {
        DuelFixtures.Table table = DuelFixtures.table();
        String brute = table.monster(HOST, "brute");
        GameState main = table.build();
        Command.DeclareAttack attack = new Command.DeclareAttack(brute, Command.DIRECT_ATTACK);

        assertTrue(CombatRules.declareAttack(main, HOST, attack).isEmpty());
        GameState firstTurn = main.toBuilder().currentPhase(Phase.COMBAT).turnNumber(1).build();
        assertTrue(CombatRules.declareAttack(firstTurn, HOST, attack).isEmpty());
        GameState secondTurn = main.toBuilder().currentPhase(Phase.COMBAT).build();
        assertFalse(CombatRules.declareAttack(secondTurn, HOST, attack).isEmpty());
    }

    @Test
    void testAttackerMustBeReady() {
        DuelFixtures.Table table = combat();
        String fresh = table.monster(HOST, "wall");
        String hidden = table.faceDownMonster(HOST, "grunt");
        String attacker = table.monster(HOST, "brute");
        GameState built = table.build();
        GameState state = built.withPlayer(HOST,
                built.host().mapBoardCard(fresh, c -> c.withTurnFlags(false, false, false)));

        assertTrue(CombatRules.declareAttack(state, HOST,
                new Command.DeclareAttack(fresh, Command.DIRECT_ATTACK)).isEmpty(), "Summoned this turn");
        assertTrue(CombatRules.declareAttack(state, HOST,
                new Command.DeclareAttack(hidden, Command.DIRECT_ATTACK)).isEmpty());

        List<Event> first = CombatRules.declareAttack(state, HOST,
                new Command.DeclareAttack(attacker, Command.DIRECT_ATTACK));
        GameState after = Evolver.fold(state, first);
        assertTrue(CombatRules.declareAttack(after, HOST,
                new Command.DeclareAttack(attacker, Command.DIRECT_ATTACK)).isEmpty(), "One attack per turn");
    }

    @Test
    void testDefensePositionMonsterMayAttack() {
        DuelFixtures.Table table = combat();
        String wall = table.monster(HOST, "wall", Position.DEFENSE);
        GameState state = table.build();

        List<Event> events = CombatRules.declareAttack(state, HOST,
                new Command.DeclareAttack(wall, Command.DIRECT_ATTACK));
        assertEquals(List.of(
                new Event.AttackDeclared(HOST, wall, Command.DIRECT_ATTACK),
                new Event.DamageDealt(AWAY, 500, true),
                new Event.BattleResolved(wall, Command.DIRECT_ATTACK, BattleResult.WIN)), events);
        assertTrue(DuelFixtures.engine().legalMoves(state, HOST)
                .contains(new Command.DeclareAttack(wall, Command.DIRECT_ATTACK)));
    }

    @Test
    void testAttackRestriction() {
        DuelFixtures.Table table = combat();
        String brute = table.monster(HOST, "brute");
        GameState state = table.build();
        GameState locked = Evolver.fold(state, List.of(new Event.TurnRestrictionApplied(HOST,
                EffectAction.Restriction.DISABLE_ATTACKS, "src", 1)));

        assertTrue(CombatRules.declareAttack(locked, HOST,
                new Command.DeclareAttack(brute, Command.DIRECT_ATTACK)).isEmpty());
    }

    // ==================== BATTLE MATH ====================

    @Test
    void testAttackPositionWin() {
        DuelFixtures.Table table = combat();
        String brute = table.monster(HOST, "brute");
        String grunt = table.monster(AWAY, "grunt");
        GameState state = table.build();

        List<Event> events = CombatRules.declareAttack(state, HOST, new Command.DeclareAttack(brute, grunt));
        assertEquals(List.of(
                new Event.AttackDeclared(HOST, brute, grunt),
                new Event.CardDestroyed(grunt, DestroyReason.BATTLE),
                new Event.CardSentToGraveyard(grunt, Zone.BOARD, AWAY),
                new Event.DamageDealt(AWAY, 800, true),
                new Event.BattleResolved(brute, grunt, BattleResult.WIN)), events);
    }

    @Test
    void testAttackPositionLoss() {
        DuelFixtures.Table table = combat();
        String grunt = table.monster(HOST, "grunt");
        String brute = table.monster(AWAY, "brute");
        GameState state = table.build();

        GameState after = Evolver.fold(state,
                CombatRules.declareAttack(state, HOST, new Command.DeclareAttack(grunt, brute)));
        assertEquals(List.of(grunt), after.host().graveyard());
        assertEquals(7200, after.host().lifePoints());
        assertEquals(8000, after.away().lifePoints());
        assertTrue(after.away().findBoardCard(brute).isPresent());
    }

    @Test
    void testAttackPositionTieDestroysBoth() {
        DuelFixtures.Table table = combat();
        String mine = table.monster(HOST, "grunt");
        String theirs = table.monster(AWAY, "grunt");
        GameState state = table.build();

        List<Event> events = CombatRules.declareAttack(state, HOST, new Command.DeclareAttack(mine, theirs));
        assertTrue(DuelFixtures.ofKind(events, Event.Kind.DAMAGE_DEALT).isEmpty());
        GameState after = Evolver.fold(state, events);
        assertTrue(after.host().board().isEmpty());
        assertTrue(after.away().board().isEmpty());
    }

    @Test
    void testDefensePositionOutcomes() {
        DuelFixtures.Table table = combat();
        String brute = table.monster(HOST, "brute");
        String grunt = table.monster(HOST, "grunt");
        String weak = table.monster(AWAY, "grunt", Position.DEFENSE);
        String wall = table.monster(AWAY, "wall", Position.DEFENSE);
        GameState state = table.build();

        // 1800 into 800 defense: destroyed, no piercing damage
        List<Event> win = CombatRules.declareAttack(state, HOST, new Command.DeclareAttack(brute, weak));
        assertTrue(DuelFixtures.ofKind(win, Event.Kind.DAMAGE_DEALT).isEmpty());
        assertEquals(BattleResult.WIN, ((Event.BattleResolved) win.get(win.size() - 1)).result());

        // 1000 into 2000 defense: bounces, attacker's controller takes 1000
        List<Event> loss = CombatRules.declareAttack(state, HOST, new Command.DeclareAttack(grunt, wall));
        assertEquals(List.of(new Event.DamageDealt(HOST, 1000, true)),
                DuelFixtures.ofKind(loss, Event.Kind.DAMAGE_DEALT));
        assertTrue(DuelFixtures.ofKind(loss, Event.Kind.CARD_DESTROYED).isEmpty());
    }

    @Test
    void testFaceDownDefenderStaysFaceDown() {
        DuelFixtures.Table table = combat();
        String brute = table.monster(HOST, "brute");
        String wall = table.faceDownMonster(AWAY, "wall");
        GameState state = table.build();

        GameState after = Evolver.fold(state,
                CombatRules.declareAttack(state, HOST, new Command.DeclareAttack(brute, wall)));
        assertTrue(after.away().findBoardCard(wall).orElseThrow().faceDown());
        assertEquals(7800, after.host().lifePoints());
    }

    @Test
    void testBoostsCountInBattle() {
        DuelFixtures.Table table = combat();
        String grunt = table.monster(HOST, "grunt");
        String brute = table.monster(AWAY, "brute");
        GameState state = table.build();
        GameState boosted = Evolver.fold(state, List.of(new Event.ModifierApplied(grunt,
                Stat.ATTACK, 1000, "src", ModifierExpiry.END_OF_TURN)));

        List<Event> events = CombatRules.declareAttack(boosted, HOST, new Command.DeclareAttack(grunt, brute));
        assertEquals(List.of(new Event.DamageDealt(AWAY, 200, true)),
                DuelFixtures.ofKind(events, Event.Kind.DAMAGE_DEALT));
    }
}
