package com.tcg.duel.compiler;

import com.fasterxml.jackson.databind.JsonNode;
import com.tcg.duel.card.Amount;
import com.tcg.duel.card.CardJson;
import com.tcg.duel.card.CardType;
import com.tcg.duel.card.Duration;
import com.tcg.duel.card.EffectAction;
import com.tcg.duel.card.EffectDefinition;
import com.tcg.duel.card.EffectType;
import com.tcg.duel.card.Recipient;
import com.tcg.duel.card.TargetFilter;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EffectCompiler.
 */
class EffectCompilerTest {

    @Test
    void testCompileSummonBoost() {
        EffectDefinition effect = EffectCompiler.compile(
                AbilityRecord.of("OnSummon", "MODIFY_STAT: reputation +300"), 0);

        assertEquals("eff_0", effect.id());
        assertEquals(EffectType.ON_SUMMON, effect.type());
        assertTrue(effect.oncePerTurn());
        assertFalse(effect.hardOncePerTurn());
        assertEquals("MODIFY_STAT: reputation +300", effect.description());
        assertEquals(List.of(new EffectAction.BoostAttack(Amount.of(300), Duration.PERMANENT)), effect.actions());
    }

    @Test
    void testNegativeStatChangeBecomesDamage() {
        EffectDefinition effect = EffectCompiler.compile(
                AbilityRecord.of("OnMainPhase", "MODIFY_STAT: stability -200"), 2);

        assertEquals("eff_2", effect.id());
        assertEquals(EffectType.IGNITION, effect.type());
        assertEquals(List.of(new EffectAction.Damage(Amount.of(200), Recipient.OPPONENT)), effect.actions());
    }

    @Test
    void testVariableAmounts() {
        EffectDefinition graveyard = EffectCompiler.compile(AbilityRecord.of("OnMainPhase",
                "MODIFY_STAT: reputation +X equal to cards in your graveyard"), 0);
        assertEquals(new EffectAction.BoostAttack(new Amount.GraveyardCount(Recipient.SELF), Duration.PERMANENT),
                graveyard.actions().get(0));

        EffectDefinition opponent = EffectCompiler.compile(AbilityRecord.of("OnMainPhase",
                "MODIFY_STAT: stability +X for each card in your opponent's graveyard"), 0);
        assertEquals(new EffectAction.BoostDefense(new Amount.GraveyardCount(Recipient.OPPONENT), Duration.PERMANENT),
                opponent.actions().get(0));

        EffectDefinition mirror = EffectCompiler.compile(AbilityRecord.of("OnMainPhase",
                "MODIFY_STAT: reputation +X"), 0);
        assertEquals(new EffectAction.BoostAttack(new Amount.Mirror(), Duration.PERMANENT), mirror.actions().get(0));
    }

    @Test
    void testCardOperations() {
        EffectDefinition effect = EffectCompiler.compile(AbilityRecord.of("OnMainPhase",
                "DRAW: 2 cards", "DISCARD: all", "DESTROY: all traps", "NEGATE"), 0);

        assertEquals(List.of(
                new EffectAction.Draw(2),
                new EffectAction.Discard(OperationParser.DISCARD_ALL, Recipient.OPPONENT),
                new EffectAction.Destroy(EffectAction.DestroyTarget.ALL_SPELLS_TRAPS),
                new EffectAction.Negate()), effect.actions());
    }

    @Test
    void testUnsupportedOperationsCompileToNothing() {
        EffectDefinition effect = EffectCompiler.compile(AbilityRecord.of("OnMainPhase",
                "MODIFY_COST: spells +1", "SHUFFLE", "DRAW: 1"), 0);
        assertEquals(List.of(new EffectAction.Draw(1)), effect.actions());
        assertEquals("MODIFY_COST: spells +1; SHUFFLE; DRAW: 1", effect.description());
    }

    @Test
    void testEffectTypeFromTriggerAndSpeed() {
        assertEquals(EffectType.QUICK, EffectCompiler.effectType("OnTrapTargetingYou", "1"));
        assertEquals(EffectType.CONTINUOUS, EffectCompiler.effectType("OnTurnStart", null));
        assertEquals(EffectType.TRIGGER, EffectCompiler.effectType("OnSomethingElse", "1"));
        assertEquals(EffectType.QUICK, EffectCompiler.effectType("OnSummon", "2"));
        assertEquals(EffectType.QUICK, EffectCompiler.effectType("OnSummon", "quick"));
        assertEquals(EffectType.IGNITION, EffectCompiler.effectType("OnTurnStart", "ignition"));
    }

    @Test
    void testTargetKeywords() {
        EffectDefinition single = EffectCompiler.compile(new AbilityRecord("OnMainPhase", "1",
                List.of("opponentCard"), List.of("DESTROY: target")), 0);
        assertEquals(TargetFilter.Owner.OPPONENT, single.targetFilter().owner());
        assertEquals(1, single.requiredTargets());

        EffectDefinition allies = EffectCompiler.compile(new AbilityRecord("OnMainPhase", "1",
                List.of("Geeks", "opponent"), List.of("MODIFY_STAT: reputation +100")), 0);
        assertEquals(TargetFilter.Owner.SELF, allies.targetFilter().owner());
        assertEquals(CardType.MONSTER, allies.targetFilter().cardType());
        assertEquals(0, allies.requiredTargets());

        EffectDefinition unknown = EffectCompiler.compile(new AbilityRecord("OnMainPhase", "1",
                List.of("nobody"), List.of("DRAW: 1")), 0);
        assertNull(unknown.targetFilter());
    }

    @Test
    void testCompileAllDropsEmptyAbilities() {
        Optional<List<EffectDefinition>> effects = EffectCompiler.compileAll(List.of(
                AbilityRecord.of("OnMainPhase", "MODIFY_COST: all +1"),
                AbilityRecord.of("OnSummon", "DRAW: 1")));

        assertTrue(effects.isPresent());
        assertEquals(1, effects.get().size());
        assertEquals("eff_1", effects.get().get(0).id());
    }

    @Test
    void testCompileAllWithNothingLeft() {
        assertTrue(EffectCompiler.compileAll(List.of(AbilityRecord.of("OnMainPhase", "SHUFFLE"))).isEmpty());
        assertTrue(EffectCompiler.compileAll(List.<AbilityRecord>of()).isEmpty());
        assertTrue(EffectCompiler.compileAll((List<AbilityRecord>) null).isEmpty());
    }

    @Test
    void testCompileAllFromJson() throws Exception {
        JsonNode abilities = CardJson.mapper().readTree("""
                [
                  "not an ability",
                  {"trigger": "OnMainPhase", "speed": 2, "targets": ["self"], "operations": ["DRAW: 1"]},
                  {"trigger": "OnSummon"}
                ]
                """);

        Optional<List<EffectDefinition>> effects = EffectCompiler.compileAll(abilities);
        assertTrue(effects.isPresent());
        assertEquals(1, effects.get().size());
        EffectDefinition effect = effects.get().get(0);
        assertEquals("eff_1", effect.id());
        assertEquals(EffectType.QUICK, effect.type());
        assertEquals(TargetFilter.Owner.SELF, effect.targetFilter().owner());
    }

    @Test
    void testCompileAllFromNonArray() throws Exception {
        assertTrue(EffectCompiler.compileAll(CardJson.mapper().readTree("{\"trigger\": \"OnSummon\"}")).isEmpty());
        assertTrue(EffectCompiler.compileAll((JsonNode) null).isEmpty());
    }
}
