package com.tcg.duel.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.tcg.duel.card.CardJson;
import com.tcg.duel.card.EffectAction;
import com.tcg.duel.card.EffectDefinition;
import com.tcg.duel.card.EffectType;
import com.tcg.duel.card.TargetFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Compiles authored ability records into effect definitions.
 * <p>
 * An ability whose operations all fail to parse is dropped. When nothing survives, the card has
 * no effects and {@link #compileAll} returns an empty Optional rather than an empty list.
 */
public final class EffectCompiler {
    private static final Logger log = LoggerFactory.getLogger(EffectCompiler.class);

    private static final String ON_SUMMON = "OnSummon";
    private static final String ON_MAIN_PHASE = "OnMainPhase";

    private static final Map<String, EffectType> TRIGGERS = Map.ofEntries(
            Map.entry(ON_SUMMON, EffectType.ON_SUMMON),
            Map.entry(ON_MAIN_PHASE, EffectType.IGNITION),
            Map.entry("OnTrapTargetingYou", EffectType.QUICK),
            Map.entry("OnTurnStart", EffectType.CONTINUOUS),
            Map.entry("OnGameStart", EffectType.CONTINUOUS)
    );

    private EffectCompiler() {
        // Utility class - prevent instantiation
    }

    // ==================== SINGLE ABILITY ====================

    /**
     * Compile one ability. The result may carry no actions; {@link #compileAll} filters those.
     *
     * @param ability the authored ability
     * @param index   position of the ability in its card's list, used for the effect id
     */
    public static EffectDefinition compile(AbilityRecord ability, int index) {
        List<String> operations = ability.operations() != null ? ability.operations() : List.of();

        List<EffectAction> actions = new ArrayList<>();
        for (String operation : operations) {
            OperationParser.parse(operation).ifPresent(actions::add);
        }

        TargetFilter filter = null;
        Integer targetCount = null;
        if (!ability.targets().isEmpty()) {
            Optional<TargetKeyword> keyword = TargetKeyword.lookup(ability.targets().get(0));
            if (keyword.isPresent()) {
                filter = keyword.get().filter();
                targetCount = keyword.get().targetCount();
            }
        }

        String trigger = ability.trigger();
        boolean oncePerTurn = ON_MAIN_PHASE.equals(trigger) || ON_SUMMON.equals(trigger);

        return new EffectDefinition(
                "eff_" + index,
                effectType(trigger, ability.speed()),
                String.join("; ", operations),
                filter,
                targetCount,
                actions,
                oncePerTurn,
                false);
    }

    /**
     * Trigger name to effect type. An explicit speed of ignition or quick overrides the trigger.
     */
    static EffectType effectType(String trigger, String speed) {
        if (speed != null) {
            String normalized = speed.trim();
            if (normalized.equals("ignition")) {
                return EffectType.IGNITION;
            }
            if (normalized.equals("quick") || normalized.equals("2")) {
                return EffectType.QUICK;
            }
        }
        return TRIGGERS.getOrDefault(trigger, EffectType.TRIGGER);
    }

    // ==================== ABILITY LISTS ====================

    /**
     * Compile a card's abilities, keeping only those that produced at least one action.
     *
     * @return the compiled effects, or empty when the card has none
     */
    public static Optional<List<EffectDefinition>> compileAll(List<AbilityRecord> abilities) {
        if (abilities == null || abilities.isEmpty()) {
            return Optional.empty();
        }
        List<EffectDefinition> results = new ArrayList<>();
        for (int i = 0; i < abilities.size(); i++) {
            AbilityRecord ability = abilities.get(i);
            if (ability == null || ability.trigger() == null || ability.trigger().isEmpty()
                    || ability.operations() == null) {
                continue;
            }
            EffectDefinition effect = compile(ability, i);
            if (!effect.actions().isEmpty()) {
                results.add(effect);
            }
        }
        return results.isEmpty() ? Optional.empty() : Optional.of(List.copyOf(results));
    }

    /**
     * Compile an untyped ability payload. Anything other than a JSON array has no effects;
     * malformed entries are skipped but keep their index.
     */
    public static Optional<List<EffectDefinition>> compileAll(JsonNode abilities) {
        if (abilities == null || !abilities.isArray() || abilities.isEmpty()) {
            return Optional.empty();
        }
        List<AbilityRecord> records = new ArrayList<>(abilities.size());
        for (JsonNode node : abilities) {
            records.add(toRecord(node));
        }
        return compileAll(records);
    }

    private static AbilityRecord toRecord(JsonNode node) {
        if (node == null || !node.isObject() || !node.path("operations").isArray()) {
            return null;
        }
        try {
            return CardJson.mapper().treeToValue(node, AbilityRecord.class);
        } catch (JsonProcessingException e) {
            log.debug("Skipping malformed ability {}: {}", node, e.getOriginalMessage());
            return null;
        }
    }
}
