package com.tcg.duel.card;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A compiled card effect: when it applies, what it may target and the ordered actions it runs.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EffectDefinition(
    @JsonProperty("id") String id,
    @JsonProperty("type") EffectType type,
    @JsonProperty("description") String description,
    @JsonProperty("target_filter") TargetFilter targetFilter,
    @JsonProperty("target_count") Integer targetCount,
    @JsonProperty("actions") List<EffectAction> actions,
    @JsonProperty("once_per_turn") boolean oncePerTurn,
    @JsonProperty("hard_once_per_turn") boolean hardOncePerTurn
) {
    public EffectDefinition {
        actions = actions != null ? List.copyOf(actions) : List.of();
        description = description != null ? description : "";
    }

    public static EffectDefinition of(String id, EffectType type, EffectAction... actions) {
        return new EffectDefinition(id, type, "", null, null, List.of(actions), false, false);
    }

    public EffectDefinition withTargets(TargetFilter filter, Integer count) {
        return new EffectDefinition(id, type, description, filter, count, actions, oncePerTurn, hardOncePerTurn);
    }

    public EffectDefinition withOncePerTurn(boolean soft, boolean hard) {
        return new EffectDefinition(id, type, description, targetFilter, targetCount, actions, soft, hard);
    }

    /**
     * Number of targets the effect needs, 0 when it selects none.
     */
    public int requiredTargets() {
        return targetCount != null ? Math.max(0, targetCount) : 0;
    }
}
