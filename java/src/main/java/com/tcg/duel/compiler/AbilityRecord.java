package com.tcg.duel.compiler;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Raw ability as authored in the card data feed.
 *
 * @param speed numeric or textual speed; numbers arrive as their decimal text
 */
public record AbilityRecord(
    @JsonProperty("trigger") String trigger,
    @JsonProperty("speed") String speed,
    @JsonProperty("targets") List<String> targets,
    @JsonProperty("operations") List<String> operations
) {
    public AbilityRecord {
        targets = targets != null ? List.copyOf(targets) : List.of();
    }

    public static AbilityRecord of(String trigger, String... operations) {
        return new AbilityRecord(trigger, "1", List.of(), List.of(operations));
    }
}
