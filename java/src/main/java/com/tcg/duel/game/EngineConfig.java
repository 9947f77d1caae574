package com.tcg.duel.game;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tcg.duel.card.CardJson;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Duel tunables. Keys missing from a JSON config keep their defaults.
 */
public record EngineConfig(
    @JsonProperty("starting_lp") int startingLP,
    @JsonProperty("starting_hand_size") int startingHandSize,
    @JsonProperty("max_hand_size") int maxHandSize,
    @JsonProperty("max_board_slots") int maxBoardSlots,
    @JsonProperty("max_spell_trap_slots") int maxSpellTrapSlots,
    @JsonProperty("breakdown_threshold") int breakdownThreshold,
    @JsonProperty("max_breakdowns_to_win") int maxBreakdownsToWin,
    @JsonProperty("tribute_level_threshold") int tributeLevelThreshold,
    @JsonProperty("tributes_required") int tributesRequired
) {
    public static final int DEFAULT_STARTING_LP = 8000;
    public static final int DEFAULT_STARTING_HAND_SIZE = 5;
    public static final int DEFAULT_MAX_HAND_SIZE = 7;
    public static final int DEFAULT_MAX_BOARD_SLOTS = 3;
    public static final int DEFAULT_MAX_SPELL_TRAP_SLOTS = 3;
    public static final int DEFAULT_BREAKDOWN_THRESHOLD = 3;
    public static final int DEFAULT_MAX_BREAKDOWNS_TO_WIN = 3;
    public static final int DEFAULT_TRIBUTE_LEVEL_THRESHOLD = 7;
    public static final int DEFAULT_TRIBUTES_REQUIRED = 1;

    public static EngineConfig defaults() {
        return new EngineConfig(DEFAULT_STARTING_LP, DEFAULT_STARTING_HAND_SIZE, DEFAULT_MAX_HAND_SIZE,
                DEFAULT_MAX_BOARD_SLOTS, DEFAULT_MAX_SPELL_TRAP_SLOTS, DEFAULT_BREAKDOWN_THRESHOLD,
                DEFAULT_MAX_BREAKDOWNS_TO_WIN, DEFAULT_TRIBUTE_LEVEL_THRESHOLD, DEFAULT_TRIBUTES_REQUIRED);
    }

    @JsonCreator
    public static EngineConfig fromJson(
            @JsonProperty("starting_lp") Integer startingLP,
            @JsonProperty("starting_hand_size") Integer startingHandSize,
            @JsonProperty("max_hand_size") Integer maxHandSize,
            @JsonProperty("max_board_slots") Integer maxBoardSlots,
            @JsonProperty("max_spell_trap_slots") Integer maxSpellTrapSlots,
            @JsonProperty("breakdown_threshold") Integer breakdownThreshold,
            @JsonProperty("max_breakdowns_to_win") Integer maxBreakdownsToWin,
            @JsonProperty("tribute_level_threshold") Integer tributeLevelThreshold,
            @JsonProperty("tributes_required") Integer tributesRequired) {
        return new EngineConfig(
                orDefault(startingLP, DEFAULT_STARTING_LP),
                orDefault(startingHandSize, DEFAULT_STARTING_HAND_SIZE),
                orDefault(maxHandSize, DEFAULT_MAX_HAND_SIZE),
                orDefault(maxBoardSlots, DEFAULT_MAX_BOARD_SLOTS),
                orDefault(maxSpellTrapSlots, DEFAULT_MAX_SPELL_TRAP_SLOTS),
                orDefault(breakdownThreshold, DEFAULT_BREAKDOWN_THRESHOLD),
                orDefault(maxBreakdownsToWin, DEFAULT_MAX_BREAKDOWNS_TO_WIN),
                orDefault(tributeLevelThreshold, DEFAULT_TRIBUTE_LEVEL_THRESHOLD),
                orDefault(tributesRequired, DEFAULT_TRIBUTES_REQUIRED));
    }

    /**
     * Load a config from a JSON file.
     */
    public static EngineConfig fromFile(String path) throws IOException {
        return CardJson.mapper().readValue(Files.readString(Path.of(path)), EngineConfig.class);
    }

    public EngineConfig withStartingLP(int lp) {
        return new EngineConfig(lp, startingHandSize, maxHandSize, maxBoardSlots, maxSpellTrapSlots,
                breakdownThreshold, maxBreakdownsToWin, tributeLevelThreshold, tributesRequired);
    }

    private static int orDefault(Integer value, int fallback) {
        return value != null ? value : fallback;
    }
}
