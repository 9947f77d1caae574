package com.tcg.duel.match;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tcg.duel.game.Event;

import java.util.List;

/**
 * Outcome of a submission. A rejected command has no events and leaves the version unchanged.
 */
public record SubmitResult(
    @JsonProperty("events") List<Event> events,
    @JsonProperty("version") long version
) {
    public SubmitResult {
        events = List.copyOf(events);
    }

    public boolean accepted() {
        return !events.isEmpty();
    }
}
