package com.tcg.duel.match;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tcg.duel.game.Command;
import com.tcg.duel.game.Event;
import com.tcg.duel.game.Seat;

import java.util.List;

/**
 * Events of one accepted command, stamped with the version they produced.
 */
public record VersionedEventBatch(
    @JsonProperty("version") long version,
    @JsonProperty("seat") Seat seat,
    @JsonProperty("command") Command command,
    @JsonProperty("events") List<Event> events
) {
    public VersionedEventBatch {
        events = List.copyOf(events);
    }
}
