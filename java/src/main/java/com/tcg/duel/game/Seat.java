package com.tcg.duel.game;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * One of the two participants, fixed for the duel.
 */
public enum Seat {
    HOST("host"),
    AWAY("away");

    private final String jsonValue;

    Seat(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    public Seat opponent() {
        return this == HOST ? AWAY : HOST;
    }

    public static Seat fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Seat cannot be null");
        }
        return switch (value.toLowerCase()) {
            case "host" -> HOST;
            case "away" -> AWAY;
            default -> throw new IllegalArgumentException("Unknown seat: " + value);
        };
    }
}
