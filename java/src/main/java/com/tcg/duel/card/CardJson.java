package com.tcg.duel.card;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Shared Jackson configuration for catalog files, commands, events and views.
 */
public final class CardJson {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

    private CardJson() {
        // Utility class - prevent instantiation
    }

    /**
     * The shared mapper. ObjectMapper is thread-safe once configured.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
