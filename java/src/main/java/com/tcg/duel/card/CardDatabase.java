package com.tcg.duel.card;

import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only card catalog loaded once from JSON and shared by every duel.
 */
public class CardDatabase {
    private static final Logger log = LoggerFactory.getLogger(CardDatabase.class);
    private static final TypeReference<List<CardDefinition>> CARD_LIST = new TypeReference<>() {};

    private final Map<String, CardDefinition> cards;

    private CardDatabase(Map<String, CardDefinition> cards) {
        this.cards = Collections.unmodifiableMap(cards);
    }

    /**
     * Load cards from a JSON file.
     */
    public static CardDatabase fromFile(String path) throws CardDatabaseException {
        try {
            String content = Files.readString(Path.of(path));
            return fromJson(content);
        } catch (IOException e) {
            throw new CardDatabaseException("IO error: " + e.getMessage(), e);
        }
    }

    /**
     * Load cards from a classpath resource.
     */
    public static CardDatabase fromResource(String resourcePath) throws CardDatabaseException {
        try (InputStream is = CardDatabase.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new CardDatabaseException("Resource not found: " + resourcePath);
            }
            return fromCardList(CardJson.mapper().readValue(is, CARD_LIST));
        } catch (IOException e) {
            throw new CardDatabaseException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    /**
     * Load cards from a JSON string.
     */
    public static CardDatabase fromJson(String json) throws CardDatabaseException {
        try {
            return fromCardList(CardJson.mapper().readValue(json, CARD_LIST));
        } catch (IOException e) {
            throw new CardDatabaseException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    public static CardDatabase of(List<CardDefinition> cardList) throws CardDatabaseException {
        return fromCardList(cardList);
    }

    private static CardDatabase fromCardList(List<CardDefinition> cardList) throws CardDatabaseException {
        Map<String, CardDefinition> cards = new LinkedHashMap<>();
        for (CardDefinition card : cardList) {
            if (cards.put(card.getId(), card) != null) {
                throw new CardDatabaseException("Duplicate card id: " + card.getId());
            }
        }
        log.debug("Loaded {} card definitions", cards.size());
        return new CardDatabase(cards);
    }

    /**
     * Get a card by id.
     * @throws CardDatabaseException if the card is not found
     */
    public CardDefinition getCard(String id) throws CardDatabaseException {
        CardDefinition card = cards.get(id);
        if (card == null) {
            throw new CardDatabaseException("Card not found: " + id);
        }
        return card;
    }

    public int cardCount() {
        return cards.size();
    }

    public boolean hasCard(String id) {
        return cards.containsKey(id);
    }

    /**
     * Read-only id to definition lookup handed to the engine.
     */
    public Map<String, CardDefinition> asLookup() {
        return cards;
    }
}
