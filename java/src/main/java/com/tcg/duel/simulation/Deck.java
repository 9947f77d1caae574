package com.tcg.duel.simulation;

import com.tcg.duel.card.CardDatabase;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * A deck list: card definition ids, one entry per copy.
 */
public class Deck {
    private final List<String> cardIds;
    private final String name;

    public Deck(List<String> cardIds, String name) {
        this.cardIds = new ArrayList<>(cardIds);
        this.name = name;
    }

    /**
     * Load a deck from a file.
     * Format: "3 card_id" per line, supports comments with # or //
     *
     * @param path Path to the deck file
     * @param db   Card database every id must exist in
     * @return Parsed deck
     * @throws DeckException if the file cannot be read or parsed
     */
    public static Deck loadFromFile(String path, CardDatabase db) throws DeckException {
        String content;
        try {
            content = Files.readString(Path.of(path));
        } catch (IOException e) {
            throw new DeckException("Failed to read deck file: " + e.getMessage(), e);
        }
        String fileName = Path.of(path).getFileName().toString();
        String deckName = fileName.endsWith(".txt")
                ? fileName.substring(0, fileName.length() - 4)
                : fileName;
        return parse(content, deckName, db);
    }

    /**
     * Parse deck text.
     */
    public static Deck parse(String content, String name, CardDatabase db) throws DeckException {
        List<String> cardIds = new ArrayList<>();
        String[] lines = content.split("\n");

        for (int lineNum = 0; lineNum < lines.length; lineNum++) {
            String line = lines[lineNum].trim();

            if (line.isEmpty() || line.startsWith("#") || line.startsWith("//")) {
                continue;
            }

            int spaceIdx = line.indexOf(' ');
            if (spaceIdx == -1) {
                throw new DeckException("Invalid deck format at line " + (lineNum + 1)
                        + ": Expected format 'COUNT CARD_ID'");
            }

            String countStr = line.substring(0, spaceIdx);
            String cardId = line.substring(spaceIdx + 1).trim();

            int count;
            try {
                count = Integer.parseInt(countStr);
            } catch (NumberFormatException e) {
                throw new DeckException("Invalid deck format at line " + (lineNum + 1)
                        + ": '" + countStr + "' is not a valid number", e);
            }
            if (count < 1) {
                throw new DeckException("Invalid count at line " + (lineNum + 1) + ": " + count);
            }
            if (!db.hasCard(cardId)) {
                throw new DeckException("Card not found at line " + (lineNum + 1) + ": " + cardId);
            }
            for (int i = 0; i < count; i++) {
                cardIds.add(cardId);
            }
        }
        return new Deck(cardIds, name);
    }

    public List<String> getCardIds() {
        return new ArrayList<>(cardIds);
    }

    public int size() {
        return cardIds.size();
    }

    public String getName() {
        return name;
    }

    /**
     * Exception thrown when deck parsing fails.
     */
    public static class DeckException extends Exception {
        public DeckException(String message) {
            super(message);
        }

        public DeckException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
