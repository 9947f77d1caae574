package com.tcg.duel.game.zones;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tcg.duel.card.Zone;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Everything one seat owns. Deck index 0 is the top card.
 */
public record PlayerZones(
    @JsonProperty("hand") List<String> hand,
    @JsonProperty("board") List<BoardCard> board,
    @JsonProperty("spell_trap_zone") List<SpellTrapCard> spellTrapZone,
    @JsonProperty("field_spell") SpellTrapCard fieldSpell,
    @JsonProperty("deck") List<String> deck,
    @JsonProperty("graveyard") List<String> graveyard,
    @JsonProperty("banished") List<String> banished,
    @JsonProperty("life_points") int lifePoints,
    @JsonProperty("breakdowns_caused") int breakdownsCaused,
    @JsonProperty("normal_summoned_this_turn") boolean normalSummonedThisTurn
) {
    public PlayerZones {
        hand = List.copyOf(hand);
        board = List.copyOf(board);
        spellTrapZone = List.copyOf(spellTrapZone);
        deck = List.copyOf(deck);
        graveyard = List.copyOf(graveyard);
        banished = List.copyOf(banished);
    }

    public static PlayerZones initial(List<String> hand, List<String> deck, int lifePoints) {
        return new PlayerZones(hand, List.of(), List.of(), null, deck, List.of(), List.of(),
                lifePoints, 0, false);
    }

    // ==================== LOOKUPS ====================

    public Optional<BoardCard> findBoardCard(String cardId) {
        return board.stream().filter(c -> c.cardId().equals(cardId)).findFirst();
    }

    /**
     * Spell/trap zone first, then the field slot.
     */
    public Optional<SpellTrapCard> findSpellTrap(String cardId) {
        Optional<SpellTrapCard> inZone = spellTrapZone.stream().filter(c -> c.cardId().equals(cardId)).findFirst();
        if (inZone.isPresent()) {
            return inZone;
        }
        if (fieldSpell != null && fieldSpell.cardId().equals(cardId)) {
            return Optional.of(fieldSpell);
        }
        return Optional.empty();
    }

    /**
     * Zone holding the card, searched in the order hand, graveyard, banished, board,
     * spell/trap zone, field, deck.
     */
    public Optional<Zone> locate(String cardId) {
        if (hand.contains(cardId)) {
            return Optional.of(Zone.HAND);
        }
        if (graveyard.contains(cardId)) {
            return Optional.of(Zone.GRAVEYARD);
        }
        if (banished.contains(cardId)) {
            return Optional.of(Zone.BANISHED);
        }
        if (findBoardCard(cardId).isPresent()) {
            return Optional.of(Zone.BOARD);
        }
        if (spellTrapZone.stream().anyMatch(c -> c.cardId().equals(cardId))) {
            return Optional.of(Zone.SPELL_TRAP_ZONE);
        }
        if (fieldSpell != null && fieldSpell.cardId().equals(cardId)) {
            return Optional.of(Zone.FIELD);
        }
        if (deck.contains(cardId)) {
            return Optional.of(Zone.DECK);
        }
        return Optional.empty();
    }

    @JsonIgnore
    public List<BoardCard> faceUpMonsters() {
        return board.stream().filter(BoardCard::isFaceUp).toList();
    }

    // ==================== TRANSFORMS ====================

    public PlayerZones withHand(List<String> newHand) {
        return new PlayerZones(newHand, board, spellTrapZone, fieldSpell, deck, graveyard, banished,
                lifePoints, breakdownsCaused, normalSummonedThisTurn);
    }

    public PlayerZones withBoard(List<BoardCard> newBoard) {
        return new PlayerZones(hand, newBoard, spellTrapZone, fieldSpell, deck, graveyard, banished,
                lifePoints, breakdownsCaused, normalSummonedThisTurn);
    }

    public PlayerZones withSpellTrapZone(List<SpellTrapCard> newZone) {
        return new PlayerZones(hand, board, newZone, fieldSpell, deck, graveyard, banished,
                lifePoints, breakdownsCaused, normalSummonedThisTurn);
    }

    public PlayerZones withFieldSpell(SpellTrapCard newFieldSpell) {
        return new PlayerZones(hand, board, spellTrapZone, newFieldSpell, deck, graveyard, banished,
                lifePoints, breakdownsCaused, normalSummonedThisTurn);
    }

    public PlayerZones withDeck(List<String> newDeck) {
        return new PlayerZones(hand, board, spellTrapZone, fieldSpell, newDeck, graveyard, banished,
                lifePoints, breakdownsCaused, normalSummonedThisTurn);
    }

    public PlayerZones withGraveyard(List<String> newGraveyard) {
        return new PlayerZones(hand, board, spellTrapZone, fieldSpell, deck, newGraveyard, banished,
                lifePoints, breakdownsCaused, normalSummonedThisTurn);
    }

    public PlayerZones withBanished(List<String> newBanished) {
        return new PlayerZones(hand, board, spellTrapZone, fieldSpell, deck, graveyard, newBanished,
                lifePoints, breakdownsCaused, normalSummonedThisTurn);
    }

    public PlayerZones withLifePoints(int lp) {
        return new PlayerZones(hand, board, spellTrapZone, fieldSpell, deck, graveyard, banished,
                lp, breakdownsCaused, normalSummonedThisTurn);
    }

    public PlayerZones withBreakdownsCaused(int count) {
        return new PlayerZones(hand, board, spellTrapZone, fieldSpell, deck, graveyard, banished,
                lifePoints, count, normalSummonedThisTurn);
    }

    public PlayerZones withNormalSummoned(boolean summoned) {
        return new PlayerZones(hand, board, spellTrapZone, fieldSpell, deck, graveyard, banished,
                lifePoints, breakdownsCaused, summoned);
    }

    public PlayerZones mapBoardCard(String cardId, UnaryOperator<BoardCard> fn) {
        List<BoardCard> updated = new ArrayList<>(board.size());
        for (BoardCard card : board) {
            updated.add(card.cardId().equals(cardId) ? fn.apply(card) : card);
        }
        return withBoard(updated);
    }

    public PlayerZones mapBoard(UnaryOperator<BoardCard> fn) {
        return withBoard(board.stream().map(fn).toList());
    }

    public PlayerZones addToHand(String cardId) {
        return withHand(append(hand, cardId));
    }

    public PlayerZones addToGraveyard(String cardId) {
        return withGraveyard(append(graveyard, cardId));
    }

    public PlayerZones addToBanished(String cardId) {
        return withBanished(append(banished, cardId));
    }

    public PlayerZones addToBoard(BoardCard card) {
        List<BoardCard> updated = new ArrayList<>(board);
        updated.add(card);
        return withBoard(updated);
    }

    public PlayerZones addToSpellTrapZone(SpellTrapCard card) {
        List<SpellTrapCard> updated = new ArrayList<>(spellTrapZone);
        updated.add(card);
        return withSpellTrapZone(updated);
    }

    /**
     * Removes the card from whichever zone holds it. Unknown ids leave the zones unchanged.
     */
    public PlayerZones remove(String cardId) {
        PlayerZones result = this;
        if (hand.contains(cardId)) {
            result = result.withHand(without(hand, cardId));
        }
        if (graveyard.contains(cardId)) {
            result = result.withGraveyard(without(graveyard, cardId));
        }
        if (banished.contains(cardId)) {
            result = result.withBanished(without(banished, cardId));
        }
        if (deck.contains(cardId)) {
            result = result.withDeck(without(deck, cardId));
        }
        if (findBoardCard(cardId).isPresent()) {
            result = result.withBoard(board.stream().filter(c -> !c.cardId().equals(cardId)).toList());
        }
        if (spellTrapZone.stream().anyMatch(c -> c.cardId().equals(cardId))) {
            result = result.withSpellTrapZone(
                    spellTrapZone.stream().filter(c -> !c.cardId().equals(cardId)).toList());
        }
        if (fieldSpell != null && fieldSpell.cardId().equals(cardId)) {
            result = result.withFieldSpell(null);
        }
        return result;
    }

    private static List<String> append(List<String> list, String value) {
        List<String> updated = new ArrayList<>(list);
        updated.add(value);
        return updated;
    }

    private static List<String> without(List<String> list, String value) {
        List<String> updated = new ArrayList<>(list);
        updated.remove(value);
        return updated;
    }
}
