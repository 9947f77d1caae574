package com.tcg.duel.engine;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tcg.duel.game.ChainLink;
import com.tcg.duel.game.GameState;
import com.tcg.duel.game.Phase;
import com.tcg.duel.game.Seat;
import com.tcg.duel.game.TopDeckView;
import com.tcg.duel.game.WinReason;
import com.tcg.duel.game.zones.BoardCard;
import com.tcg.duel.game.zones.PlayerZones;
import com.tcg.duel.game.zones.SpellTrapCard;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * What one seat is allowed to see. The opponent's hand is reduced to a count, deck order is
 * never shown, and the opponent's face-down cards carry {@link #HIDDEN} as their definition.
 * Instance ids are opaque; {@code cardDefinitions} names the definition behind every id the
 * viewer may identify.
 */
public record PlayerView(
    @JsonProperty("seat") Seat seat,
    @JsonProperty("self") SideView self,
    @JsonProperty("opponent") SideView opponent,
    @JsonProperty("current_turn_player") Seat currentTurnPlayer,
    @JsonProperty("current_priority_player") Seat currentPriorityPlayer,
    @JsonProperty("turn_number") int turnNumber,
    @JsonProperty("current_phase") Phase currentPhase,
    @JsonProperty("current_chain") List<ChainLink> currentChain,
    @JsonProperty("max_board_slots") int maxBoardSlots,
    @JsonProperty("max_spell_trap_slots") int maxSpellTrapSlots,
    @JsonProperty("top_deck_view") List<String> topDeckView,
    @JsonProperty("card_definitions") Map<String, String> cardDefinitions,
    @JsonProperty("game_over") boolean gameOver,
    @JsonProperty("winner") Seat winner,
    @JsonProperty("win_reason") WinReason winReason
) {
    public static final String HIDDEN = "hidden";

    public static PlayerView mask(GameState state, Seat seat) {
        List<String> topDeck = state.topDeckView(seat).map(TopDeckView::cardIds).orElse(List.of());
        return new PlayerView(
                seat,
                SideView.owner(state.player(seat)),
                SideView.redacted(state.player(seat.opponent())),
                state.currentTurnPlayer(),
                state.currentPriorityPlayer(),
                state.turnNumber(),
                state.currentPhase(),
                state.currentChain(),
                state.config().maxBoardSlots(),
                state.config().maxSpellTrapSlots(),
                topDeck,
                visibleDefinitions(state, seat),
                state.gameOver(),
                state.winner(),
                state.winReason());
    }

    /**
     * Instance id to definition id for every card the viewer may identify: its own hand and
     * set cards, face-up cards on both sides, public piles, chain links and any top-deck view.
     * A null viewer is a spectator and sees only public cards.
     */
    static Map<String, String> visibleDefinitions(GameState state, Seat viewer) {
        Map<String, String> visible = new TreeMap<>();
        for (Seat seat : Seat.values()) {
            PlayerZones zones = state.player(seat);
            boolean own = seat == viewer;
            if (own) {
                zones.hand().forEach(id -> reveal(state, visible, id));
            }
            for (BoardCard card : zones.board()) {
                if (own || !card.faceDown()) {
                    reveal(state, visible, card.cardId());
                }
            }
            for (SpellTrapCard card : zones.spellTrapZone()) {
                if (own || !card.faceDown()) {
                    reveal(state, visible, card.cardId());
                }
            }
            SpellTrapCard field = zones.fieldSpell();
            if (field != null && (own || !field.faceDown())) {
                reveal(state, visible, field.cardId());
            }
            zones.graveyard().forEach(id -> reveal(state, visible, id));
            zones.banished().forEach(id -> reveal(state, visible, id));
        }
        state.currentChain().forEach(link -> reveal(state, visible, link.cardId()));
        if (viewer != null) {
            state.topDeckView(viewer).ifPresent(view -> view.cardIds().forEach(id -> reveal(state, visible, id)));
        }
        return Collections.unmodifiableMap(visible);
    }

    private static void reveal(GameState state, Map<String, String> visible, String cardId) {
        String definitionId = state.instances().get(cardId);
        if (definitionId != null) {
            visible.put(cardId, definitionId);
        }
    }

    /**
     * One seat's zones as seen by some viewer. {@code hand} is empty when the viewer may only
     * know {@code handCount}.
     */
    public record SideView(
        @JsonProperty("hand") List<String> hand,
        @JsonProperty("hand_count") int handCount,
        @JsonProperty("board") List<BoardCard> board,
        @JsonProperty("spell_trap_zone") List<SpellTrapCard> spellTrapZone,
        @JsonProperty("field_spell") SpellTrapCard fieldSpell,
        @JsonProperty("graveyard") List<String> graveyard,
        @JsonProperty("banished") List<String> banished,
        @JsonProperty("life_points") int lifePoints,
        @JsonProperty("deck_count") int deckCount,
        @JsonProperty("breakdowns_caused") int breakdownsCaused,
        @JsonProperty("normal_summoned_this_turn") boolean normalSummonedThisTurn
    ) {
        static SideView owner(PlayerZones zones) {
            return new SideView(zones.hand(), zones.hand().size(), zones.board(), zones.spellTrapZone(),
                    zones.fieldSpell(), zones.graveyard(), zones.banished(), zones.lifePoints(),
                    zones.deck().size(), zones.breakdownsCaused(), zones.normalSummonedThisTurn());
        }

        static SideView redacted(PlayerZones zones) {
            List<BoardCard> board = zones.board().stream().map(SideView::hide).toList();
            List<SpellTrapCard> spellTraps = zones.spellTrapZone().stream().map(SideView::hide).toList();
            SpellTrapCard field = zones.fieldSpell() != null ? hide(zones.fieldSpell()) : null;
            return new SideView(List.of(), zones.hand().size(), board, spellTraps, field, zones.graveyard(),
                    zones.banished(), zones.lifePoints(), zones.deck().size(), zones.breakdownsCaused(),
                    zones.normalSummonedThisTurn());
        }

        private static BoardCard hide(BoardCard card) {
            if (!card.faceDown()) {
                return card;
            }
            return new BoardCard(card.cardId(), HIDDEN, card.position(), true, card.canAttack(),
                    card.hasAttackedThisTurn(), card.changedPositionThisTurn(), card.viceCounters(),
                    card.attackBoost(), card.defenseBoost(), card.equippedCards(), card.turnSummoned());
        }

        private static SpellTrapCard hide(SpellTrapCard card) {
            if (!card.faceDown()) {
                return card;
            }
            return new SpellTrapCard(card.cardId(), HIDDEN, true, card.activated(), card.fieldSpell());
        }
    }
}
