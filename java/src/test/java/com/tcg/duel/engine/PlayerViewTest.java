package com.tcg.duel.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.tcg.duel.DuelFixtures;
import com.tcg.duel.card.CardJson;
import com.tcg.duel.game.Event;
import com.tcg.duel.game.GameState;
import com.tcg.duel.game.zones.BoardCard;
import com.tcg.duel.game.zones.SpellTrapCard;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.tcg.duel.game.Seat.AWAY;
import static com.tcg.duel.game.Seat.HOST;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PlayerView and SpectatorView.
 */
class PlayerViewTest {

    private DuelFixtures.Table table;
    private String hostHand;
    private String awayHand;
    private String hostSet;
    private String awayFaceDown;
    private String awayFaceUp;
    private String awaySetTrap;

    private GameState layout() {
        table = DuelFixtures.table().fillDeck(HOST, 4).fillDeck(AWAY, 2);
        hostHand = table.hand(HOST, "fireball");
        awayHand = table.hand(AWAY, "dragon");
        hostSet = table.faceDownMonster(HOST, "wall");
        awayFaceDown = table.faceDownMonster(AWAY, "medic");
        awayFaceUp = table.monster(AWAY, "brute");
        awaySetTrap = table.setCard(AWAY, "pitfall");
        return table.build();
    }

    @Test
    void testOwnSideIsFullyVisible() {
        PlayerView view = PlayerView.mask(layout(), HOST);

        assertEquals(HOST, view.seat());
        assertEquals(List.of(hostHand), view.self().hand());
        assertEquals(1, view.self().handCount());
        assertEquals(4, view.self().deckCount());
        assertEquals("wall", view.self().board().get(0).definitionId());
    }

    @Test
    void testOpponentHiddenInformation() {
        PlayerView view = PlayerView.mask(layout(), HOST);

        assertTrue(view.opponent().hand().isEmpty());
        assertEquals(1, view.opponent().handCount());
        assertEquals(2, view.opponent().deckCount());

        BoardCard hidden = view.opponent().board().get(0);
        assertEquals(awayFaceDown, hidden.cardId());
        assertEquals(PlayerView.HIDDEN, hidden.definitionId());
        assertEquals("brute", view.opponent().board().get(1).definitionId());

        SpellTrapCard trap = view.opponent().spellTrapZone().get(0);
        assertEquals(awaySetTrap, trap.cardId());
        assertEquals(PlayerView.HIDDEN, trap.definitionId());
    }

    @Test
    void testSerializedViewLeaksNothing() throws JsonProcessingException {
        PlayerView view = PlayerView.mask(layout(), HOST);
        String json = CardJson.mapper().writeValueAsString(view);

        assertFalse(json.contains(awayHand));
        assertFalse(json.contains("\"medic\""));
        assertFalse(json.contains("\"pitfall\""));
        assertTrue(json.contains(awayFaceUp));
        assertTrue(json.contains("\"hand_count\""));
    }

    @Test
    void testCardDefinitionsCoverOnlyIdentifiableCards() {
        GameState state = layout();
        PlayerView view = PlayerView.mask(state, HOST);

        assertEquals("fireball", view.cardDefinitions().get(hostHand));
        assertEquals("wall", view.cardDefinitions().get(hostSet));
        assertEquals("brute", view.cardDefinitions().get(awayFaceUp));
        assertFalse(view.cardDefinitions().containsKey(awayHand));
        assertFalse(view.cardDefinitions().containsKey(awayFaceDown));
        assertFalse(view.cardDefinitions().containsKey(awaySetTrap));
        assertTrue(state.host().deck().stream().noneMatch(view.cardDefinitions()::containsKey));

        SpectatorView spectator = SpectatorView.of(state);
        assertEquals(Set.of(awayFaceUp), spectator.cardDefinitions().keySet());
    }

    @Test
    void testOpeningViewNamesOnlyOwnHand() throws JsonProcessingException {
        GameState state = DuelFixtures.engine().newDuel(DuelFixtures.SAMPLER_DECK, DuelFixtures.SAMPLER_DECK, HOST, 3);
        PlayerView view = PlayerView.mask(state, HOST);

        assertEquals(Set.copyOf(state.host().hand()), view.cardDefinitions().keySet());
        for (String id : state.host().hand()) {
            assertEquals(state.instances().get(id), view.cardDefinitions().get(id));
        }
        String json = CardJson.mapper().writeValueAsString(view);
        for (String id : state.away().hand()) {
            assertFalse(json.contains("\"" + id + "\""), "Opponent hand id " + id + " leaked");
        }
        assertTrue(SpectatorView.of(state).cardDefinitions().isEmpty());
    }

    @Test
    void testTopDeckViewOnlyForViewer() {
        GameState state = layout();
        List<String> top = state.host().deck().subList(0, 2);
        GameState viewed = Evolver.fold(state, List.of(new Event.TopCardsViewed(HOST, top, "src")));

        assertEquals(top, PlayerView.mask(viewed, HOST).topDeckView());
        assertTrue(PlayerView.mask(viewed, AWAY).topDeckView().isEmpty());
    }

    @Test
    void testSpectatorSeesNoHands() {
        SpectatorView view = SpectatorView.of(layout());

        assertTrue(view.host().hand().isEmpty());
        assertTrue(view.away().hand().isEmpty());
        assertEquals(1, view.host().handCount());
        assertEquals(PlayerView.HIDDEN, view.host().board().get(0).definitionId());
        assertEquals(hostSet, view.host().board().get(0).cardId());
        assertEquals(PlayerView.HIDDEN, view.away().board().get(0).definitionId());
    }
}
