package com.tcg.duel.rules;

import com.tcg.duel.card.CardDefinition;
import com.tcg.duel.card.EffectDefinition;
import com.tcg.duel.card.Zone;
import com.tcg.duel.game.Command;
import com.tcg.duel.game.Event;
import com.tcg.duel.game.GameState;
import com.tcg.duel.game.Seat;
import com.tcg.duel.game.zones.BoardCard;
import com.tcg.duel.game.zones.PlayerZones;
import com.tcg.duel.game.zones.SpellTrapCard;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Setting and activating spells and traps. Every activation opens a chain; the card's effect
 * runs when its link resolves.
 */
public final class SpellTrapRules {

    private SpellTrapRules() {
        // Utility class - prevent instantiation
    }

    // ==================== SET ====================

    /**
     * Set a spell or trap face-down. Field spells can only be activated.
     */
    public static List<Event> setSpellTrap(GameState state, Seat seat, Command.SetSpellTrap command) {
        PlayerZones zones = state.player(seat);
        if (!state.currentPhase().isMainPhase() || command.cardId() == null
                || !zones.hand().contains(command.cardId())) {
            return List.of();
        }
        CardDefinition card = state.definitionOf(command.cardId());
        if (card == null || card.isMonster() || card.isFieldSpell()
                || zones.spellTrapZone().size() >= state.config().maxSpellTrapSlots()) {
            return List.of();
        }
        return List.of(new Event.SpellTrapSet(seat, command.cardId()));
    }

    // ==================== ACTIVATE ====================

    /**
     * Activate a spell from the hand during a main phase, or a set quick-play at any time.
     */
    public static List<Event> activateSpell(GameState state, Seat seat, Command.ActivateSpell command) {
        PlayerZones zones = state.player(seat);
        String cardId = command.cardId();
        CardDefinition card = state.definitionOf(cardId);
        if (card == null || !card.isSpell()) {
            return List.of();
        }

        boolean inHand = zones.hand().contains(cardId);
        if (inHand) {
            if (!state.currentPhase().isMainPhase()) {
                return List.of();
            }
            if (!card.isFieldSpell() && zones.spellTrapZone().size() >= state.config().maxSpellTrapSlots()) {
                return List.of();
            }
        } else if (!isSetCard(zones, cardId) || !card.isQuickPlay()) {
            return List.of();
        }

        Optional<List<String>> targets = linkTargets(state, seat, card, command.effectIndex(), command.targets());
        if (targets.isEmpty()) {
            return List.of();
        }

        List<Event> events = new ArrayList<>();
        if (inHand && card.isFieldSpell() && zones.fieldSpell() != null) {
            events.add(new Event.CardSentToGraveyard(zones.fieldSpell().cardId(), Zone.FIELD, seat));
        }
        events.add(new Event.ChainStarted());
        events.add(new Event.ChainLinkAdded(seat, cardId, command.effectIndex(), targets.get()));
        events.add(new Event.SpellActivated(seat, cardId, targets.get()));
        if (card.isEquipSpell()) {
            events.add(new Event.SpellEquipped(seat, cardId, targets.get().get(0)));
        }
        return events;
    }

    /**
     * Activate a set trap. Traps may be activated on either player's turn.
     */
    public static List<Event> activateTrap(GameState state, Seat seat, Command.ActivateTrap command) {
        PlayerZones zones = state.player(seat);
        String cardId = command.cardId();
        CardDefinition card = state.definitionOf(cardId);
        if (card == null || !card.isTrap() || !isSetCard(zones, cardId)) {
            return List.of();
        }
        Optional<List<String>> targets = linkTargets(state, seat, card, command.effectIndex(), command.targets());
        if (targets.isEmpty()) {
            return List.of();
        }
        return List.of(
                new Event.ChainStarted(),
                new Event.ChainLinkAdded(seat, cardId, command.effectIndex(), targets.get()),
                new Event.TrapActivated(seat, cardId, targets.get()));
    }

    /**
     * Flip a set trap or quick-play into an open chain. Hand spells never join a chain.
     */
    public static List<Event> respondWithSetCard(GameState state, Seat seat, String cardId, int effectIndex,
                                                 List<String> selected) {
        PlayerZones zones = state.player(seat);
        CardDefinition card = state.definitionOf(cardId);
        if (card == null || !isSetCard(zones, cardId) || !(card.isTrap() || card.isQuickPlay())) {
            return List.of();
        }
        Optional<List<String>> targets = linkTargets(state, seat, card, effectIndex, selected);
        if (targets.isEmpty()) {
            return List.of();
        }
        Event activation = card.isTrap()
                ? new Event.TrapActivated(seat, cardId, targets.get())
                : new Event.SpellActivated(seat, cardId, targets.get());
        return List.of(new Event.ChainLinkAdded(seat, cardId, effectIndex, targets.get()), activation);
    }

    // ==================== TARGETS ====================

    /**
     * Targets recorded on the link. Equip spells take exactly one face-up monster of their
     * controller; other cards follow their effect's target filter. A card without effects
     * activates with effect index 0 and no targets.
     */
    static Optional<List<String>> linkTargets(GameState state, Seat seat, CardDefinition card, int effectIndex,
                                              List<String> selected) {
        if (card.isEquipSpell()) {
            if (selected.size() != 1) {
                return Optional.empty();
            }
            Optional<BoardCard> monster = state.player(seat).findBoardCard(selected.get(0));
            if (monster.isEmpty() || monster.get().faceDown()) {
                return Optional.empty();
            }
            if (!card.getEffects().isEmpty() && EffectRules.effectAt(card, effectIndex).isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(List.copyOf(selected));
        }
        if (card.getEffects().isEmpty()) {
            return effectIndex == 0 && selected.isEmpty() ? Optional.of(List.of()) : Optional.empty();
        }
        Optional<EffectDefinition> effect = EffectRules.effectAt(card, effectIndex);
        if (effect.isEmpty()) {
            return Optional.empty();
        }
        return EffectRules.activationTargets(state, seat, effect.get(), selected);
    }

    private static boolean isSetCard(PlayerZones zones, String cardId) {
        return zones.findSpellTrap(cardId).map(SpellTrapCard::faceDown).orElse(false);
    }
}
