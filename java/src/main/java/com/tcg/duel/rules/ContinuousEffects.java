package com.tcg.duel.rules;

import com.tcg.duel.card.CardDefinition;
import com.tcg.duel.card.EffectAction;
import com.tcg.duel.card.EffectDefinition;
import com.tcg.duel.effect.Operations;
import com.tcg.duel.game.ChainLink;
import com.tcg.duel.game.Event;
import com.tcg.duel.game.GameState;
import com.tcg.duel.game.ModifierExpiry;
import com.tcg.duel.game.Seat;
import com.tcg.duel.game.TemporaryModifier;
import com.tcg.duel.game.zones.PlayerZones;
import com.tcg.duel.game.zones.SpellTrapCard;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Stat boosts granted by face-up field and continuous cards. A boost lasts as long as its source
 * stays on the field: monsters that arrive later receive it too, and the boosts are taken back
 * when the source leaves (see {@code Evolver}).
 */
public final class ContinuousEffects {

    private ContinuousEffects() {
        // Utility class - prevent instantiation
    }

    /**
     * Whether modifiers granted by this card end when it leaves the field.
     */
    public static boolean lingers(CardDefinition card) {
        return card != null && !card.isMonster() && card.staysOnField();
    }

    /**
     * Permanent boosts owed to monsters that do not carry them yet. Only untargeted effects of
     * resolved face-up field and continuous cards spread; equips stay on the monster they chose.
     */
    public static List<Event> refresh(GameState state) {
        List<Event> events = new ArrayList<>();
        for (Seat seat : Seat.values()) {
            for (SpellTrapCard source : faceUpSources(state.player(seat))) {
                CardDefinition card = state.definitionOf(source.cardId());
                if (!lingers(card) || card.isEquipSpell() || onChain(state, source.cardId())) {
                    continue;
                }
                for (EffectDefinition effect : card.getEffects()) {
                    if (effect.requiredTargets() > 0) {
                        continue;
                    }
                    for (EffectAction action : effect.actions()) {
                        events.addAll(missingBoosts(state, action, seat, source.cardId(), events));
                    }
                }
            }
        }
        return events;
    }

    private static List<Event> missingBoosts(GameState state, EffectAction action, Seat seat, String sourceId,
                                             List<Event> pending) {
        if (action.kind() != EffectAction.Kind.BOOST_ATTACK && action.kind() != EffectAction.Kind.BOOST_DEFENSE) {
            return List.of();
        }
        List<Event> missing = new ArrayList<>();
        for (Event event : Operations.executeAction(state, action, seat, sourceId, List.of())) {
            Event.ModifierApplied applied = (Event.ModifierApplied) event;
            if (applied.expiry() == ModifierExpiry.PERMANENT && !carries(state, applied)
                    && !pending.contains(applied)) {
                missing.add(applied);
            }
        }
        return missing;
    }

    private static boolean carries(GameState state, Event.ModifierApplied applied) {
        for (TemporaryModifier modifier : state.temporaryModifiers()) {
            if (modifier.cardId().equals(applied.cardId()) && modifier.stat() == applied.stat()
                    && Objects.equals(modifier.source(), applied.source())) {
                return true;
            }
        }
        return false;
    }

    private static List<SpellTrapCard> faceUpSources(PlayerZones zones) {
        List<SpellTrapCard> sources = new ArrayList<>();
        for (SpellTrapCard card : zones.spellTrapZone()) {
            if (!card.faceDown()) {
                sources.add(card);
            }
        }
        if (zones.fieldSpell() != null && !zones.fieldSpell().faceDown()) {
            sources.add(zones.fieldSpell());
        }
        return sources;
    }

    private static boolean onChain(GameState state, String cardId) {
        for (ChainLink link : state.currentChain()) {
            if (link.cardId().equals(cardId)) {
                return true;
            }
        }
        return false;
    }
}
