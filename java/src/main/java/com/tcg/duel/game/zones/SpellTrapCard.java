package com.tcg.duel.game.zones;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A card in a spell/trap zone or the field-spell slot.
 */
public record SpellTrapCard(
    @JsonProperty("card_id") String cardId,
    @JsonProperty("definition_id") String definitionId,
    @JsonProperty("face_down") boolean faceDown,
    @JsonProperty("activated") boolean activated,
    @JsonProperty("is_field_spell") boolean fieldSpell
) {
    public static SpellTrapCard set(String cardId, String definitionId) {
        return new SpellTrapCard(cardId, definitionId, true, false, false);
    }

    public static SpellTrapCard activated(String cardId, String definitionId, boolean fieldSpell) {
        return new SpellTrapCard(cardId, definitionId, false, true, fieldSpell);
    }

    public SpellTrapCard flipUp() {
        return new SpellTrapCard(cardId, definitionId, false, true, fieldSpell);
    }
}
