package com.tcg.duel.card;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Restricts which cards an effect may select. A missing zone means the board.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TargetFilter(
    @JsonProperty("owner") Owner owner,
    @JsonProperty("zone") Zone zone,
    @JsonProperty("card_type") CardType cardType
) {
    public TargetFilter {
        if (owner == null) {
            owner = Owner.ANY;
        }
    }

    public static TargetFilter of(Owner owner) {
        return new TargetFilter(owner, null, null);
    }

    public static TargetFilter of(Owner owner, CardType cardType) {
        return new TargetFilter(owner, null, cardType);
    }

    /**
     * Zone the filter selects from, defaulting to the board.
     */
    public Zone effectiveZone() {
        return zone != null ? zone : Zone.BOARD;
    }

    public enum Owner {
        SELF("self"),
        OPPONENT("opponent"),
        ANY("any");

        private final String jsonValue;

        Owner(String jsonValue) {
            this.jsonValue = jsonValue;
        }

        @JsonValue
        public String getJsonValue() {
            return jsonValue;
        }
    }
}
