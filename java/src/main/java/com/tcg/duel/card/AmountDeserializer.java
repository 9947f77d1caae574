package com.tcg.duel.card;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;

/**
 * Reads the three JSON forms of {@link Amount}.
 */
public class AmountDeserializer extends StdDeserializer<Amount> {
    static final String GRAVEYARD_COUNT = "graveyard_count";
    static final String MIRROR = "mirror";

    public AmountDeserializer() {
        super(Amount.class);
    }

    @Override
    public Amount deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonToken token = p.currentToken();
        if (token == JsonToken.VALUE_NUMBER_INT) {
            return new Amount.Literal(p.getIntValue());
        }
        if (token == JsonToken.VALUE_STRING) {
            String text = p.getText().trim();
            if (MIRROR.equalsIgnoreCase(text)) {
                return new Amount.Mirror();
            }
            try {
                return new Amount.Literal(Integer.parseInt(text));
            } catch (NumberFormatException e) {
                return (Amount) ctxt.handleWeirdStringValue(Amount.class, text, "not an amount");
            }
        }
        if (token == JsonToken.START_OBJECT) {
            JsonNode node = p.readValueAsTree();
            JsonNode scope = node.get(GRAVEYARD_COUNT);
            if (scope != null && scope.isTextual()) {
                for (Recipient recipient : Recipient.values()) {
                    if (recipient.getJsonValue().equals(scope.asText())) {
                        return new Amount.GraveyardCount(recipient);
                    }
                }
            }
            return (Amount) ctxt.handleUnexpectedToken(Amount.class, p);
        }
        return (Amount) ctxt.handleUnexpectedToken(Amount.class, p);
    }
}
