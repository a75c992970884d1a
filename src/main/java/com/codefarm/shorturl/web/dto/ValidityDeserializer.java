package com.codefarm.shorturl.web.dto;

import com.codefarm.shorturl.exception.ValidationException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;

/**
 * Accepts only JSON number tokens. Strings such as {@code "30"}, booleans, arrays and objects are
 * refused rather than coerced into minutes.
 */
public class ValidityDeserializer extends StdDeserializer<Number> {

    public ValidityDeserializer() {
        super(Number.class);
    }

    @Override
    public Number deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonToken token = parser.currentToken();
        if (token == JsonToken.VALUE_NUMBER_INT || token == JsonToken.VALUE_NUMBER_FLOAT) {
            return parser.getNumberValue();
        }
        parser.skipChildren();
        throw ValidationException.invalidValidity();
    }
}
