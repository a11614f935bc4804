package com.al.pricetransparency.util;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;

/**
 * Binds price fields the way {@link NumberParser} reads CSV cells: {@code "$1,234.00"} becomes
 * 1234.0, while {@code "N/A"}, booleans and nested values become null instead of failing the element.
 */
public class LenientDoubleDeserializer extends StdDeserializer<Double> {

    public LenientDoubleDeserializer() {
        super(Double.class);
    }

    @Override
    public Double deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonToken token = parser.currentToken();
        if (token == JsonToken.VALUE_NUMBER_INT || token == JsonToken.VALUE_NUMBER_FLOAT) {
            double value = parser.getDoubleValue();
            return Double.isNaN(value) || Double.isInfinite(value) ? null : value;
        }
        if (token == JsonToken.VALUE_STRING) {
            return NumberParser.parse(parser.getText());
        }
        if (token == JsonToken.START_OBJECT || token == JsonToken.START_ARRAY) {
            parser.skipChildren();
        }
        return null;
    }
}
