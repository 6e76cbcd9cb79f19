package com.webapp.backend_telemetry.dtos;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Field deserializers that turn a value of the wrong JSON type into
 * {@code null} instead of failing the whole document. The extractor then
 * applies the usual defaults.
 */
public final class LenientDeserializers {

    private LenientDeserializers() {
    }

    public static class LenientDouble extends JsonDeserializer<Double> {
        @Override
        public Double deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            return readDouble(p);
        }
    }

    public static class LenientString extends JsonDeserializer<String> {
        @Override
        public String deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (p.currentToken().isScalarValue()) return p.getText();
            p.skipChildren();
            return null;
        }
    }

    /**
     * Keeps one slot per array element so sample indices survive a bad value.
     */
    public static class LenientDoubleList extends JsonDeserializer<List<Double>> {
        @Override
        public List<Double> deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (p.currentToken() != JsonToken.START_ARRAY) {
                p.skipChildren();
                return null;
            }
            List<Double> samples = new ArrayList<>();
            while (p.nextToken() != JsonToken.END_ARRAY) {
                samples.add(readDouble(p));
            }
            return samples;
        }
    }

    public static class LenientSummary extends JsonDeserializer<RunSummary> {
        @Override
        public RunSummary deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            return readObject(p, ctxt, RunSummary.class);
        }
    }

    public static class LenientTimeline extends JsonDeserializer<Timeline> {
        @Override
        public Timeline deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            return readObject(p, ctxt, Timeline.class);
        }
    }

    private static Double readDouble(JsonParser p) throws IOException {
        JsonToken token = p.currentToken();
        if (token == JsonToken.VALUE_NUMBER_INT || token == JsonToken.VALUE_NUMBER_FLOAT) {
            return p.getDoubleValue();
        }
        if (token == JsonToken.VALUE_STRING) {
            try {
                return Double.valueOf(p.getText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        p.skipChildren();
        return null;
    }

    private static <T> T readObject(JsonParser p, DeserializationContext ctxt, Class<T> type) throws IOException {
        if (p.currentToken() == JsonToken.START_OBJECT) {
            return ctxt.readValue(p, type);
        }
        p.skipChildren();
        return null;
    }
}
