package org.txc.appsec.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a string-or-array field (e.g. an atomic condition {@code name}) into a list of strings.
 */
public class FlexibleStringListDeserializer extends StdDeserializer<List<String>> {

    public FlexibleStringListDeserializer() {
        super(List.class);
    }

    @Override
    public List<String> deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = p.readValueAsTree();
        List<String> values = FlexibleValueDecoder.decode(node).asList();
        return values == null ? null : new ArrayList<>(values);
    }
}
