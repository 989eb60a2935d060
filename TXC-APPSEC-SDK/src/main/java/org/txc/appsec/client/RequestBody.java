package org.txc.appsec.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;

/**
 * JSON payload of a create/update call: either caller-supplied raw JSON sent untouched,
 * or an object serialized with the session mapper.
 */
public abstract class RequestBody {

    public abstract byte[] toBytes(ObjectMapper mapper) throws JsonProcessingException;

    public static RequestBody raw(String json) {
        return new RequestBody() {
            @Override
            public byte[] toBytes(ObjectMapper mapper) {
                return json == null ? new byte[0] : json.getBytes(StandardCharsets.UTF_8);
            }
        };
    }

    public static RequestBody json(Object value) {
        return new RequestBody() {
            @Override
            public byte[] toBytes(ObjectMapper mapper) throws JsonProcessingException {
                return mapper.writeValueAsBytes(value);
            }
        };
    }
}
