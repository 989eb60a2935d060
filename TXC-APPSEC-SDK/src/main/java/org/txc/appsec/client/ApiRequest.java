package org.txc.appsec.client;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An outbound API call: method, path relative to the API host (query included), headers and optional body.
 */
public class ApiRequest {
    private final String method;
    private final String path;
    private final Map<String, String> headers;
    private final byte[] body;

    public ApiRequest(String method, String path, Map<String, String> headers, byte[] body) {
        this.method = method;
        this.path = path;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.body = body;
    }

    public String getMethod() { return method; }
    public String getPath() { return path; }
    public Map<String, String> getHeaders() { return headers; }
    public byte[] getBody() { return body; }

    public boolean hasBody() {
        return body != null;
    }

    @Override
    public String toString() {
        return method + " " + path;
    }
}
