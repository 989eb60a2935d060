package org.txc.appsec.client;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Status, raw bytes and (for successful JSON responses) the decoded body of one exchange.
 */
public class ApiResponse<T> {
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final byte[] rawBody;
    private final T body;

    public ApiResponse(int statusCode, Map<String, List<String>> headers, byte[] rawBody, T body) {
        this.statusCode = statusCode;
        this.headers = headers != null ? headers : Collections.emptyMap();
        this.rawBody = rawBody != null ? rawBody : new byte[0];
        this.body = body;
    }

    public int getStatusCode() { return statusCode; }
    public Map<String, List<String>> getHeaders() { return headers; }
    public byte[] getRawBody() { return rawBody; }

    /**
     * @return the decoded body, or {@code null} if nothing was decoded
     */
    public T getBody() { return body; }
}
