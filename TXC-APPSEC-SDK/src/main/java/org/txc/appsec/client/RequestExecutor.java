package org.txc.appsec.client;

import java.io.IOException;

/**
 * Authenticated transport every resource handler sends its requests through.
 */
public interface RequestExecutor {

    /**
     * Signs and sends the request. When the status is 2xx, the body is JSON and {@code responseType}
     * is non-null, the body is decoded into it.
     *
     * @throws IOException on transport faults, undecodable success bodies or a cancelled context
     */
    <T> ApiResponse<T> execute(RequestContext context, ApiRequest request, Class<T> responseType) throws IOException;
}
