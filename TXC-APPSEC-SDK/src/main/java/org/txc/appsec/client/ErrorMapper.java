package org.txc.appsec.client;

import org.txc.appsec.errors.ApiException;

/**
 * Turns a response whose status is outside an operation's success set into an {@link ApiException}.
 */
public interface ErrorMapper {
    ApiException map(String operation, ApiResponse<?> response);
}
