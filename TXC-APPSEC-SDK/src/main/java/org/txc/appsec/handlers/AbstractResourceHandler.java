package org.txc.appsec.handlers;

import com.fasterxml.jackson.core.JsonProcessingException;
import jakarta.validation.ConstraintViolation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.txc.appsec.client.ApiRequest;
import org.txc.appsec.client.ApiResponse;
import org.txc.appsec.client.AppSecSession;
import org.txc.appsec.client.ContextCancelledException;
import org.txc.appsec.client.RequestBody;
import org.txc.appsec.client.RequestContext;
import org.txc.appsec.errors.AppSecException;
import org.txc.appsec.errors.TransportException;
import org.txc.appsec.errors.ValidationException;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Runs {@link ResourceOperation}s: validate, send, check status, decode.
 * Subclasses only declare their operations and expose typed methods.
 */
public abstract class AbstractResourceHandler implements IResourceHandler {
    protected final Logger logger = LoggerFactory.getLogger(getClass());

    protected final AppSecSession session;

    protected AbstractResourceHandler(AppSecSession session) {
        this.session = session;
    }

    protected <Q, R> R execute(RequestContext context, ResourceOperation<Q, R> operation, Q request)
            throws AppSecException {
        String name = operation.getName();
        validate(name, request);

        try {
            context.ensureActive();
        } catch (ContextCancelledException e) {
            throw new TransportException(name, e);
        }

        String uri = operation.uri(request);
        logger.debug("{} {}", name, uri);
        Map<String, String> headers = new LinkedHashMap<>();
        byte[] payload = null;
        RequestBody body = operation.body(request);
        if (body != null) {
            try {
                payload = body.toBytes(session.getJsonMapper());
            } catch (JsonProcessingException e) {
                throw new TransportException(name, e);
            }
            headers.put("Content-Type", "application/json");
        }

        ApiResponse<R> response;
        try {
            response = session.getExecutor().execute(context,
                    new ApiRequest(operation.getMethod(), uri, headers, payload), operation.getResponseType());
        } catch (IOException e) {
            throw new TransportException(name, e);
        }

        if (!operation.isSuccess(response.getStatusCode())) {
            throw session.getErrorMapper().map(name, response);
        }
        R result = response.getBody() != null ? response.getBody() : operation.emptyResponse();
        return operation.postProcess(request, result);
    }

    private <Q> void validate(String operation, Q request) throws ValidationException {
        if (request == null) {
            throw new ValidationException(operation, Map.of("request", "must not be null"));
        }
        Set<ConstraintViolation<Q>> violations = session.getValidator().validate(request);
        if (violations.isEmpty()) {
            return;
        }
        Map<String, String> byField = new TreeMap<>();
        for (ConstraintViolation<Q> violation : violations) {
            byField.merge(violation.getPropertyPath().toString(), violation.getMessage(), (a, b) -> a + ", " + b);
        }
        throw new ValidationException(operation, byField);
    }
}
