package org.txc.appsec.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.txc.appsec.errors.ApiError;
import org.txc.appsec.errors.ApiException;

import java.io.IOException;

/**
 * Reads the API's problem+json error body. Bodies that are not valid problem JSON still produce an
 * {@link ApiError} carrying the status code and the parse failure.
 */
public class ProblemErrorMapper implements ErrorMapper {
    private final ObjectMapper jsonMapper;

    public ProblemErrorMapper(ObjectMapper jsonMapper) {
        this.jsonMapper = jsonMapper;
    }

    @Override
    public ApiException map(String operation, ApiResponse<?> response) {
        ApiError error;
        try {
            error = jsonMapper.readValue(response.getRawBody(), ApiError.class);
            if (error == null) {
                error = unreadable("empty error body");
            }
        } catch (JsonProcessingException e) {
            error = unreadable(e.getOriginalMessage());
        } catch (IOException e) {
            error = new ApiError();
            error.setTitle("Failed to read error body");
            error.setDetail(e.getMessage());
        }
        error.setStatusCode(response.getStatusCode());
        return new ApiException(operation, error);
    }

    private static ApiError unreadable(String detail) {
        ApiError error = new ApiError();
        error.setTitle("Failed to unmarshal error body");
        error.setDetail(detail);
        return error;
    }
}
