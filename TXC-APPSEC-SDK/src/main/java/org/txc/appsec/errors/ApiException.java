package org.txc.appsec.errors;

/**
 * The API answered with a status code outside the operation's success set.
 */
public class ApiException extends AppSecException {
    private final int statusCode;
    private final ApiError error;

    public ApiException(String operation, ApiError error) {
        super(operation, operation + ": API error: " + error);
        this.statusCode = error.getStatusCode();
        this.error = error;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public ApiError getError() {
        return error;
    }
}
