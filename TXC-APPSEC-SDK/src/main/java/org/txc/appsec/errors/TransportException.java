package org.txc.appsec.errors;

/**
 * Network, cancellation or request-construction failure. The server never produced a usable status.
 */
public class TransportException extends AppSecException {

    public TransportException(String operation, Throwable cause) {
        super(operation, operation + " request failed: " + cause.getMessage(), cause);
    }
}
