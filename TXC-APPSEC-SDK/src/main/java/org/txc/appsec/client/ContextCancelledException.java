package org.txc.appsec.client;

import java.io.IOException;

/**
 * The caller's {@link RequestContext} was cancelled or ran past its deadline.
 */
public class ContextCancelledException extends IOException {

    public ContextCancelledException(String message) {
        super(message);
    }

    public ContextCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
