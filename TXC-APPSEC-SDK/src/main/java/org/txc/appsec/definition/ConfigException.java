package org.txc.appsec.definition;

/**
 * Credentials or SDK properties could not be loaded.
 */
public class ConfigException extends Exception {

    public enum Reason {
        LOADING_FILE,
        SECTION_DOES_NOT_EXIST,
        REQUIRED_OPTION_EDGERC,
        REQUIRED_OPTION_ENV,
        HOST_CONTAINS_SLASH_AT_THE_END,
        INVALID_VALUE
    }

    private final Reason reason;

    public ConfigException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ConfigException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
