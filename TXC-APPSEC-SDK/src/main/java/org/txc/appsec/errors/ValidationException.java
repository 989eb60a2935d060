package org.txc.appsec.errors;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Raised locally, before any network call, when a request is missing required fields.
 */
public class ValidationException extends AppSecException {
    private final Map<String, String> violations;

    /**
     * @param operation  the operation whose request failed validation
     * @param violations property name to constraint message, in the order they should be reported
     */
    public ValidationException(String operation, Map<String, String> violations) {
        super(operation, operation + ": struct validation: " + describe(violations));
        this.violations = Collections.unmodifiableMap(violations);
    }

    private static String describe(Map<String, String> violations) {
        return violations.entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining("; "));
    }

    public List<String> getFields() {
        return List.copyOf(violations.keySet());
    }

    public Map<String, String> getViolations() {
        return violations;
    }
}
