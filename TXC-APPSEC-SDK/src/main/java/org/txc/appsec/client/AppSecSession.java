package org.txc.appsec.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;

/**
 * Everything a resource handler needs to run an operation. Built once and passed to every handler.
 */
public class AppSecSession {
    private final RequestExecutor executor;
    private final ErrorMapper errorMapper;
    private final Validator validator;
    private final ObjectMapper jsonMapper;

    public AppSecSession(RequestExecutor executor, ErrorMapper errorMapper, Validator validator, ObjectMapper jsonMapper) {
        this.executor = executor;
        this.errorMapper = errorMapper;
        this.validator = validator;
        this.jsonMapper = jsonMapper;
    }

    /**
     * Session with the problem+json error mapper and a default validator.
     */
    public static AppSecSession create(RequestExecutor executor, ObjectMapper jsonMapper) {
        return new AppSecSession(executor, new ProblemErrorMapper(jsonMapper), newValidator(), jsonMapper);
    }

    public static Validator newValidator() {
        return ValidatorHolder.FACTORY.getValidator();
    }

    private static final class ValidatorHolder {
        // Parameter interpolation keeps the SDK free of an Expression Language runtime.
        private static final ValidatorFactory FACTORY = Validation.byDefaultProvider()
                .configure()
                .messageInterpolator(new ParameterMessageInterpolator())
                .buildValidatorFactory();
    }

    public RequestExecutor getExecutor() { return executor; }
    public ErrorMapper getErrorMapper() { return errorMapper; }
    public Validator getValidator() { return validator; }
    public ObjectMapper getJsonMapper() { return jsonMapper; }
}
