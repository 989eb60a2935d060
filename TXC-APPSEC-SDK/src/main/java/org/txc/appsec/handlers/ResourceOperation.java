package org.txc.appsec.handlers;

import org.txc.appsec.client.RequestBody;

import java.util.Objects;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Declarative description of one API operation: how to build its URL and body from a request,
 * which statuses count as success and how to shape the decoded response.
 *
 * @param <Q> request type
 * @param <R> response type
 */
public final class ResourceOperation<Q, R> {
    private static final Set<Integer> GET_SUCCESS = Set.of(200);
    private static final Set<Integer> WRITE_SUCCESS = Set.of(200, 201);
    private static final Set<Integer> DELETE_SUCCESS = Set.of(200, 204);

    private final String name;
    private final String method;
    private final Function<Q, String> uri;
    private final Function<Q, RequestBody> body;
    private final Set<Integer> successCodes;
    private final Class<R> responseType;
    private final Supplier<R> emptyResponse;
    private final BiFunction<Q, R, R> postProcessor;

    private ResourceOperation(Builder<Q, R> builder) {
        this.name = builder.name;
        this.method = Objects.requireNonNull(builder.method, "HTTP method not set for " + builder.name);
        this.uri = Objects.requireNonNull(builder.uri, "URI not set for " + builder.name);
        this.body = builder.body;
        this.successCodes = builder.successCodes;
        this.responseType = builder.responseType;
        this.emptyResponse = builder.emptyResponse;
        this.postProcessor = builder.postProcessor;
    }

    public static <Q, R> Builder<Q, R> builder(String name, Class<Q> requestType,
                                               Class<R> responseType, Supplier<R> emptyResponse) {
        return new Builder<>(name, responseType, emptyResponse);
    }

    public String getName() { return name; }
    public String getMethod() { return method; }
    public Class<R> getResponseType() { return responseType; }

    public String uri(Q request) {
        return uri.apply(request);
    }

    /**
     * @return the payload to send, or {@code null} for body-less operations
     */
    public RequestBody body(Q request) {
        return body == null ? null : body.apply(request);
    }

    public boolean isSuccess(int statusCode) {
        return successCodes.contains(statusCode);
    }

    public R emptyResponse() {
        return emptyResponse.get();
    }

    public R postProcess(Q request, R response) {
        return postProcessor == null ? response : postProcessor.apply(request, response);
    }

    public static final class Builder<Q, R> {
        private final String name;
        private final Class<R> responseType;
        private final Supplier<R> emptyResponse;
        private String method;
        private Function<Q, String> uri;
        private Function<Q, RequestBody> body;
        private Set<Integer> successCodes;
        private BiFunction<Q, R, R> postProcessor;

        private Builder(String name, Class<R> responseType, Supplier<R> emptyResponse) {
            this.name = name;
            this.responseType = responseType;
            this.emptyResponse = emptyResponse;
        }

        public Builder<Q, R> get(Function<Q, String> uri) {
            return route("GET", uri, null, GET_SUCCESS);
        }

        public Builder<Q, R> post(Function<Q, String> uri, Function<Q, RequestBody> body) {
            return route("POST", uri, body, WRITE_SUCCESS);
        }

        public Builder<Q, R> put(Function<Q, String> uri, Function<Q, RequestBody> body) {
            return route("PUT", uri, body, WRITE_SUCCESS);
        }

        public Builder<Q, R> delete(Function<Q, String> uri) {
            return route("DELETE", uri, null, DELETE_SUCCESS);
        }

        public Builder<Q, R> postProcess(BiFunction<Q, R, R> postProcessor) {
            this.postProcessor = postProcessor;
            return this;
        }

        public ResourceOperation<Q, R> build() {
            return new ResourceOperation<>(this);
        }

        private Builder<Q, R> route(String method, Function<Q, String> uri, Function<Q, RequestBody> body,
                                    Set<Integer> successCodes) {
            this.method = method;
            this.uri = uri;
            this.body = body;
            this.successCodes = successCodes;
            return this;
        }
    }
}
