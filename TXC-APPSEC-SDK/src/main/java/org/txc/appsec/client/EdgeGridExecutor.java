package org.txc.appsec.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.txc.appsec.definition.EdgeGridCredentials;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * {@link RequestExecutor} that signs requests with EdgeGrid credentials and sends them with the JDK HTTP client.
 */
public class EdgeGridExecutor implements RequestExecutor {
    private static final Logger logger = LoggerFactory.getLogger(EdgeGridExecutor.class);

    private final HttpClient httpClient;
    private final ObjectMapper jsonMapper;
    private final EdgeGridSigner signer;
    private final URI baseUri;
    private final Duration requestTimeout;

    public EdgeGridExecutor(EdgeGridCredentials credentials, ObjectMapper jsonMapper,
                            Duration connectTimeout, Duration requestTimeout) {
        this(HttpClient.newBuilder()
                        .version(HttpClient.Version.HTTP_1_1)
                        .connectTimeout(connectTimeout)
                        .build(),
                jsonMapper, new EdgeGridSigner(credentials), URI.create(credentials.getBaseUrl()), requestTimeout);
    }

    public EdgeGridExecutor(HttpClient httpClient, ObjectMapper jsonMapper, EdgeGridSigner signer,
                            URI baseUri, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.jsonMapper = jsonMapper;
        this.signer = signer;
        this.baseUri = baseUri;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public <T> ApiResponse<T> execute(RequestContext context, ApiRequest request, Class<T> responseType) throws IOException {
        context.ensureActive();

        URI uri = baseUri.resolve(request.getPath());
        HttpRequest.BodyPublisher publisher = request.hasBody()
                ? HttpRequest.BodyPublishers.ofByteArray(request.getBody())
                : HttpRequest.BodyPublishers.noBody();

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .method(request.getMethod(), publisher)
                .header("Accept", "application/json")
                .timeout(effectiveTimeout(context));
        request.getHeaders().forEach(builder::header);
        builder.header("Authorization", signer.sign(request.getMethod(), uri, request.getBody()));

        logger.debug("{} {}", request.getMethod(), uri);
        HttpResponse<byte[]> response = send(context, builder.build());
        logger.debug("{} {} -> {}", request.getMethod(), uri, response.statusCode());

        T body = null;
        if (responseType != null && isSuccess(response.statusCode()) && isJson(response)) {
            body = jsonMapper.readValue(response.body(), responseType);
        }
        return new ApiResponse<>(response.statusCode(), response.headers().map(), response.body(), body);
    }

    private HttpResponse<byte[]> send(RequestContext context, HttpRequest request) throws IOException {
        CompletableFuture<HttpResponse<byte[]>> future =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray());
        try (RequestContext.Registration ignored = context.onCancel(() -> future.cancel(true))) {
            return future.get();
        } catch (CancellationException e) {
            throw new ContextCancelledException("context canceled", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            InterruptedIOException interrupted = new InterruptedIOException("interrupted while waiting for response");
            interrupted.initCause(e);
            throw interrupted;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            // The client fails a cancelled exchange with a plain IOException.
            if (context.isCancelled()) {
                throw new ContextCancelledException("context canceled", cause);
            }
            if (cause instanceof HttpTimeoutException && context.isExpired()) {
                throw new ContextCancelledException("context deadline exceeded", cause);
            }
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new IOException(cause.getMessage(), cause);
        }
    }

    private Duration effectiveTimeout(RequestContext context) {
        return context.remaining()
                .filter(left -> left.compareTo(requestTimeout) < 0 && !left.isZero())
                .orElse(requestTimeout);
    }

    private static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }

    private static boolean isJson(HttpResponse<byte[]> response) {
        if (response.body() == null || response.body().length == 0) {
            return false;
        }
        List<String> contentTypes = response.headers().allValues("Content-Type");
        if (contentTypes.isEmpty()) {
            // Some endpoints omit the header; sniff the first non-blank byte instead.
            for (byte b : response.body()) {
                if (!Character.isWhitespace(b)) {
                    return b == '{' || b == '[';
                }
            }
            return false;
        }
        return contentTypes.stream().anyMatch(type -> type.toLowerCase().contains("json"));
    }
}
