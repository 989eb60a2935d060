package org.txc.appsec.handlers;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.txc.appsec.definition.AppSecSDK;
import org.txc.appsec.definition.AppSecSdkManager;
import org.txc.appsec.definition.EdgeGridConfigLoader;
import org.txc.appsec.definition.EdgeGridCredentials;
import org.txc.appsec.definition.SdkConfig;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * In-process stand-in for the Application Security API. Responses are stubbed per method and path
 * (query included); every request that reaches the server is recorded.
 */
final class MockAppSecApi implements AutoCloseable {

    static final String PROBLEM_NOT_FOUND = "{\"type\":\"https://problems.luna.akamaiapis.net/appsec/error-types/NOT-FOUND\","
            + "\"title\":\"Not Found\",\"detail\":\"No stub for this request\",\"status\":404}";

    private final HttpServer server;
    private final Map<String, Stub> stubs = new ConcurrentHashMap<>();
    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();
    private final CountDownLatch closed = new CountDownLatch(1);

    MockAppSecApi() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/", this::handle);
        server.start();
    }

    MockAppSecApi stub(String method, String pathAndQuery, int status, String json) {
        stubs.put(method + " " + pathAndQuery, new Stub(status, json, Duration.ZERO));
        return this;
    }

    /**
     * Like {@link #stub} but holds the response back for {@code delay}, or until the server is closed.
     */
    MockAppSecApi stubDelayed(String method, String pathAndQuery, Duration delay, int status, String json) {
        stubs.put(method + " " + pathAndQuery, new Stub(status, json, delay));
        return this;
    }

    List<RecordedRequest> requests() {
        return requests;
    }

    RecordedRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }

    String baseUrl() {
        return "http://" + server.getAddress().getHostString() + ":" + server.getAddress().getPort();
    }

    /**
     * A fresh SDK signed with dummy credentials and pointed at this server.
     */
    AppSecSDK newSdk() {
        EdgeGridCredentials credentials = new EdgeGridCredentials(baseUrl(), "akab-client-token",
                "client-secret", "akab-access-token", EdgeGridCredentials.DEFAULT_MAX_BODY);
        return new AppSecSdkManager(new SdkConfig(), new EdgeGridConfigLoader(name -> null)).create(credentials);
    }

    private void handle(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getRawPath();
        String query = exchange.getRequestURI().getRawQuery();
        String pathAndQuery = query == null ? path : path + "?" + query;
        byte[] body;
        try (InputStream in = exchange.getRequestBody()) {
            body = in.readAllBytes();
        }
        requests.add(new RecordedRequest(exchange.getRequestMethod(), pathAndQuery,
                exchange.getRequestHeaders().getFirst("Content-Type"),
                exchange.getRequestHeaders().getFirst("Authorization"), body));

        Stub stub = stubs.getOrDefault(exchange.getRequestMethod() + " " + pathAndQuery,
                new Stub(404, PROBLEM_NOT_FOUND, Duration.ZERO));
        if (!stub.delay.isZero()) {
            try {
                closed.await(stub.delay.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        byte[] response = stub.json == null ? new byte[0] : stub.json.getBytes(StandardCharsets.UTF_8);
        if (stub.status >= 400) {
            exchange.getResponseHeaders().add("Content-Type", "application/problem+json");
        } else if (response.length > 0) {
            exchange.getResponseHeaders().add("Content-Type", "application/json");
        }
        exchange.sendResponseHeaders(stub.status, response.length == 0 ? -1 : response.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(response);
        }
    }

    @Override
    public void close() {
        closed.countDown();
        server.stop(0);
    }

    private static final class Stub {
        final int status;
        final String json;
        final Duration delay;

        Stub(int status, String json, Duration delay) {
            this.status = status;
            this.json = json;
            this.delay = delay;
        }
    }

    static final class RecordedRequest {
        final String method;
        final String pathAndQuery;
        final String contentType;
        final String authorization;
        final byte[] body;

        RecordedRequest(String method, String pathAndQuery, String contentType, String authorization, byte[] body) {
            this.method = method;
            this.pathAndQuery = pathAndQuery;
            this.contentType = contentType;
            this.authorization = authorization;
            this.body = body;
        }

        String bodyAsString() {
            return new String(body, StandardCharsets.UTF_8);
        }
    }
}
