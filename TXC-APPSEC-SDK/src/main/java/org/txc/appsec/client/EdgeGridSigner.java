package org.txc.appsec.client;

import org.txc.appsec.definition.EdgeGridCredentials;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Base64;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Produces the EG1-HMAC-SHA256 {@code Authorization} header value for a request.
 */
public class EdgeGridSigner {
    private static final String ALGORITHM = "EG1-HMAC-SHA256";
    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HH:mm:ss+0000").withZone(ZoneOffset.UTC);

    private final EdgeGridCredentials credentials;
    private final Clock clock;
    private final Supplier<String> nonceSupplier;

    public EdgeGridSigner(EdgeGridCredentials credentials) {
        this(credentials, Clock.systemUTC(), () -> UUID.randomUUID().toString());
    }

    public EdgeGridSigner(EdgeGridCredentials credentials, Clock clock, Supplier<String> nonceSupplier) {
        this.credentials = credentials;
        this.clock = clock;
        this.nonceSupplier = nonceSupplier;
    }

    public String sign(String method, URI uri, byte[] body) {
        String timestamp = TIMESTAMP_FORMAT.format(clock.instant());
        String authHeader = ALGORITHM
                + " client_token=" + credentials.getClientToken()
                + ";access_token=" + credentials.getAccessToken()
                + ";timestamp=" + timestamp
                + ";nonce=" + nonceSupplier.get()
                + ";";

        String signingKey = hmacBase64(credentials.getClientSecret(), timestamp);
        String dataToSign = String.join("\t",
                method.toUpperCase(),
                uri.getScheme().toLowerCase(),
                hostWithPort(uri),
                relativeUrl(uri),
                "",
                contentHash(method, body),
                authHeader);

        return authHeader + "signature=" + hmacBase64(signingKey, dataToSign);
    }

    private String contentHash(String method, byte[] body) {
        if (!"POST".equalsIgnoreCase(method) || body == null || body.length == 0) {
            return "";
        }
        byte[] hashed = body.length > credentials.getMaxBody()
                ? Arrays.copyOf(body, credentials.getMaxBody())
                : body;
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return Base64.getEncoder().encodeToString(digest.digest(hashed));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private static String hostWithPort(URI uri) {
        return uri.getPort() == -1 ? uri.getHost() : uri.getHost() + ":" + uri.getPort();
    }

    private static String relativeUrl(URI uri) {
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        return uri.getRawQuery() == null ? path : path + "?" + uri.getRawQuery();
    }

    private static String hmacBase64(String key, String data) {
        try {
            Mac hmac = Mac.getInstance(HMAC_ALGORITHM);
            hmac.init(new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return Base64.getEncoder().encodeToString(hmac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 signing failed", e);
        }
    }
}
