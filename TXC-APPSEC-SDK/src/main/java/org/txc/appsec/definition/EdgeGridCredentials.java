package org.txc.appsec.definition;

import java.util.Objects;

/**
 * API client credentials as found in an {@code .edgerc} section or the AKAMAI_* environment.
 */
public class EdgeGridCredentials {
    public static final int DEFAULT_MAX_BODY = 131072;

    private String host;
    private String clientToken;
    private String clientSecret;
    private String accessToken;
    private int maxBody = DEFAULT_MAX_BODY;

    public EdgeGridCredentials() {
    }

    public EdgeGridCredentials(String host, String clientToken, String clientSecret, String accessToken, int maxBody) {
        this.host = host;
        this.clientToken = clientToken;
        this.clientSecret = clientSecret;
        this.accessToken = accessToken;
        this.maxBody = maxBody;
    }

    // Getters and Setters
    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }
    public String getClientToken() { return clientToken; }
    public void setClientToken(String clientToken) { this.clientToken = clientToken; }
    public String getClientSecret() { return clientSecret; }
    public void setClientSecret(String clientSecret) { this.clientSecret = clientSecret; }
    public String getAccessToken() { return accessToken; }
    public void setAccessToken(String accessToken) { this.accessToken = accessToken; }
    public int getMaxBody() { return maxBody; }
    public void setMaxBody(int maxBody) { this.maxBody = maxBody; }

    /**
     * Hosts in credential files carry no scheme, so HTTPS is assumed unless one is given explicitly.
     */
    public String getBaseUrl() {
        return host.contains("://") ? host : "https://" + host;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EdgeGridCredentials that = (EdgeGridCredentials) o;
        return maxBody == that.maxBody
                && Objects.equals(host, that.host)
                && Objects.equals(clientToken, that.clientToken)
                && Objects.equals(clientSecret, that.clientSecret)
                && Objects.equals(accessToken, that.accessToken);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, clientToken, clientSecret, accessToken, maxBody);
    }

    @Override
    public String toString() {
        // Secrets stay out of logs.
        return "EdgeGridCredentials{" + "host='" + host + '\'' + ", maxBody=" + maxBody + '}';
    }
}
