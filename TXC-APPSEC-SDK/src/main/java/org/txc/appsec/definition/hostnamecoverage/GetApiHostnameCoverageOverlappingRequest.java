package org.txc.appsec.definition.hostnamecoverage;

import jakarta.validation.constraints.Positive;

/**
 * Asks which other configurations also cover {@code hostname}. Without a hostname the API reports every overlap.
 */
public class GetApiHostnameCoverageOverlappingRequest {
    @Positive
    private int configId;
    @Positive
    private int version;
    private String hostname;

    public GetApiHostnameCoverageOverlappingRequest() {
    }

    public GetApiHostnameCoverageOverlappingRequest(int configId, int version, String hostname) {
        this.configId = configId;
        this.version = version;
        this.hostname = hostname;
    }

    public int getConfigId() { return configId; }
    public void setConfigId(int configId) { this.configId = configId; }
    public int getVersion() { return version; }
    public void setVersion(int version) { this.version = version; }
    public String getHostname() { return hostname; }
    public void setHostname(String hostname) { this.hostname = hostname; }
}
