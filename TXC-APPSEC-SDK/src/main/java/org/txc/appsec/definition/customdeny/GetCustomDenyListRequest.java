package org.txc.appsec.definition.customdeny;

import jakarta.validation.constraints.Positive;

/**
 * Lists the custom deny actions of a configuration version, optionally narrowed to one {@code id}.
 */
public class GetCustomDenyListRequest {
    @Positive
    private int configId;
    @Positive
    private int version;
    private String id;

    public GetCustomDenyListRequest() {
    }

    public GetCustomDenyListRequest(int configId, int version) {
        this.configId = configId;
        this.version = version;
    }

    public int getConfigId() { return configId; }
    public void setConfigId(int configId) { this.configId = configId; }
    public int getVersion() { return version; }
    public void setVersion(int version) { this.version = version; }
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
}
