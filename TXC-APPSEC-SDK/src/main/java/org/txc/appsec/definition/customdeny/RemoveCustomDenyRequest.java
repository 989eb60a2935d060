package org.txc.appsec.definition.customdeny;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

public class RemoveCustomDenyRequest {
    @Positive
    private int configId;
    @Positive
    private int version;
    @NotBlank
    private String id;

    public RemoveCustomDenyRequest() {
    }

    public RemoveCustomDenyRequest(int configId, int version, String id) {
        this.configId = configId;
        this.version = version;
        this.id = id;
    }

    public int getConfigId() { return configId; }
    public void setConfigId(int configId) { this.configId = configId; }
    public int getVersion() { return version; }
    public void setVersion(int version) { this.version = version; }
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
}
