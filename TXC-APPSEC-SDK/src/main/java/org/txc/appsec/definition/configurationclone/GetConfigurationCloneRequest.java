package org.txc.appsec.definition.configurationclone;

import jakarta.validation.constraints.Positive;

public class GetConfigurationCloneRequest {
    @Positive
    private int configId;
    @Positive
    private int version;

    public GetConfigurationCloneRequest() {
    }

    public GetConfigurationCloneRequest(int configId, int version) {
        this.configId = configId;
        this.version = version;
    }

    public int getConfigId() { return configId; }
    public void setConfigId(int configId) { this.configId = configId; }
    public int getVersion() { return version; }
    public void setVersion(int version) { this.version = version; }
}
