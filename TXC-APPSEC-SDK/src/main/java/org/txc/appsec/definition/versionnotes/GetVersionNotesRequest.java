package org.txc.appsec.definition.versionnotes;

import jakarta.validation.constraints.Positive;

public class GetVersionNotesRequest {
    @Positive
    private int configId;
    @Positive
    private int version;

    public GetVersionNotesRequest() {
    }

    public GetVersionNotesRequest(int configId, int version) {
        this.configId = configId;
        this.version = version;
    }

    public int getConfigId() { return configId; }
    public void setConfigId(int configId) { this.configId = configId; }
    public int getVersion() { return version; }
    public void setVersion(int version) { this.version = version; }
}
