package org.txc.appsec.definition.reputationprofile;

import jakarta.validation.constraints.Positive;

public class GetReputationProfileRequest {
    @Positive
    private int configId;
    @Positive
    private int configVersion;
    @Positive
    private int reputationProfileId;

    public GetReputationProfileRequest() {
    }

    public GetReputationProfileRequest(int configId, int configVersion, int reputationProfileId) {
        this.configId = configId;
        this.configVersion = configVersion;
        this.reputationProfileId = reputationProfileId;
    }

    public int getConfigId() { return configId; }
    public void setConfigId(int configId) { this.configId = configId; }
    public int getConfigVersion() { return configVersion; }
    public void setConfigVersion(int configVersion) { this.configVersion = configVersion; }
    public int getReputationProfileId() { return reputationProfileId; }
    public void setReputationProfileId(int reputationProfileId) { this.reputationProfileId = reputationProfileId; }
}
