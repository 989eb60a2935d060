package org.txc.appsec.definition.reputationprofile;

import jakarta.validation.constraints.Positive;

/**
 * Lists reputation profiles; a non-zero {@code reputationProfileId} keeps only that profile.
 */
public class GetReputationProfilesRequest {
    @Positive
    private int configId;
    @Positive
    private int configVersion;
    private int reputationProfileId;

    public GetReputationProfilesRequest() {
    }

    public GetReputationProfilesRequest(int configId, int configVersion) {
        this.configId = configId;
        this.configVersion = configVersion;
    }

    public int getConfigId() { return configId; }
    public void setConfigId(int configId) { this.configId = configId; }
    public int getConfigVersion() { return configVersion; }
    public void setConfigVersion(int configVersion) { this.configVersion = configVersion; }
    public int getReputationProfileId() { return reputationProfileId; }
    public void setReputationProfileId(int reputationProfileId) { this.reputationProfileId = reputationProfileId; }
}
