package org.txc.appsec.definition.reputationprofile;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.Positive;

public class UpdateReputationProfileRequest {
    @Positive
    private int configId;
    @Positive
    private int configVersion;
    @Positive
    private int reputationProfileId;
    @JsonIgnore
    private String jsonPayloadRaw;

    public UpdateReputationProfileRequest() {
    }

    public UpdateReputationProfileRequest(int configId, int configVersion, int reputationProfileId, String jsonPayloadRaw) {
        this.configId = configId;
        this.configVersion = configVersion;
        this.reputationProfileId = reputationProfileId;
        this.jsonPayloadRaw = jsonPayloadRaw;
    }

    public int getConfigId() { return configId; }
    public void setConfigId(int configId) { this.configId = configId; }
    public int getConfigVersion() { return configVersion; }
    public void setConfigVersion(int configVersion) { this.configVersion = configVersion; }
    public int getReputationProfileId() { return reputationProfileId; }
    public void setReputationProfileId(int reputationProfileId) { this.reputationProfileId = reputationProfileId; }
    public String getJsonPayloadRaw() { return jsonPayloadRaw; }
    public void setJsonPayloadRaw(String jsonPayloadRaw) { this.jsonPayloadRaw = jsonPayloadRaw; }
}
