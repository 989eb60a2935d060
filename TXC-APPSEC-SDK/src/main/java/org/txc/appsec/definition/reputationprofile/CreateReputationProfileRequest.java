package org.txc.appsec.definition.reputationprofile;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.Positive;

public class CreateReputationProfileRequest {
    @Positive
    private int configId;
    @Positive
    private int configVersion;
    @JsonIgnore
    private String jsonPayloadRaw;

    public CreateReputationProfileRequest() {
    }

    public CreateReputationProfileRequest(int configId, int configVersion, String jsonPayloadRaw) {
        this.configId = configId;
        this.configVersion = configVersion;
        this.jsonPayloadRaw = jsonPayloadRaw;
    }

    public int getConfigId() { return configId; }
    public void setConfigId(int configId) { this.configId = configId; }
    public int getConfigVersion() { return configVersion; }
    public void setConfigVersion(int configVersion) { this.configVersion = configVersion; }
    public String getJsonPayloadRaw() { return jsonPayloadRaw; }
    public void setJsonPayloadRaw(String jsonPayloadRaw) { this.jsonPayloadRaw = jsonPayloadRaw; }
}
