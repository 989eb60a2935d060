package org.txc.appsec.definition.matchtarget;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.Positive;

public class UpdateMatchTargetRequest {
    @Positive
    private int configId;
    @Positive
    private int configVersion;
    @Positive
    private int targetId;
    @JsonIgnore
    private String jsonPayloadRaw;

    public UpdateMatchTargetRequest() {
    }

    public UpdateMatchTargetRequest(int configId, int configVersion, int targetId, String jsonPayloadRaw) {
        this.configId = configId;
        this.configVersion = configVersion;
        this.targetId = targetId;
        this.jsonPayloadRaw = jsonPayloadRaw;
    }

    public int getConfigId() { return configId; }
    public void setConfigId(int configId) { this.configId = configId; }
    public int getConfigVersion() { return configVersion; }
    public void setConfigVersion(int configVersion) { this.configVersion = configVersion; }
    public int getTargetId() { return targetId; }
    public void setTargetId(int targetId) { this.targetId = targetId; }
    public String getJsonPayloadRaw() { return jsonPayloadRaw; }
    public void setJsonPayloadRaw(String jsonPayloadRaw) { this.jsonPayloadRaw = jsonPayloadRaw; }
}
