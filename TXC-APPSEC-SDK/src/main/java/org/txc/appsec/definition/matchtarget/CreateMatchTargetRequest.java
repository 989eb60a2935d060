package org.txc.appsec.definition.matchtarget;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.Positive;

/**
 * Creates a match target from caller-supplied JSON. {@code type} is informational; the payload carries the real one.
 */
public class CreateMatchTargetRequest {
    @Positive
    private int configId;
    @Positive
    private int configVersion;
    private String type;
    @JsonIgnore
    private String jsonPayloadRaw;

    public CreateMatchTargetRequest() {
    }

    public CreateMatchTargetRequest(int configId, int configVersion, String jsonPayloadRaw) {
        this.configId = configId;
        this.configVersion = configVersion;
        this.jsonPayloadRaw = jsonPayloadRaw;
    }

    public int getConfigId() { return configId; }
    public void setConfigId(int configId) { this.configId = configId; }
    public int getConfigVersion() { return configVersion; }
    public void setConfigVersion(int configVersion) { this.configVersion = configVersion; }
    public String getType() { return type; }
    public void setType(String type) { this.type = type; }
    public String getJsonPayloadRaw() { return jsonPayloadRaw; }
    public void setJsonPayloadRaw(String jsonPayloadRaw) { this.jsonPayloadRaw = jsonPayloadRaw; }
}
