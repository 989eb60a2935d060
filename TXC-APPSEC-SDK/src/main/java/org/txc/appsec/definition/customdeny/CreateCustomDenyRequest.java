package org.txc.appsec.definition.customdeny;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.Positive;

/**
 * Creates a custom deny action from caller-supplied JSON, sent unchanged.
 */
public class CreateCustomDenyRequest {
    @Positive
    private int configId;
    @Positive
    private int version;
    @JsonIgnore
    private String jsonPayloadRaw;

    public CreateCustomDenyRequest() {
    }

    public CreateCustomDenyRequest(int configId, int version, String jsonPayloadRaw) {
        this.configId = configId;
        this.version = version;
        this.jsonPayloadRaw = jsonPayloadRaw;
    }

    public int getConfigId() { return configId; }
    public void setConfigId(int configId) { this.configId = configId; }
    public int getVersion() { return version; }
    public void setVersion(int version) { this.version = version; }
    public String getJsonPayloadRaw() { return jsonPayloadRaw; }
    public void setJsonPayloadRaw(String jsonPayloadRaw) { this.jsonPayloadRaw = jsonPayloadRaw; }
}
