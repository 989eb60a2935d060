package org.txc.appsec.definition.customdeny;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Replaces a custom deny action. {@code jsonPayloadRaw} is sent byte-for-byte.
 */
public class UpdateCustomDenyRequest {
    @Positive
    private int configId;
    @Positive
    private int version;
    @NotBlank
    private String id;
    @JsonIgnore
    private String jsonPayloadRaw;

    public UpdateCustomDenyRequest() {
    }

    public UpdateCustomDenyRequest(int configId, int version, String id, String jsonPayloadRaw) {
        this.configId = configId;
        this.version = version;
        this.id = id;
        this.jsonPayloadRaw = jsonPayloadRaw;
    }

    public int getConfigId() { return configId; }
    public void setConfigId(int configId) { this.configId = configId; }
    public int getVersion() { return version; }
    public void setVersion(int version) { this.version = version; }
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getJsonPayloadRaw() { return jsonPayloadRaw; }
    public void setJsonPayloadRaw(String jsonPayloadRaw) { this.jsonPayloadRaw = jsonPayloadRaw; }
}
