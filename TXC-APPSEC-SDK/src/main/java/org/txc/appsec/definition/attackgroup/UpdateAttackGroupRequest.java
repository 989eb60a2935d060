package org.txc.appsec.definition.attackgroup;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Sets the action of an attack group and, optionally, its condition/exception block given as raw JSON.
 * Serialized as {@code {"action": ..., "conditionException": <raw>}}.
 */
public class UpdateAttackGroupRequest {
    @JsonIgnore
    @Positive
    private int configId;
    @JsonIgnore
    @Positive
    private int version;
    @JsonIgnore
    @NotBlank
    private String policyId;
    @JsonIgnore
    @NotBlank
    private String group;

    private String action;

    @JsonProperty("conditionException")
    @JsonRawValue
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private String jsonPayloadRaw;

    public UpdateAttackGroupRequest() {
    }

    public UpdateAttackGroupRequest(int configId, int version, String policyId, String group, String action) {
        this.configId = configId;
        this.version = version;
        this.policyId = policyId;
        this.group = group;
        this.action = action;
    }

    public int getConfigId() { return configId; }
    public void setConfigId(int configId) { this.configId = configId; }
    public int getVersion() { return version; }
    public void setVersion(int version) { this.version = version; }
    public String getPolicyId() { return policyId; }
    public void setPolicyId(String policyId) { this.policyId = policyId; }
    public String getGroup() { return group; }
    public void setGroup(String group) { this.group = group; }
    public String getAction() { return action; }
    public void setAction(String action) { this.action = action; }
    public String getJsonPayloadRaw() { return jsonPayloadRaw; }
    public void setJsonPayloadRaw(String jsonPayloadRaw) { this.jsonPayloadRaw = jsonPayloadRaw; }
}
