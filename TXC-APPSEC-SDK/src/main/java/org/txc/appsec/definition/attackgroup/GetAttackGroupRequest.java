package org.txc.appsec.definition.attackgroup;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

public class GetAttackGroupRequest {
    @Positive
    private int configId;
    @Positive
    private int version;
    @NotBlank
    private String policyId;
    @NotBlank
    private String group;

    public GetAttackGroupRequest() {
    }

    public GetAttackGroupRequest(int configId, int version, String policyId, String group) {
        this.configId = configId;
        this.version = version;
        this.policyId = policyId;
        this.group = group;
    }

    public int getConfigId() { return configId; }
    public void setConfigId(int configId) { this.configId = configId; }
    public int getVersion() { return version; }
    public void setVersion(int version) { this.version = version; }
    public String getPolicyId() { return policyId; }
    public void setPolicyId(String policyId) { this.policyId = policyId; }
    public String getGroup() { return group; }
    public void setGroup(String group) { this.group = group; }
}
