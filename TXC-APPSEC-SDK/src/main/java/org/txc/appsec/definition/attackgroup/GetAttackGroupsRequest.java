package org.txc.appsec.definition.attackgroup;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Lists the attack groups of a security policy. {@code group}, when set, narrows the result
 * client-side since the API has no such filter.
 */
public class GetAttackGroupsRequest {
    @Positive
    private int configId;
    @Positive
    private int version;
    @NotBlank
    private String policyId;
    private String group;

    public GetAttackGroupsRequest() {
    }

    public GetAttackGroupsRequest(int configId, int version, String policyId) {
        this.configId = configId;
        this.version = version;
        this.policyId = policyId;
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
