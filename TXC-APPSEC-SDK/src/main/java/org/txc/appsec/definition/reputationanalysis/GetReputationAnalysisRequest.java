package org.txc.appsec.definition.reputationanalysis;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

public class GetReputationAnalysisRequest {
    @Positive
    private int configId;
    @Positive
    private int version;
    @NotBlank
    private String policyId;

    public GetReputationAnalysisRequest() {
    }

    public GetReputationAnalysisRequest(int configId, int version, String policyId) {
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
}
