package org.txc.appsec.definition.reputationanalysis;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Resets the forwarding flags of a policy. The API has no delete; the flags given here (normally both false) are written with a PUT.
 */
public class RemoveReputationAnalysisRequest {
    @JsonIgnore
    @Positive
    private int configId;
    @JsonIgnore
    @Positive
    private int version;
    @JsonIgnore
    @NotBlank
    private String policyId;
    @JsonProperty("forwardToHTTPHeader")
    private boolean forwardToHttpHeader;
    @JsonProperty("forwardSharedIPToHTTPHeaderAndSIEM")
    private boolean forwardSharedIpToHttpHeaderAndSiem;

    public RemoveReputationAnalysisRequest() {
    }

    public RemoveReputationAnalysisRequest(int configId, int version, String policyId) {
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
    public boolean isForwardToHttpHeader() { return forwardToHttpHeader; }
    public void setForwardToHttpHeader(boolean forwardToHttpHeader) { this.forwardToHttpHeader = forwardToHttpHeader; }
    public boolean isForwardSharedIpToHttpHeaderAndSiem() { return forwardSharedIpToHttpHeaderAndSiem; }
    public void setForwardSharedIpToHttpHeaderAndSiem(boolean forwardSharedIpToHttpHeaderAndSiem) { this.forwardSharedIpToHttpHeaderAndSiem = forwardSharedIpToHttpHeaderAndSiem; }
}
