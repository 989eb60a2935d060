package org.txc.appsec.definition.reputationanalysis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Whether reputation scores are forwarded to the origin in an HTTP header and, for shared IPs, to SIEM.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReputationAnalysisSettings {
    @JsonProperty("forwardToHTTPHeader")
    private boolean forwardToHttpHeader;
    @JsonProperty("forwardSharedIPToHTTPHeaderAndSIEM")
    private boolean forwardSharedIpToHttpHeaderAndSiem;

    public boolean isForwardToHttpHeader() { return forwardToHttpHeader; }
    public void setForwardToHttpHeader(boolean forwardToHttpHeader) { this.forwardToHttpHeader = forwardToHttpHeader; }
    public boolean isForwardSharedIpToHttpHeaderAndSiem() { return forwardSharedIpToHttpHeaderAndSiem; }
    public void setForwardSharedIpToHttpHeaderAndSiem(boolean forwardSharedIpToHttpHeaderAndSiem) { this.forwardSharedIpToHttpHeaderAndSiem = forwardSharedIpToHttpHeaderAndSiem; }

    @Override
    public String toString() {
        return "ReputationAnalysisSettings{" + "forwardToHTTPHeader=" + forwardToHttpHeader
                + ", forwardSharedIPToHTTPHeaderAndSIEM=" + forwardSharedIpToHttpHeaderAndSiem + '}';
    }
}
