package org.txc.appsec.definition.reputationprofile;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GetReputationProfilesResponse {
    private List<ReputationProfile> reputationProfiles;

    public List<ReputationProfile> getReputationProfiles() { return reputationProfiles; }
    public void setReputationProfiles(List<ReputationProfile> reputationProfiles) { this.reputationProfiles = reputationProfiles; }
}
