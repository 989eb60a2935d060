package org.txc.appsec.definition.matchtarget;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GetMatchTargetsResponse {
    private MatchTargets matchTargets;

    public MatchTargets getMatchTargets() { return matchTargets; }
    public void setMatchTargets(MatchTargets matchTargets) { this.matchTargets = matchTargets; }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class MatchTargets {
        private List<MatchTarget> apiTargets;
        private List<MatchTarget> websiteTargets;

        public List<MatchTarget> getApiTargets() { return apiTargets; }
        public void setApiTargets(List<MatchTarget> apiTargets) { this.apiTargets = apiTargets; }
        public List<MatchTarget> getWebsiteTargets() { return websiteTargets; }
        public void setWebsiteTargets(List<MatchTarget> websiteTargets) { this.websiteTargets = websiteTargets; }
    }
}
