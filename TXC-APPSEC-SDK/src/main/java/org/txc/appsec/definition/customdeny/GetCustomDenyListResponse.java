package org.txc.appsec.definition.customdeny;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GetCustomDenyListResponse {
    private List<CustomDeny> customDenyList;

    public List<CustomDeny> getCustomDenyList() { return customDenyList; }
    public void setCustomDenyList(List<CustomDeny> customDenyList) { this.customDenyList = customDenyList; }
}
