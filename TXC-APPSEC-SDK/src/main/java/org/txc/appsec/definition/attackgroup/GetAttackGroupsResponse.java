package org.txc.appsec.definition.attackgroup;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GetAttackGroupsResponse {
    @JsonProperty("attackGroupActions")
    private List<AttackGroupAction> attackGroups;

    public List<AttackGroupAction> getAttackGroups() { return attackGroups; }
    public void setAttackGroups(List<AttackGroupAction> attackGroups) { this.attackGroups = attackGroups; }
}
