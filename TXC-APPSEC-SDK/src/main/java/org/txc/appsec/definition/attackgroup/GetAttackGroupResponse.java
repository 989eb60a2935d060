package org.txc.appsec.definition.attackgroup;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GetAttackGroupResponse {
    private String action;
    private ConditionException conditionException;

    public String getAction() { return action; }
    public void setAction(String action) { this.action = action; }
    public ConditionException getConditionException() { return conditionException; }
    public void setConditionException(ConditionException conditionException) { this.conditionException = conditionException; }

    @JsonIgnore
    public boolean isEmptyConditionException() {
        return conditionException == null;
    }
}
