package org.txc.appsec.definition.attackgroup;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One attack group of a policy with the action taken when its rules trigger.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AttackGroupAction {
    private String group;
    private String action;
    private ConditionException conditionException;

    public AttackGroupAction() {
    }

    public AttackGroupAction(String group, String action) {
        this.group = group;
        this.action = action;
    }

    public String getGroup() { return group; }
    public void setGroup(String group) { this.group = group; }
    public String getAction() { return action; }
    public void setAction(String action) { this.action = action; }
    public ConditionException getConditionException() { return conditionException; }
    public void setConditionException(ConditionException conditionException) { this.conditionException = conditionException; }

    @Override
    public String toString() {
        return "AttackGroupAction{" + "group='" + group + '\'' + ", action='" + action + '\'' + '}';
    }
}
