package org.txc.appsec.definition.reputationprofile;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReputationProfileCondition {
    private List<AtomicCondition> atomicConditions;
    private Boolean positiveMatch;

    public List<AtomicCondition> getAtomicConditions() { return atomicConditions; }
    public void setAtomicConditions(List<AtomicCondition> atomicConditions) { this.atomicConditions = atomicConditions; }
    public Boolean getPositiveMatch() { return positiveMatch; }
    public void setPositiveMatch(Boolean positiveMatch) { this.positiveMatch = positiveMatch; }
}
