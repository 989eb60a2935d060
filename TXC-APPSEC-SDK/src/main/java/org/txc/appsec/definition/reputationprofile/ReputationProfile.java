package org.txc.appsec.definition.reputationprofile;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Client reputation profile: the reputation category, score threshold and optional match condition.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReputationProfile {
    private int id;
    private String name;
    private String description;
    private String context;
    private String contextReadable;
    private Boolean enabled;
    private String sharedIpHandling;
    private Integer threshold;
    private ReputationProfileCondition condition;

    public int getId() { return id; }
    public void setId(int id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public String getContext() { return context; }
    public void setContext(String context) { this.context = context; }
    public String getContextReadable() { return contextReadable; }
    public void setContextReadable(String contextReadable) { this.contextReadable = contextReadable; }
    public Boolean getEnabled() { return enabled; }
    public void setEnabled(Boolean enabled) { this.enabled = enabled; }
    public String getSharedIpHandling() { return sharedIpHandling; }
    public void setSharedIpHandling(String sharedIpHandling) { this.sharedIpHandling = sharedIpHandling; }
    public Integer getThreshold() { return threshold; }
    public void setThreshold(Integer threshold) { this.threshold = threshold; }
    public ReputationProfileCondition getCondition() { return condition; }
    public void setCondition(ReputationProfileCondition condition) { this.condition = condition; }

    @Override
    public String toString() {
        return "ReputationProfile{" + "id=" + id + ", name='" + name + '\'' + ", context='" + context + '\'' + '}';
    }
}
