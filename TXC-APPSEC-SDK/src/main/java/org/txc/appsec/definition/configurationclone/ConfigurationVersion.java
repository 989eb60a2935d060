package org.txc.appsec.definition.configurationclone;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Details of one configuration version, including where it is activated.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConfigurationVersion {
    private int configId;
    private String configName;
    private int version;
    private String versionNotes;
    private Instant createDate;
    private String createdBy;
    private Integer basedOn;
    private Activation production;
    private Activation staging;

    public int getConfigId() { return configId; }
    public void setConfigId(int configId) { this.configId = configId; }
    public String getConfigName() { return configName; }
    public void setConfigName(String configName) { this.configName = configName; }
    public int getVersion() { return version; }
    public void setVersion(int version) { this.version = version; }
    public String getVersionNotes() { return versionNotes; }
    public void setVersionNotes(String versionNotes) { this.versionNotes = versionNotes; }
    public Instant getCreateDate() { return createDate; }
    public void setCreateDate(Instant createDate) { this.createDate = createDate; }
    public String getCreatedBy() { return createdBy; }
    public void setCreatedBy(String createdBy) { this.createdBy = createdBy; }
    public Integer getBasedOn() { return basedOn; }
    public void setBasedOn(Integer basedOn) { this.basedOn = basedOn; }
    public Activation getProduction() { return production; }
    public void setProduction(Activation production) { this.production = production; }
    public Activation getStaging() { return staging; }
    public void setStaging(Activation staging) { this.staging = staging; }

    /**
     * Activation state on one network; {@code time} is absent when the version was never activated there.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Activation {
        private String status;
        private Instant time;

        public String getStatus() { return status; }
        public void setStatus(String status) { this.status = status; }
        public Instant getTime() { return time; }
        public void setTime(Instant time) { this.time = time; }
    }
}
