package org.txc.appsec.definition.hostnamecoverage;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GetApiHostnameCoverageOverlappingResponse {
    @JsonProperty("overLappingList")
    private List<OverlappingConfiguration> overlappingList;

    public List<OverlappingConfiguration> getOverlappingList() { return overlappingList; }
    public void setOverlappingList(List<OverlappingConfiguration> overlappingList) { this.overlappingList = overlappingList; }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class OverlappingConfiguration {
        private int configId;
        private String configName;
        private int configVersion;
        private String contractId;
        private String contractName;
        private List<String> versionTags;

        public int getConfigId() { return configId; }
        public void setConfigId(int configId) { this.configId = configId; }
        public String getConfigName() { return configName; }
        public void setConfigName(String configName) { this.configName = configName; }
        public int getConfigVersion() { return configVersion; }
        public void setConfigVersion(int configVersion) { this.configVersion = configVersion; }
        public String getContractId() { return contractId; }
        public void setContractId(String contractId) { this.contractId = contractId; }
        public String getContractName() { return contractName; }
        public void setContractName(String contractName) { this.contractName = contractName; }
        public List<String> getVersionTags() { return versionTags; }
        public void setVersionTags(List<String> versionTags) { this.versionTags = versionTags; }
    }
}
