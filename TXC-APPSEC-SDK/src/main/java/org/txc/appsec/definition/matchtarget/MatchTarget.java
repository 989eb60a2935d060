package org.txc.appsec.definition.matchtarget;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * A match target: which API endpoints ({@code type = "api"}) or website hostnames and paths
 * ({@code type = "website"}) a security policy protects.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MatchTarget {
    private String type;
    private Integer configId;
    private Integer configVersion;
    private int targetId;
    private Integer sequence;
    private List<ApiReference> apis;
    private String defaultFile;
    private List<String> hostnames;
    private Boolean isNegativeFileExtensionMatch;
    private Boolean isNegativePathMatch;
    private List<String> filePaths;
    private List<String> fileExtensions;
    private SecurityPolicyReference securityPolicy;
    private List<BypassNetworkList> bypassNetworkLists;

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }
    public Integer getConfigId() { return configId; }
    public void setConfigId(Integer configId) { this.configId = configId; }
    public Integer getConfigVersion() { return configVersion; }
    public void setConfigVersion(Integer configVersion) { this.configVersion = configVersion; }
    public int getTargetId() { return targetId; }
    public void setTargetId(int targetId) { this.targetId = targetId; }
    public Integer getSequence() { return sequence; }
    public void setSequence(Integer sequence) { this.sequence = sequence; }
    public List<ApiReference> getApis() { return apis; }
    public void setApis(List<ApiReference> apis) { this.apis = apis; }
    public String getDefaultFile() { return defaultFile; }
    public void setDefaultFile(String defaultFile) { this.defaultFile = defaultFile; }
    public List<String> getHostnames() { return hostnames; }
    public void setHostnames(List<String> hostnames) { this.hostnames = hostnames; }
    public Boolean getIsNegativeFileExtensionMatch() { return isNegativeFileExtensionMatch; }
    public void setIsNegativeFileExtensionMatch(Boolean isNegativeFileExtensionMatch) { this.isNegativeFileExtensionMatch = isNegativeFileExtensionMatch; }
    public Boolean getIsNegativePathMatch() { return isNegativePathMatch; }
    public void setIsNegativePathMatch(Boolean isNegativePathMatch) { this.isNegativePathMatch = isNegativePathMatch; }
    public List<String> getFilePaths() { return filePaths; }
    public void setFilePaths(List<String> filePaths) { this.filePaths = filePaths; }
    public List<String> getFileExtensions() { return fileExtensions; }
    public void setFileExtensions(List<String> fileExtensions) { this.fileExtensions = fileExtensions; }
    public SecurityPolicyReference getSecurityPolicy() { return securityPolicy; }
    public void setSecurityPolicy(SecurityPolicyReference securityPolicy) { this.securityPolicy = securityPolicy; }
    public List<BypassNetworkList> getBypassNetworkLists() { return bypassNetworkLists; }
    public void setBypassNetworkLists(List<BypassNetworkList> bypassNetworkLists) { this.bypassNetworkLists = bypassNetworkLists; }

    @Override
    public String toString() {
        return "MatchTarget{" + "type='" + type + '\'' + ", targetId=" + targetId + '}';
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiReference {
        private int id;
        private String name;

        public int getId() { return id; }
        public void setId(int id) { this.id = id; }
        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class SecurityPolicyReference {
        private String policyId;

        public String getPolicyId() { return policyId; }
        public void setPolicyId(String policyId) { this.policyId = policyId; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class BypassNetworkList {
        private String id;
        private String name;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }
        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
    }
}
