package org.txc.appsec.definition.configurationclone;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.List;

/**
 * Creates a new configuration by cloning an existing configuration version. Serialized as-is.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CreateConfigurationCloneRequest {
    private String name;
    private String description;
    private String contractId;
    private Integer groupId;
    private List<String> hostnames;
    @NotNull
    @Valid
    private CreateFrom createFrom;

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public String getContractId() { return contractId; }
    public void setContractId(String contractId) { this.contractId = contractId; }
    public Integer getGroupId() { return groupId; }
    public void setGroupId(Integer groupId) { this.groupId = groupId; }
    public List<String> getHostnames() { return hostnames; }
    public void setHostnames(List<String> hostnames) { this.hostnames = hostnames; }
    public CreateFrom getCreateFrom() { return createFrom; }
    public void setCreateFrom(CreateFrom createFrom) { this.createFrom = createFrom; }

    public static class CreateFrom {
        @Positive
        private int configId;
        private int version;

        public CreateFrom() {
        }

        public CreateFrom(int configId, int version) {
            this.configId = configId;
            this.version = version;
        }

        public int getConfigId() { return configId; }
        public void setConfigId(int configId) { this.configId = configId; }
        public int getVersion() { return version; }
        public void setVersion(int version) { this.version = version; }
    }
}
