package org.txc.appsec.definition.matchtarget;

import jakarta.validation.constraints.Positive;

public class RemoveMatchTargetRequest {
    @Positive
    private int configId;
    @Positive
    private int configVersion;
    @Positive
    private int targetId;

    public RemoveMatchTargetRequest() {
    }

    public RemoveMatchTargetRequest(int configId, int configVersion, int targetId) {
        this.configId = configId;
        this.configVersion = configVersion;
        this.targetId = targetId;
    }

    public int getConfigId() { return configId; }
    public void setConfigId(int configId) { this.configId = configId; }
    public int getConfigVersion() { return configVersion; }
    public void setConfigVersion(int configVersion) { this.configVersion = configVersion; }
    public int getTargetId() { return targetId; }
    public void setTargetId(int targetId) { this.targetId = targetId; }
}
