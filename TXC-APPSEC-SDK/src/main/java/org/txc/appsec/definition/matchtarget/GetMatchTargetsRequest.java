package org.txc.appsec.definition.matchtarget;

import jakarta.validation.constraints.Positive;

/**
 * Lists API and website match targets; a non-zero {@code targetId} keeps only that target.
 */
public class GetMatchTargetsRequest {
    @Positive
    private int configId;
    @Positive
    private int configVersion;
    private int targetId;

    public GetMatchTargetsRequest() {
    }

    public GetMatchTargetsRequest(int configId, int configVersion) {
        this.configId = configId;
        this.configVersion = configVersion;
    }

    public int getConfigId() { return configId; }
    public void setConfigId(int configId) { this.configId = configId; }
    public int getConfigVersion() { return configVersion; }
    public void setConfigVersion(int configVersion) { this.configVersion = configVersion; }
    public int getTargetId() { return targetId; }
    public void setTargetId(int targetId) { this.targetId = targetId; }
}
