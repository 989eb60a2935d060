package org.txc.appsec.definition.versionnotes;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.Positive;

/**
 * Replaces the notes of a configuration version. Sent as {@code {"notes": ...}}.
 */
public class UpdateVersionNotesRequest {
    @JsonIgnore
    @Positive
    private int configId;
    @JsonIgnore
    @Positive
    private int version;
    private String notes;

    public UpdateVersionNotesRequest() {
    }

    public UpdateVersionNotesRequest(int configId, int version, String notes) {
        this.configId = configId;
        this.version = version;
        this.notes = notes;
    }

    public int getConfigId() { return configId; }
    public void setConfigId(int configId) { this.configId = configId; }
    public int getVersion() { return version; }
    public void setVersion(int version) { this.version = version; }
    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }
}
