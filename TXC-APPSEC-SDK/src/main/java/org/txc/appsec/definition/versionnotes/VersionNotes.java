package org.txc.appsec.definition.versionnotes;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Free-text notes attached to a configuration version.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class VersionNotes {
    private String notes;

    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }
}
