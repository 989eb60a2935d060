package org.txc.appsec.definition.customdeny;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class CustomDenyParameter {
    @JsonIgnore
    private String displayName;
    private String name;
    private String value;

    public CustomDenyParameter() {
    }

    public CustomDenyParameter(String name, String value) {
        this.name = name;
        this.value = value;
    }

    public String getDisplayName() { return displayName; }
    public void setDisplayName(String displayName) { this.displayName = displayName; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getValue() { return value; }
    public void setValue(String value) { this.value = value; }
}
