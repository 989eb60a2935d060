package org.txc.appsec.definition.customdeny;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.txc.appsec.json.FlexibleStringDeserializer;

import java.util.List;

/**
 * A custom deny action. The API reports {@code id} either as a string or as a number.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CustomDeny {
    private String description;
    private String name;
    @JsonDeserialize(using = FlexibleStringDeserializer.class)
    private String id;
    private List<CustomDenyParameter> parameters;

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public List<CustomDenyParameter> getParameters() { return parameters; }
    public void setParameters(List<CustomDenyParameter> parameters) { this.parameters = parameters; }

    @Override
    public String toString() {
        return "CustomDeny{" + "id='" + id + '\'' + ", name='" + name + '\'' + '}';
    }
}
