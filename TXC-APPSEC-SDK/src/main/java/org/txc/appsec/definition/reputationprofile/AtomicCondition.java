package org.txc.appsec.definition.reputationprofile;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.txc.appsec.json.FlexibleStringDeserializer;
import org.txc.appsec.json.FlexibleStringListDeserializer;

import java.util.List;

/**
 * One clause of a reputation profile condition. {@code name} arrives either as a single string or as an array.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AtomicCondition {
    private String className;
    private Integer index;
    @JsonDeserialize(using = FlexibleStringDeserializer.class)
    private String checkIps;
    private Boolean positiveMatch;
    @JsonDeserialize(using = FlexibleStringListDeserializer.class)
    private List<String> name;
    private Boolean nameCase;
    private Boolean nameWildcard;
    private List<String> value;
    private Boolean valueCase;
    private Boolean valueWildcard;
    private List<String> host;

    public String getClassName() { return className; }
    public void setClassName(String className) { this.className = className; }
    public Integer getIndex() { return index; }
    public void setIndex(Integer index) { this.index = index; }
    public String getCheckIps() { return checkIps; }
    public void setCheckIps(String checkIps) { this.checkIps = checkIps; }
    public Boolean getPositiveMatch() { return positiveMatch; }
    public void setPositiveMatch(Boolean positiveMatch) { this.positiveMatch = positiveMatch; }
    public List<String> getName() { return name; }
    public void setName(List<String> name) { this.name = name; }
    public Boolean getNameCase() { return nameCase; }
    public void setNameCase(Boolean nameCase) { this.nameCase = nameCase; }
    public Boolean getNameWildcard() { return nameWildcard; }
    public void setNameWildcard(Boolean nameWildcard) { this.nameWildcard = nameWildcard; }
    public List<String> getValue() { return value; }
    public void setValue(List<String> value) { this.value = value; }
    public Boolean getValueCase() { return valueCase; }
    public void setValueCase(Boolean valueCase) { this.valueCase = valueCase; }
    public Boolean getValueWildcard() { return valueWildcard; }
    public void setValueWildcard(Boolean valueWildcard) { this.valueWildcard = valueWildcard; }
    public List<String> getHost() { return host; }
    public void setHost(List<String> host) { this.host = host; }
}
