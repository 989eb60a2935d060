package org.txc.appsec.definition.attackgroup;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Conditions and exceptions that scope when an attack group's rules apply.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConditionException {
    private AdvancedExceptions advancedExceptions;
    private BasicException exception;

    public AdvancedExceptions getAdvancedExceptions() { return advancedExceptions; }
    public void setAdvancedExceptions(AdvancedExceptions advancedExceptions) { this.advancedExceptions = advancedExceptions; }
    public BasicException getException() { return exception; }
    public void setException(BasicException exception) { this.exception = exception; }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class AdvancedExceptions {
        private String conditionOperator;
        private List<Condition> conditions;
        private List<HeaderCookieOrParamValues> headerCookieOrParamValues;
        private List<SpecificNameValue> specificHeaderCookieOrParamNameValue;
        @JsonProperty("specificHeaderCookieParamXmlOrJsonNames")
        private List<SpecificXmlOrJsonNames> specificHeaderCookieParamXmlOrJsonNames;

        public String getConditionOperator() { return conditionOperator; }
        public void setConditionOperator(String conditionOperator) { this.conditionOperator = conditionOperator; }
        public List<Condition> getConditions() { return conditions; }
        public void setConditions(List<Condition> conditions) { this.conditions = conditions; }
        public List<HeaderCookieOrParamValues> getHeaderCookieOrParamValues() { return headerCookieOrParamValues; }
        public void setHeaderCookieOrParamValues(List<HeaderCookieOrParamValues> headerCookieOrParamValues) { this.headerCookieOrParamValues = headerCookieOrParamValues; }
        public List<SpecificNameValue> getSpecificHeaderCookieOrParamNameValue() { return specificHeaderCookieOrParamNameValue; }
        public void setSpecificHeaderCookieOrParamNameValue(List<SpecificNameValue> specificHeaderCookieOrParamNameValue) { this.specificHeaderCookieOrParamNameValue = specificHeaderCookieOrParamNameValue; }
        public List<SpecificXmlOrJsonNames> getSpecificHeaderCookieParamXmlOrJsonNames() { return specificHeaderCookieParamXmlOrJsonNames; }
        public void setSpecificHeaderCookieParamXmlOrJsonNames(List<SpecificXmlOrJsonNames> specificHeaderCookieParamXmlOrJsonNames) { this.specificHeaderCookieParamXmlOrJsonNames = specificHeaderCookieParamXmlOrJsonNames; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    public static class Condition {
        private String type;
        private List<String> extensions;
        private List<String> filenames;
        private List<String> hosts;
        private List<String> ips;
        private List<String> methods;
        private List<String> paths;
        private String header;
        private boolean caseSensitive;
        private String name;
        private boolean nameCase;
        @JsonInclude(JsonInclude.Include.ALWAYS)
        private boolean positiveMatch;
        private String value;
        private boolean wildcard;
        private boolean valueCase;
        private boolean valueWildcard;
        private boolean useHeaders;

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public List<String> getExtensions() { return extensions; }
        public void setExtensions(List<String> extensions) { this.extensions = extensions; }
        public List<String> getFilenames() { return filenames; }
        public void setFilenames(List<String> filenames) { this.filenames = filenames; }
        public List<String> getHosts() { return hosts; }
        public void setHosts(List<String> hosts) { this.hosts = hosts; }
        public List<String> getIps() { return ips; }
        public void setIps(List<String> ips) { this.ips = ips; }
        public List<String> getMethods() { return methods; }
        public void setMethods(List<String> methods) { this.methods = methods; }
        public List<String> getPaths() { return paths; }
        public void setPaths(List<String> paths) { this.paths = paths; }
        public String getHeader() { return header; }
        public void setHeader(String header) { this.header = header; }
        public boolean isCaseSensitive() { return caseSensitive; }
        public void setCaseSensitive(boolean caseSensitive) { this.caseSensitive = caseSensitive; }
        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public boolean isNameCase() { return nameCase; }
        public void setNameCase(boolean nameCase) { this.nameCase = nameCase; }
        public boolean isPositiveMatch() { return positiveMatch; }
        public void setPositiveMatch(boolean positiveMatch) { this.positiveMatch = positiveMatch; }
        public String getValue() { return value; }
        public void setValue(String value) { this.value = value; }
        public boolean isWildcard() { return wildcard; }
        public void setWildcard(boolean wildcard) { this.wildcard = wildcard; }
        public boolean isValueCase() { return valueCase; }
        public void setValueCase(boolean valueCase) { this.valueCase = valueCase; }
        public boolean isValueWildcard() { return valueWildcard; }
        public void setValueWildcard(boolean valueWildcard) { this.valueWildcard = valueWildcard; }
        public boolean isUseHeaders() { return useHeaders; }
        public void setUseHeaders(boolean useHeaders) { this.useHeaders = useHeaders; }
    }

    /**
     * Hostname/path scope limiting where an advanced exception applies.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Criteria {
        private List<String> hostnames;
        private List<String> names;
        private List<String> paths;
        private List<String> values;

        public List<String> getHostnames() { return hostnames; }
        public void setHostnames(List<String> hostnames) { this.hostnames = hostnames; }
        public List<String> getNames() { return names; }
        public void setNames(List<String> names) { this.names = names; }
        public List<String> getPaths() { return paths; }
        public void setPaths(List<String> paths) { this.paths = paths; }
        public List<String> getValues() { return values; }
        public void setValues(List<String> values) { this.values = values; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class HeaderCookieOrParamValues {
        private List<Criteria> criteria;
        private boolean valueWildcard;
        private List<String> values;

        public List<Criteria> getCriteria() { return criteria; }
        public void setCriteria(List<Criteria> criteria) { this.criteria = criteria; }
        public boolean isValueWildcard() { return valueWildcard; }
        public void setValueWildcard(boolean valueWildcard) { this.valueWildcard = valueWildcard; }
        public List<String> getValues() { return values; }
        public void setValues(List<String> values) { this.values = values; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class SpecificNameValue {
        private List<Criteria> criteria;
        private List<NamesValues> namesValues;
        private String selector;
        private boolean valueWildcard;
        private boolean wildcard;

        public List<Criteria> getCriteria() { return criteria; }
        public void setCriteria(List<Criteria> criteria) { this.criteria = criteria; }
        public List<NamesValues> getNamesValues() { return namesValues; }
        public void setNamesValues(List<NamesValues> namesValues) { this.namesValues = namesValues; }
        public String getSelector() { return selector; }
        public void setSelector(String selector) { this.selector = selector; }
        public boolean isValueWildcard() { return valueWildcard; }
        public void setValueWildcard(boolean valueWildcard) { this.valueWildcard = valueWildcard; }
        public boolean isWildcard() { return wildcard; }
        public void setWildcard(boolean wildcard) { this.wildcard = wildcard; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class NamesValues {
        private List<String> names;
        private List<String> values;

        public List<String> getNames() { return names; }
        public void setNames(List<String> names) { this.names = names; }
        public List<String> getValues() { return values; }
        public void setValues(List<String> values) { this.values = values; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class SpecificXmlOrJsonNames {
        private List<Criteria> criteria;
        private List<String> names;
        private String selector;
        private boolean wildcard;

        public List<Criteria> getCriteria() { return criteria; }
        public void setCriteria(List<Criteria> criteria) { this.criteria = criteria; }
        public List<String> getNames() { return names; }
        public void setNames(List<String> names) { this.names = names; }
        public String getSelector() { return selector; }
        public void setSelector(String selector) { this.selector = selector; }
        public boolean isWildcard() { return wildcard; }
        public void setWildcard(boolean wildcard) { this.wildcard = wildcard; }
    }

    /**
     * Exception block without criteria, as returned by older configurations.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class BasicException {
        @JsonProperty("specificHeaderCookieParamXmlOrJsonNames")
        private List<SpecificXmlOrJsonNames> specificHeaderCookieParamXmlOrJsonNames;

        public List<SpecificXmlOrJsonNames> getSpecificHeaderCookieParamXmlOrJsonNames() { return specificHeaderCookieParamXmlOrJsonNames; }
        public void setSpecificHeaderCookieParamXmlOrJsonNames(List<SpecificXmlOrJsonNames> specificHeaderCookieParamXmlOrJsonNames) { this.specificHeaderCookieParamXmlOrJsonNames = specificHeaderCookieParamXmlOrJsonNames; }
    }
}
