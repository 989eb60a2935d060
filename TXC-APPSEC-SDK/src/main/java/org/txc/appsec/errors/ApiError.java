package org.txc.appsec.errors;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Problem details returned by the Application Security API on failure (application/problem+json).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApiError {
    private String type;
    private String title;
    private String detail;
    private String instance;
    private String behaviorName;
    private String errorLocation;
    private List<ApiError> errors = new ArrayList<>();

    // Taken from the HTTP response, not the body.
    @JsonIgnore
    private int statusCode;

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }
    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }
    public String getDetail() { return detail; }
    public void setDetail(String detail) { this.detail = detail; }
    public String getInstance() { return instance; }
    public void setInstance(String instance) { this.instance = instance; }
    public String getBehaviorName() { return behaviorName; }
    public void setBehaviorName(String behaviorName) { this.behaviorName = behaviorName; }
    public String getErrorLocation() { return errorLocation; }
    public void setErrorLocation(String errorLocation) { this.errorLocation = errorLocation; }
    public List<ApiError> getErrors() { return errors; }
    public void setErrors(List<ApiError> errors) { this.errors = errors; }
    public int getStatusCode() { return statusCode; }
    public void setStatusCode(int statusCode) { this.statusCode = statusCode; }

    @Override
    public String toString() {
        return "Title: " + title + "; Type: " + type + "; Detail: " + detail;
    }
}
