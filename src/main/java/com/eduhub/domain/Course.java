package com.eduhub.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A course offered by one institution.
 */
public class Course extends TenantOwnedRecord {
    
    @JsonProperty("code")
    private String code;
    
    @JsonProperty("title")
    private String title;
    
    @JsonProperty("credits")
    private Integer credits;
    
    public Course() {
    }
    
    public Course(String code, String title, Integer credits) {
        this.code = code;
        this.title = title;
        this.credits = credits;
    }
    
    public String getCode() {
        return code;
    }
    
    public void setCode(String code) {
        this.code = code;
    }
    
    public String getTitle() {
        return title;
    }
    
    public void setTitle(String title) {
        this.title = title;
    }
    
    public Integer getCredits() {
        return credits;
    }
    
    public void setCredits(Integer credits) {
        this.credits = credits;
    }
}
