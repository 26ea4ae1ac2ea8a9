package com.eduhub.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A student enrolled at one institution.
 */
public class Student extends TenantOwnedRecord {
    
    @JsonProperty("firstName")
    private String firstName;
    
    @JsonProperty("lastName")
    private String lastName;
    
    @JsonProperty("email")
    private String email;
    
    @JsonProperty("gradeLevel")
    private Integer gradeLevel;
    
    public Student() {
    }
    
    public Student(String firstName, String lastName, String email, Integer gradeLevel) {
        this.firstName = firstName;
        this.lastName = lastName;
        this.email = email;
        this.gradeLevel = gradeLevel;
    }
    
    public String getFirstName() {
        return firstName;
    }
    
    public void setFirstName(String firstName) {
        this.firstName = firstName;
    }
    
    public String getLastName() {
        return lastName;
    }
    
    public void setLastName(String lastName) {
        this.lastName = lastName;
    }
    
    public String getEmail() {
        return email;
    }
    
    public void setEmail(String email) {
        this.email = email;
    }
    
    public Integer getGradeLevel() {
        return gradeLevel;
    }
    
    public void setGradeLevel(Integer gradeLevel) {
        this.gradeLevel = gradeLevel;
    }
    
    @Override
    public String toString() {
        return "Student{" +
                "id='" + getId() + '\'' +
                ", tenantId='" + getTenantId() + '\'' +
                ", gradeLevel=" + gradeLevel +
                '}';
    }
}
