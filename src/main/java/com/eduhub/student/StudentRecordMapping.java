package com.eduhub.student;

import com.eduhub.domain.Student;
import com.eduhub.isolation.AbstractRecordMapping;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.RowMapper;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps {@link Student} to the {@code students} table.
 */
public class StudentRecordMapping extends AbstractRecordMapping<Student> {
    
    public static final String TABLE = "students";
    
    public StudentRecordMapping(ObjectMapper objectMapper) {
        super(TABLE, Map.of(
            "firstName", "first_name",
            "lastName", "last_name",
            "email", "email",
            "gradeLevel", "grade_level"
        ), objectMapper);
    }
    
    @Override
    public Map<String, Object> toColumns(Student student) {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put(ID_COLUMN, student.getId());
        columns.put(TENANT_COLUMN, student.getTenantId());
        columns.put("first_name", student.getFirstName());
        columns.put("last_name", student.getLastName());
        columns.put("email", student.getEmail());
        columns.put("grade_level", student.getGradeLevel());
        columns.put("custom_fields", writeJson(student.getCustomFields()));
        return columns;
    }
    
    @Override
    public RowMapper<Student> getRowMapper() {
        return (rs, rowNum) -> {
            Student student = new Student(
                rs.getString("first_name"),
                rs.getString("last_name"),
                rs.getString("email"),
                (Integer) rs.getObject("grade_level"));
            student.setId(rs.getString(ID_COLUMN));
            student.setTenantId(rs.getString(TENANT_COLUMN));
            student.setCustomFields(readJson(rs.getString("custom_fields")));
            return student;
        };
    }
}
